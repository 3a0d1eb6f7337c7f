package org.cachebust.engine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 静态资源索引：一次运行开始时构建的“时间点快照”，构建完成后只读。
 * <p>
 * 两种查找方式：
 * <ul>
 *   <li>按绝对路径精确查找（用于相对引用按引用文件所在目录解析）。</li>
 *   <li>按文件名 + 路径段后缀查找（用于 {@code /static/js/app.js} 这类与部署路径相关的 URL）。</li>
 * </ul>
 * 索引作为显式的值在组件之间传递，不存在全局单例，因此并发的多次运行互不影响。
 */
public final class ResourceIndex {

    private static final Comparator<StaticResource> ROOT_ORDER = Comparator
            .comparingInt(StaticResource::rootOrder)
            .thenComparing(StaticResource::relativePath);

    private final List<StaticResource> resources;
    private final Map<Path, StaticResource> byAbsolutePath;
    // 文件名索引：key 为文件名（区分大小写，URL 本身区分大小写），value 为所有同名资源
    private final Map<String, List<StaticResource>> byFileName;
    // 相对根目录的路径 -> 各根目录下的同路径资源
    private final Map<String, List<StaticResource>> byRelativePath;
    private final List<String> warnings;

    private ResourceIndex(List<StaticResource> resources, List<String> warnings) {
        List<StaticResource> sorted = new ArrayList<>(resources);
        sorted.sort(ROOT_ORDER);
        this.resources = List.copyOf(sorted);

        Map<Path, StaticResource> absolute = new HashMap<>();
        Map<String, List<StaticResource>> names = new HashMap<>();
        Map<String, List<StaticResource>> relatives = new HashMap<>();
        for (StaticResource resource : this.resources) {
            absolute.putIfAbsent(resource.absolutePath(), resource);
            names.computeIfAbsent(resource.fileName(), k -> new ArrayList<>()).add(resource);
            relatives.computeIfAbsent(resource.relativePath(), k -> new ArrayList<>()).add(resource);
        }
        this.byAbsolutePath = Map.copyOf(absolute);
        this.byFileName = freeze(names);
        this.byRelativePath = freeze(relatives);
        this.warnings = List.copyOf(warnings);
    }

    /**
     * 合并各工作线程的私有结果，构建最终索引。
     * <p>
     * 同一根目录内相对路径必须唯一；同一文件被多个根目录覆盖（根目录嵌套）时会出现在多个根目录下，这是允许的。
     */
    public static ResourceIndex merge(Collection<List<StaticResource>> perRoot, List<String> warnings) {
        Map<String, StaticResource> unique = new LinkedHashMap<>();
        for (List<StaticResource> part : perRoot) {
            for (StaticResource resource : part) {
                String key = resource.rootId() + "|" + resource.relativePath();
                if (unique.putIfAbsent(key, resource) != null) {
                    throw new IllegalStateException("静态资源索引中出现重复路径：" + key);
                }
            }
        }
        return new ResourceIndex(new ArrayList<>(unique.values()), warnings);
    }

    private static Map<String, List<StaticResource>> freeze(Map<String, List<StaticResource>> source) {
        Map<String, List<StaticResource>> frozen = new HashMap<>();
        source.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return Map.copyOf(frozen);
    }

    public static ResourceIndex of(List<StaticResource> resources) {
        return merge(List.of(resources), List.of());
    }

    public List<StaticResource> resources() {
        return resources;
    }

    public int size() {
        return resources.size();
    }

    /**
     * 构建索引时产生的非致命告警（不可读文件、跳过的链接目录等）。
     */
    public List<String> warnings() {
        return warnings;
    }

    public StaticResource byAbsolutePath(Path path) {
        if (path == null) {
            return null;
        }
        return byAbsolutePath.get(path.toAbsolutePath().normalize());
    }

    public List<StaticResource> byFileName(String fileName) {
        return byFileName.getOrDefault(fileName, List.of());
    }

    /**
     * 各根目录下相对路径完全相同的资源，按根目录优先级排序。
     */
    public List<StaticResource> byRelativePath(String relativePath) {
        return byRelativePath.getOrDefault(relativePath, List.of());
    }

    /**
     * 查找相对路径以给定段后缀结尾的所有资源，按根目录优先级排序。
     */
    public List<StaticResource> lookupSuffix(String suffix) {
        if (suffix == null || suffix.isEmpty()) {
            return List.of();
        }
        int slash = suffix.lastIndexOf('/');
        String fileName = slash < 0 ? suffix : suffix.substring(slash + 1);
        List<StaticResource> candidates = byFileName(fileName);
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<StaticResource> result = new ArrayList<>(Math.min(candidates.size(), 8));
        for (StaticResource candidate : candidates) {
            if (candidate.endsWithSegments(suffix)) {
                result.add(candidate);
            }
        }
        return result;
    }
}
