package org.cachebust.engine;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 项目路径解析器：把配置中的相对目录解析成受控的绝对路径，并提供目录忽略/扩展名过滤规则。
 * <p>
 * 设计目标：
 * <ul>
 *   <li>所有 static/code 目录都相对 {@code app.cachebust.project-dir} 解析，且不允许逃逸出项目目录。</li>
 *   <li>目录缺失属于致命配置错误，在任何扫描开始之前抛出。</li>
 *   <li>对外展示的路径统一为相对项目根目录、使用 / 分隔的形式。</li>
 * </ul>
 */
public class ProjectPathResolver {

    private final Path projectDir;
    private final List<SearchRoot> staticRoots;
    private final List<SearchRoot> codeRoots;
    private final Set<String> staticExtensions;
    private final Set<String> codeExtensions;
    private final List<PathMatcher> ignoreMatchers;
    private final List<PathMatcher> staticExcludeMatchers;
    private final List<PathMatcher> codeExcludeMatchers;

    public ProjectPathResolver(CachebustProperties properties) {
        this.projectDir = resolveProjectDir(properties.getProjectDir());
        this.staticRoots = resolveRoots("app.cachebust.static-dirs", properties.getStaticDirs(), "static");
        this.codeRoots = resolveRoots("app.cachebust.code-dirs", properties.getCodeDirs(), "code");
        this.staticExtensions = normalizeExtensions(properties.getStaticFiletypes());
        this.codeExtensions = normalizeExtensions(properties.getCodeFiletypes());
        this.ignoreMatchers = compileGlobs(properties.getIgnoreDirs());
        this.staticExcludeMatchers = compileGlobs(properties.getStaticExclude());
        this.codeExcludeMatchers = compileGlobs(properties.getCodeExclude());
    }

    public Path projectDir() {
        return projectDir;
    }

    /**
     * 静态资源根目录（顺序即查找优先级）。
     */
    public List<SearchRoot> staticRoots() {
        return staticRoots;
    }

    public List<SearchRoot> codeRoots() {
        return codeRoots;
    }

    public boolean isStaticFile(Path file) {
        return staticExtensions.contains(extension(file)) && !matchesAny(staticExcludeMatchers, file);
    }

    public boolean isCodeFile(Path file) {
        return codeExtensions.contains(extension(file)) && !matchesAny(codeExcludeMatchers, file);
    }

    public Set<String> staticExtensions() {
        return staticExtensions;
    }

    /**
     * 目录是否应被跳过：glob 既匹配目录名，也匹配相对项目根目录的路径。
     */
    public boolean isIgnoredDirectory(Path dir) {
        return matchesAny(ignoreMatchers, dir);
    }

    /**
     * glob 既匹配文件/目录名，也匹配相对项目根目录的路径。
     */
    private boolean matchesAny(List<PathMatcher> matchers, Path path) {
        if (matchers.isEmpty()) {
            return false;
        }
        Path name = path.getFileName();
        Path relative = relativeToProject(path);
        for (PathMatcher matcher : matchers) {
            if (name != null && matcher.matches(name)) {
                return true;
            }
            if (relative != null && matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 相对项目根目录的展示路径（统一使用 / 分隔；项目根目录本身为 "."）。
     */
    public String displayPath(Path path) {
        Path relative = relativeToProject(path);
        if (relative == null) {
            return path.toString().replace('\\', '/');
        }
        String text = relative.toString().replace('\\', '/');
        return text.isEmpty() ? "." : text;
    }

    /**
     * 把一个可能位于项目目录之外的路径规范化，越界时抛出异常。
     */
    public Path requireWithinProject(String configKey, String value) {
        Path path = projectDir.resolve(value).toAbsolutePath().normalize();
        if (!path.startsWith(projectDir)) {
            throw new IllegalStateException("配置项 " + configKey + " 指向项目目录之外：" + value);
        }
        return path;
    }

    private Path relativeToProject(Path path) {
        try {
            Path absolute = path.toAbsolutePath().normalize();
            if (!absolute.startsWith(projectDir)) {
                return null;
            }
            return projectDir.relativize(absolute);
        } catch (Exception e) {
            return null;
        }
    }

    private List<SearchRoot> resolveRoots(String configKey, List<String> configured, String kind) {
        if (configured == null || configured.isEmpty()) {
            throw new IllegalStateException("未配置目录（" + configKey + "）");
        }
        List<SearchRoot> result = new ArrayList<>(configured.size());
        Set<Path> seen = new LinkedHashSet<>();
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 " + configKey + "[" + i + "] 不能为空");
            Path path = requireWithinProject(configKey + "[" + i + "]", value.trim());
            if (!Files.isDirectory(path)) {
                throw new IllegalStateException("配置项 " + configKey + "[" + i + "] 不是已存在的目录：" + path);
            }
            if (!seen.add(path)) {
                throw new IllegalStateException("配置项 " + configKey + " 中存在重复目录：" + value);
            }
            result.add(new SearchRoot(result.size(), kind + result.size(), path, displayPath(path)));
        }
        return List.copyOf(result);
    }

    private static Path resolveProjectDir(String projectDir) {
        Path path = Path.of(projectDir == null || projectDir.isBlank() ? "." : projectDir).toAbsolutePath().normalize();
        if (!Files.isDirectory(path)) {
            throw new IllegalStateException("项目目录不存在或不是目录（app.cachebust.project-dir）：" + path);
        }
        try {
            // 统一使用真实路径，保证后续 startsWith 比较与 walkFileTree 产生的路径一致
            return path.toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("项目目录无法解析：" + path, e);
        }
    }

    private static Set<String> normalizeExtensions(List<String> configured) {
        Set<String> result = new LinkedHashSet<>();
        if (configured == null) {
            return result;
        }
        for (String ext : configured) {
            if (ext == null || ext.isBlank()) {
                continue;
            }
            String normalized = ext.trim().toLowerCase(Locale.ROOT);
            while (normalized.startsWith(".") || normalized.startsWith("*")) {
                normalized = normalized.substring(1);
            }
            if (!normalized.isEmpty()) {
                result.add(normalized);
            }
        }
        return Set.copyOf(result);
    }

    private static List<PathMatcher> compileGlobs(List<String> globs) {
        if (globs == null || globs.isEmpty()) {
            return List.of();
        }
        List<PathMatcher> result = new ArrayList<>(globs.size());
        for (String glob : globs) {
            if (glob == null || glob.isBlank()) {
                continue;
            }
            result.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.trim()));
        }
        return List.copyOf(result);
    }

    static String extension(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String text = name.toString();
        int dot = text.lastIndexOf('.');
        if (dot < 0 || dot == text.length() - 1) {
            return "";
        }
        return text.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * 一个已解析的根目录。
     *
     * @param order       配置中的顺序（0-based，越小优先级越高）
     * @param id          根目录标识（static0、code1...）
     * @param path        绝对路径
     * @param displayPath 相对项目根目录的展示路径
     */
    public record SearchRoot(int order, String id, Path path, String displayPath) {
    }
}
