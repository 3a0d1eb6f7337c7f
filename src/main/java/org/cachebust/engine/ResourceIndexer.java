package org.cachebust.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 静态资源索引构建器。
 * <p>
 * 每个静态根目录由一个工作线程遍历，线程内计算摘要并写入私有结果；全部完成后一次性合并为 {@link ResourceIndex}。
 * 索引构建是一个同步屏障：{@link #build(ExecutorService)} 返回之前不会开始任何匹配。
 */
public class ResourceIndexer {

    private static final Logger log = LoggerFactory.getLogger(ResourceIndexer.class);

    private final ProjectPathResolver resolver;
    private final ProjectWalker walker;
    private final String hashFunction;
    private final int maxWarnings;

    public ResourceIndexer(ProjectPathResolver resolver, ProjectWalker walker, String hashFunction, int maxWarnings) {
        this.resolver = resolver;
        this.walker = walker;
        this.hashFunction = HashingUtils.normalizeAlgorithm(hashFunction);
        this.maxWarnings = maxWarnings;
    }

    public ResourceIndex build(ExecutorService executor) {
        List<Future<RootScan>> futures = new ArrayList<>();
        for (ProjectPathResolver.SearchRoot root : resolver.staticRoots()) {
            futures.add(executor.submit(() -> indexRoot(root)));
        }

        List<List<StaticResource>> parts = new ArrayList<>(futures.size());
        LimitedWarnings warnings = new LimitedWarnings(maxWarnings);
        for (Future<RootScan> future : futures) {
            RootScan scan = await(future);
            parts.add(scan.resources());
            warnings.addAll(scan.warnings());
        }
        ResourceIndex index = ResourceIndex.merge(parts, warnings.toList());
        log.info("静态资源索引完成：{} 个根目录，{} 个文件", parts.size(), index.size());
        return index;
    }

    private RootScan indexRoot(ProjectPathResolver.SearchRoot root) {
        List<StaticResource> resources = new ArrayList<>();
        LimitedWarnings warnings = new LimitedWarnings(maxWarnings);
        walker.walk(root.path(), (file, attrs) -> {
            if (!resolver.isStaticFile(file)) {
                return;
            }
            StaticResource resource = describe(root, file, attrs, warnings);
            if (resource != null) {
                resources.add(resource);
            }
        }, warnings);
        log.debug("根目录 {}（{}）索引到 {} 个静态资源", root.id(), root.displayPath(), resources.size());
        return new RootScan(resources, warnings);
    }

    private StaticResource describe(ProjectPathResolver.SearchRoot root, Path file, BasicFileAttributes attrs, LimitedWarnings warnings) {
        Path absolute = file.toAbsolutePath().normalize();
        String relative = root.path().relativize(absolute).toString().replace('\\', '/');
        try {
            // 摘要每次运行都重新计算，不跨运行缓存
            String digest = HashingUtils.digestHex(hashFunction, absolute);
            return new StaticResource(
                    root.order(),
                    root.id(),
                    relative,
                    absolute,
                    resolver.displayPath(absolute),
                    attrs.size(),
                    attrs.lastModifiedTime().toMillis(),
                    digest
            );
        } catch (IOException e) {
            log.warn("静态资源无法读取，已跳过：{}", resolver.displayPath(absolute), e);
            warnings.add("静态资源无法读取，已跳过：" + resolver.displayPath(absolute) + "（" + e.getMessage() + "）");
            return null;
        }
    }

    static <T> T await(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IllegalStateException("运行被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("工作线程执行失败：" + cause.getMessage(), cause);
        }
    }

    private record RootScan(List<StaticResource> resources, LimitedWarnings warnings) {
    }
}
