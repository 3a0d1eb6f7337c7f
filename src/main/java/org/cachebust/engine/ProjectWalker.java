package org.cachebust.engine;

import java.io.IOException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * 目录遍历器：静态资源索引、引用扫描与 init 共用的递归遍历规则。
 * <p>
 * 规则：
 * <ul>
 *   <li>命中 {@code app.cachebust.ignore-dirs} 的目录整棵跳过。</li>
 *   <li>未开启 {@code follow-symlinks} 时跳过符号链接；开启时按真实路径去重，每个真实目录最多访问一次（防止循环）。</li>
 *   <li>访问失败的文件/目录只记录告警，不中断遍历。</li>
 * </ul>
 */
public class ProjectWalker {

    private final ProjectPathResolver resolver;
    private final boolean followSymlinks;

    public ProjectWalker(ProjectPathResolver resolver, boolean followSymlinks) {
        this.resolver = resolver;
        this.followSymlinks = followSymlinks;
    }

    @FunctionalInterface
    public interface FileHandler {
        void accept(Path file, BasicFileAttributes attrs);
    }

    /**
     * 递归遍历 {@code base}，对每个普通文件调用 {@code handler}。
     *
     * @return 访问到的普通文件数
     */
    public int walk(Path base, FileHandler handler, LimitedWarnings warnings) {
        Set<Path> visitedRealDirs = new HashSet<>();
        int[] files = new int[]{0};
        EnumSet<FileVisitOption> options = followSymlinks
                ? EnumSet.of(FileVisitOption.FOLLOW_LINKS)
                : EnumSet.noneOf(FileVisitOption.class);
        try {
            Files.walkFileTree(base, options, Integer.MAX_VALUE, new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(base) && resolver.isIgnoredDirectory(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    Path real;
                    try {
                        real = dir.toRealPath();
                    } catch (IOException e) {
                        warnings.add("目录无法解析，已跳过：" + resolver.displayPath(dir) + "（" + e.getMessage() + "）");
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (!visitedRealDirs.add(real)) {
                        warnings.add("疑似存在循环引用，已跳过目录：" + resolver.displayPath(dir));
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isSymbolicLink()) {
                        warnings.add("已跳过符号链接：" + resolver.displayPath(file));
                        return FileVisitResult.CONTINUE;
                    }
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    files[0]++;
                    handler.accept(file, attrs);
                    if (Thread.currentThread().isInterrupted()) {
                        return FileVisitResult.TERMINATE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    if (exc instanceof FileSystemLoopException) {
                        warnings.add("检测到符号链接循环，已跳过：" + resolver.displayPath(file));
                    } else {
                        warnings.add("访问失败：" + resolver.displayPath(file) + "（" + exc.getMessage() + "）");
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new IllegalStateException("遍历目录失败：" + resolver.displayPath(base), e);
        }
        return files[0];
    }
}
