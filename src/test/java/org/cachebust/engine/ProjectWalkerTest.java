package org.cachebust.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ProjectWalkerTest {

    @TempDir
    Path project;

    @Test
    void walk_followingLinksVisitsEachRealDirectoryOnce() throws Exception {
        write("a/file.txt", "content");
        link(project.resolve("a/loop"), project);
        link(project.resolve("b"), project.resolve("a"));
        LimitedWarnings warnings = new LimitedWarnings(50);
        List<String> visited = new ArrayList<>();

        int count = walker(true).walk(project, (file, attrs) -> visited.add(file.getFileName().toString()), warnings);

        assertThat(count).isEqualTo(1);
        assertThat(visited).containsExactly("file.txt");
        assertThat(warnings.toList()).anyMatch(w -> w.contains("检测到符号链接循环"));
        assertThat(warnings.toList()).anyMatch(w -> w.contains("疑似存在循环引用"));
    }

    @Test
    void walk_withoutFollowingSkipsLinksAndReportsThem() throws Exception {
        write("a/file.txt", "content");
        link(project.resolve("b"), project.resolve("a"));
        LimitedWarnings warnings = new LimitedWarnings(50);
        List<Path> visited = new ArrayList<>();

        int count = walker(false).walk(project, (file, attrs) -> visited.add(file), warnings);

        assertThat(count).isEqualTo(1);
        assertThat(visited).containsExactly(project.resolve("a/file.txt"));
        assertThat(warnings.toList()).anyMatch(w -> w.contains("已跳过符号链接") && w.contains("b"));
    }

    @Test
    void walk_reportsUnreadableDirectoryAndContinues() throws Exception {
        write("open/file.txt", "content");
        Path locked = Files.createDirectories(project.resolve("locked"));
        write("locked/hidden.txt", "secret");
        try {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        } catch (UnsupportedOperationException e) {
            assumeTrue(false, "文件系统不支持 POSIX 权限");
        }
        try {
            assumeFalse(Files.isReadable(locked), "当前用户无视目录权限（例如 root）");
            LimitedWarnings warnings = new LimitedWarnings(50);
            List<String> visited = new ArrayList<>();

            int count = walker(false).walk(project, (file, attrs) -> visited.add(file.getFileName().toString()), warnings);

            assertThat(count).isEqualTo(1);
            assertThat(visited).containsExactly("file.txt");
            assertThat(warnings.toList()).anyMatch(w -> w.startsWith("访问失败") && w.contains("locked"));
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    void walk_skipsIgnoredDirectories() throws Exception {
        write("node_modules/pkg/index.js", "module");
        write("src/app.js", "app");
        List<String> visited = new ArrayList<>();

        walker(false).walk(project, (file, attrs) -> visited.add(file.getFileName().toString()), new LimitedWarnings(50));

        assertThat(visited).containsExactly("app.js");
    }

    private ProjectWalker walker(boolean followSymlinks) {
        CachebustProperties properties = new CachebustProperties();
        properties.setProjectDir(project.toString());
        return new ProjectWalker(new ProjectPathResolver(properties), followSymlinks);
    }

    private static void link(Path link, Path target) {
        try {
            Files.createSymbolicLink(link, target);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "无法创建符号链接：" + e.getMessage());
        }
    }

    private void write(String relative, String content) throws IOException {
        Path file = project.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}
