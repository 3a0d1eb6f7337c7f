package org.cachebust.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceScannerTest {

    @TempDir
    Path project;

    @Test
    void scan_reportsByteOffsetsAndLineNumbers() throws Exception {
        String html = "<h1>日本語</h1>\n<p>\n<script src=\"/static/app.js?_cb_=abcd1234\"></script>\n";
        Files.writeString(project.resolve("index.html"), html, StandardCharsets.UTF_8);

        ReferenceScanner.ScanResult result = scan(properties());

        assertThat(result.references()).hasSize(1);
        Reference reference = result.references().get(0);
        byte[] bytes = html.getBytes(StandardCharsets.UTF_8);
        String literal = new String(bytes, reference.start(), reference.end() - reference.start(), StandardCharsets.UTF_8);
        assertThat(literal).isEqualTo("/static/app.js?_cb_=abcd1234");
        assertThat(reference.line()).isEqualTo(3);
        assertThat(reference.displayPath()).isEqualTo("index.html");
        assertThat(reference.marker()).isEqualTo(new CachebustMarker(MarkerStyle.QUERY, "abcd1234"));
    }

    @Test
    void scan_skipsBinaryAndOversizedFiles() throws Exception {
        Files.write(project.resolve("blob.txt"), new byte[]{'a', 0, '/', 'x', '.', 'j', 's'});
        Files.writeString(project.resolve("big.html"), "<img src='/a.png'>" + " ".repeat(2048), StandardCharsets.UTF_8);
        Files.writeString(project.resolve("small.html"), "<img src='/a.png'>", StandardCharsets.UTF_8);
        CachebustProperties properties = properties();
        properties.setMaxFileSize(DataSize.ofKilobytes(1));

        ReferenceScanner.ScanResult result = scan(properties);

        assertThat(result.references()).extracting(Reference::displayPath).containsExactly("small.html");
        assertThat(result.skippedFiles()).isEqualTo(2);
        assertThat(result.warnings()).anyMatch(w -> w.contains("blob.txt")).anyMatch(w -> w.contains("big.html"));
    }

    @Test
    void scan_doesNotDescendIntoIgnoredDirectories() throws Exception {
        Files.createDirectories(project.resolve("node_modules/pkg"));
        Files.writeString(project.resolve("node_modules/pkg/readme.md"), "see /dist/pkg.js", StandardCharsets.UTF_8);
        Files.writeString(project.resolve("readme.md"), "see /dist/app.js", StandardCharsets.UTF_8);

        ReferenceScanner.ScanResult result = scan(properties());

        assertThat(result.references()).extracting(Reference::path).containsExactly("/dist/app.js");
    }

    @Test
    void scan_nestedCodeDirectoriesScanEachFileOnce() throws Exception {
        Files.createDirectories(project.resolve("templates"));
        Files.writeString(project.resolve("templates/page.html"), "<img src='/a.png'>", StandardCharsets.UTF_8);
        CachebustProperties properties = properties();
        properties.setCodeDirs(List.of(".", "templates"));

        ReferenceScanner.ScanResult result = scan(properties);

        assertThat(result.scannedFiles()).isEqualTo(1);
        assertThat(result.references()).hasSize(1);
    }

    @Test
    void scan_skipsFilesMatchingCodeExcludeGlobs() throws Exception {
        Files.createDirectories(project.resolve("vendor"));
        Files.writeString(project.resolve("vendor/jquery.min.js"), "load('/img/b.png')", StandardCharsets.UTF_8);
        Files.writeString(project.resolve("vendor/plugin.js"), "load('/img/c.png')", StandardCharsets.UTF_8);
        Files.writeString(project.resolve("app.js"), "load('/img/a.png')", StandardCharsets.UTF_8);
        CachebustProperties properties = properties();
        properties.setCodeExclude(List.of("*.min.js", "vendor/plugin.js"));

        ReferenceScanner.ScanResult result = scan(properties);

        assertThat(result.scannedFiles()).isEqualTo(1);
        assertThat(result.references()).extracting(Reference::path).containsExactly("/img/a.png");
    }

    @Test
    void isBinary_looksForNulBytes() {
        assertThat(ReferenceScanner.isBinary("plain text".getBytes(StandardCharsets.UTF_8))).isFalse();
        assertThat(ReferenceScanner.isBinary(new byte[]{'a', 0})).isTrue();
    }

    private CachebustProperties properties() {
        CachebustProperties properties = new CachebustProperties();
        properties.setProjectDir(project.toString());
        return properties;
    }

    private ReferenceScanner.ScanResult scan(CachebustProperties properties) {
        ProjectPathResolver resolver = new ProjectPathResolver(properties);
        ProjectWalker walker = new ProjectWalker(resolver, false);
        ScanRule rule = new ScanRule(properties.getDelimiters(), resolver.staticExtensions(), List.of());
        ReferenceScanner scanner = new ReferenceScanner(resolver, walker, rule, new MarkerSyntax("_cb_"),
                properties.getMaxFileSize().toBytes(), properties.getMaxWarnings());
        ExecutorService executor = CachebustEngine.newExecutor(2);
        try {
            return scanner.scan(executor);
        } finally {
            executor.shutdownNow();
        }
    }
}
