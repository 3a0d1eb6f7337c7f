package org.cachebust.engine;

import org.cachebust.engine.dto.CachebustReport;
import org.cachebust.engine.dto.FilePatchStatus;
import org.cachebust.engine.dto.ReferenceOutcome;
import org.cachebust.engine.dto.ReferenceReport;
import org.cachebust.engine.dto.RewriteAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CachebustEngineTest {

    private static final String INDEX = """
            <!doctype html>
            <link rel="stylesheet" href="/static/css/site.css">
            <script src="/static/js/app.js?_cb_=00000000"></script>
            <img src="/static/img/i18n_{{lang}}.png" alt="中文">
            <img src="/static/img/missing.png">
            """;

    @TempDir
    Path project;

    private Path index;

    @BeforeEach
    void setUp() throws Exception {
        write("static/css/site.css", "body { color: red }");
        write("static/js/app.js", "console.log('app');");
        write("static/img/i18n_en.png", "english");
        write("static/img/i18n_de.png", "deutsch");
        index = write("templates/index.html", INDEX);
    }

    @Test
    void scan_reportsWithoutTouchingFiles() throws Exception {
        CachebustReport report = engine(properties()).run(RunMode.SCAN, null, null);

        assertThat(report.staticResources()).isEqualTo(4);
        assertThat(report.scannedFiles()).isEqualTo(1);
        assertThat(report.references()).extracting(ReferenceReport::outcome).containsExactly(
                ReferenceOutcome.MATCHED, ReferenceOutcome.STALE, ReferenceOutcome.MATCHED, ReferenceOutcome.UNMATCHED);
        assertThat(report.references()).extracting(ReferenceReport::action).containsOnly(RewriteAction.LEAVE);
        assertThat(report.files()).isEmpty();
        assertThat(report.hasProblems()).isTrue();
        assertThat(read()).isEqualTo(INDEX);
    }

    @Test
    void rewrite_insertsAndUpdatesThenBecomesIdempotent() throws Exception {
        CachebustEngine engine = engine(properties());

        CachebustReport first = engine.run(RunMode.REWRITE, false, null);

        assertThat(first.inserted()).isEqualTo(2);
        assertThat(first.updated()).isEqualTo(1);
        assertThat(first.unmatched()).isEqualTo(1);
        assertThat(first.files()).singleElement().extracting(f -> f.status()).isEqualTo(FilePatchStatus.WRITTEN);
        String rewritten = read();
        assertThat(rewritten)
                .containsPattern("href=\"/static/css/site\\.css\\?_cb_=[0-9a-f]{8}\"")
                .containsPattern("src=\"/static/js/app\\.js\\?_cb_=[0-9a-f]{8}\"")
                .containsPattern("src=\"/static/img/i18n_\\{\\{lang}}\\.png\\?_cb_=[0-9a-f]{8}\" alt=\"中文\"")
                .contains("<img src=\"/static/img/missing.png\">")
                .doesNotContain("_cb_=00000000");

        CachebustReport update = engine.run(RunMode.UPDATE, false, null);
        CachebustReport again = engine.run(RunMode.REWRITE, false, null);

        assertThat(update.files()).isEmpty();
        assertThat(update.current()).isEqualTo(3);
        assertThat(again.files()).isEmpty();
        assertThat(again.inserted() + again.updated()).isZero();
        assertThat(read()).isEqualTo(rewritten);
    }

    @Test
    void rewrite_preservesBytesOutsideEditedSpans() throws Exception {
        CachebustReport report = engine(properties()).run(RunMode.REWRITE, false, null);

        String expected = INDEX;
        for (ReferenceReport reference : report.references()) {
            if (reference.replacement() != null) {
                expected = expected.replace(reference.literal(), reference.replacement());
            }
        }
        assertThat(read()).isEqualTo(expected);
    }

    @Test
    void update_onlyRefreshesExistingMarkers() throws Exception {
        CachebustReport report = engine(properties()).run(RunMode.UPDATE, false, null);

        assertThat(report.inserted()).isZero();
        assertThat(report.updated()).isEqualTo(1);
        assertThat(read())
                .contains("href=\"/static/css/site.css\"")
                .contains("src=\"/static/img/i18n_{{lang}}.png\"")
                .doesNotContain("_cb_=00000000");
    }

    @Test
    void update_afterContentChangeRewritesOnlyAffectedReference() throws Exception {
        CachebustEngine engine = engine(properties());
        engine.run(RunMode.REWRITE, false, null);
        String before = read();

        Path de = project.resolve("static/img/i18n_de.png");
        FileTime modified = Files.getLastModifiedTime(de);
        Files.writeString(de, "deutsch!", StandardCharsets.UTF_8);
        Files.setLastModifiedTime(de, modified);

        CachebustReport report = engine.run(RunMode.UPDATE, false, null);

        assertThat(report.updated()).isEqualTo(1);
        ReferenceReport multibust = report.references().get(2);
        assertThat(multibust.action()).isEqualTo(RewriteAction.UPDATE);
        assertThat(multibust.resources()).containsExactly("static/img/i18n_en.png", "static/img/i18n_de.png");
        assertThat(read()).isNotEqualTo(before);
        assertThat(lines(read()).get(1)).isEqualTo(lines(before).get(1));
        assertThat(lines(read()).get(2)).isEqualTo(lines(before).get(2));
    }

    @Test
    void update_afterModificationTimeChangeRewritesOnlyAffectedReference() throws Exception {
        CachebustEngine engine = engine(properties());
        engine.run(RunMode.REWRITE, false, null);
        String before = read();

        Path css = project.resolve("static/css/site.css");
        Files.setLastModifiedTime(css, FileTime.fromMillis(Files.getLastModifiedTime(css).toMillis() + 60_000));

        CachebustReport report = engine.run(RunMode.UPDATE, false, null);

        assertThat(report.updated()).isEqualTo(1);
        assertThat(report.references().get(0).outcome()).isEqualTo(ReferenceOutcome.STALE);
        assertThat(lines(read()).get(1)).isNotEqualTo(lines(before).get(1));
        assertThat(lines(read()).get(2)).isEqualTo(lines(before).get(2));
    }

    @Test
    void rewrite_dryRunPreviewsWithoutWriting() throws Exception {
        CachebustReport report = engine(properties()).run(RunMode.REWRITE, true, null);

        assertThat(report.dryRun()).isTrue();
        assertThat(report.files()).singleElement().satisfies(file -> {
            assertThat(file.status()).isEqualTo(FilePatchStatus.PREVIEW);
            assertThat(file.path()).isEqualTo("templates/index.html");
            assertThat(file.diff()).contains("+<link rel=\"stylesheet\" href=\"/static/css/site.css?_cb_=");
        });
        assertThat(read()).isEqualTo(INDEX);
    }

    @Test
    void rewrite_usesRequestedMarkerStyle() throws Exception {
        engine(properties()).run(RunMode.REWRITE, false, MarkerStyle.FILENAME);

        assertThat(read())
                .containsPattern("href=\"/static/css/site_cb_[0-9a-f]{8}\\.css\"")
                .containsPattern("src=\"/static/js/app_cb_[0-9a-f]{8}\\.js\"")
                .doesNotContain("?_cb_=");
    }

    @Test
    void rewrite_leavesAmbiguousReferenceUntouched() throws Exception {
        write("build/js/app.js", "console.log('other build');");
        CachebustProperties properties = properties();
        properties.setStaticDirs(List.of("static", "build"));

        CachebustReport report = engine(properties).run(RunMode.REWRITE, false, null);

        ReferenceReport app = report.references().get(1);
        assertThat(app.outcome()).isEqualTo(ReferenceOutcome.AMBIGUOUS);
        assertThat(app.action()).isEqualTo(RewriteAction.LEAVE);
        assertThat(app.resources()).containsExactly("static/js/app.js", "build/js/app.js");
        assertThat(report.ambiguous()).isEqualTo(1);
        assertThat(read()).contains("src=\"/static/js/app.js?_cb_=00000000\"");
    }

    @Test
    void rewrite_relativeReferenceWithConflictingCopyInOtherRootIsAmbiguous() throws Exception {
        write("build/js/app.js", "console.log('other build');");
        Path page = write("static/page.html", "<script src=\"js/app.js\"></script>\n");
        CachebustProperties properties = properties();
        properties.setStaticDirs(List.of("static", "build"));
        properties.setCodeDirs(List.of("static"));

        CachebustReport report = engine(properties).run(RunMode.REWRITE, false, null);

        ReferenceReport app = report.references().stream()
                .filter(r -> r.path().equals("static/page.html"))
                .findFirst()
                .orElseThrow();
        assertThat(app.outcome()).isEqualTo(ReferenceOutcome.AMBIGUOUS);
        assertThat(app.action()).isEqualTo(RewriteAction.LEAVE);
        assertThat(app.resources()).containsExactly("static/js/app.js", "build/js/app.js");
        assertThat(Files.readString(page, StandardCharsets.UTF_8)).isEqualTo("<script src=\"js/app.js\"></script>\n");
    }

    @Test
    void scan_invalidPathCharacterDoesNotAbortRun() throws Exception {
        write("templates/broken.html", "<script src=\"app.js\"></script>\n<a href=\"bad%00.js\">x</a>\n");

        CachebustReport report = engine(properties()).run(RunMode.SCAN, null, null);

        List<ReferenceReport> broken = report.references().stream()
                .filter(r -> r.path().equals("templates/broken.html"))
                .toList();
        assertThat(broken).extracting(ReferenceReport::literal).containsExactly("app.js", "bad%00.js");
        assertThat(broken).extracting(ReferenceReport::outcome).containsExactly(ReferenceOutcome.MATCHED, ReferenceOutcome.UNMATCHED);
        assertThat(report.references()).hasSize(6);
    }

    @Test
    void scan_excludedStaticFilesAreNotIndexed() throws Exception {
        CachebustProperties properties = properties();
        properties.setStaticExclude(List.of("*_de.png"));

        CachebustReport report = engine(properties).run(RunMode.SCAN, null, null);

        assertThat(report.staticResources()).isEqualTo(3);
        ReferenceReport multibust = report.references().get(2);
        assertThat(multibust.outcome()).isEqualTo(ReferenceOutcome.MATCHED);
        assertThat(multibust.resources()).containsExactly("static/img/i18n_en.png");
        assertThat(multibust.detail()).contains("de");
    }

    @Test
    void run_rejectsInitMode() {
        CachebustEngine engine = engine(properties());

        assertThatThrownBy(() -> engine.run(RunMode.INIT, null, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolver_rejectsMissingStaticDirectory() {
        CachebustProperties properties = properties();
        properties.setStaticDirs(List.of("does-not-exist"));

        assertThatThrownBy(() -> new ProjectPathResolver(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("static-dirs");
    }

    private CachebustProperties properties() {
        CachebustProperties properties = new CachebustProperties();
        properties.setProjectDir(project.toString());
        properties.setStaticDirs(List.of("static"));
        properties.setCodeDirs(List.of("templates"));
        properties.setCodeFiletypes(List.of("html"));
        Map<String, List<String>> multibust = new LinkedHashMap<>();
        multibust.put("{{lang}}", List.of("en", "de"));
        properties.setMultibust(multibust);
        properties.setWorkerThreads(2);
        return properties;
    }

    private static CachebustEngine engine(CachebustProperties properties) {
        return new CachebustEngine(
                properties,
                new ProjectPathResolver(properties),
                MultibustRules.from(properties.getMultibust()),
                new TokenGenerator(properties.getHashFunction(), properties.getHashLength())
        );
    }

    private Path write(String relative, String content) throws Exception {
        Path file = project.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private String read() throws Exception {
        return Files.readString(index, StandardCharsets.UTF_8);
    }

    private static List<String> lines(String text) {
        return List.of(text.split("\n"));
    }
}
