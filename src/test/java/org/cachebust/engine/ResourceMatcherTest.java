package org.cachebust.engine;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceMatcherTest {

    private static final Path PROJECT = Path.of("/project");

    private final MarkerSyntax markers = new MarkerSyntax("_cb_");

    @Test
    void match_findsResourceBySegmentSuffix() {
        StaticResource app = resource(0, "static", "js/app.js", "d1");
        ResourceMatcher matcher = matcher(MultibustRules.empty(), app);

        MatchResult result = matcher.match(reference("templates/index.html", "/static/js/app.js", ""));

        assertThat(result).isEqualTo(new MatchResult.SingleMatch(app));
    }

    @Test
    void match_identicalContentInSeveralRootsIsNotAConflict() {
        StaticResource first = resource(0, "static", "app.js", "same");
        StaticResource second = resource(1, "build", "app.js", "same");
        ResourceMatcher matcher = matcher(MultibustRules.empty(), second, first);

        MatchResult result = matcher.match(reference("index.html", "/app.js", ""));

        assertThat(result).isEqualTo(new MatchResult.SingleMatch(first));
    }

    @Test
    void match_reportsAmbiguityWhenContentDiffers() {
        StaticResource first = resource(0, "static", "app.js", "d1");
        StaticResource second = resource(1, "build", "app.js", "d2");
        ResourceMatcher matcher = matcher(MultibustRules.empty(), first, second);

        MatchResult result = matcher.match(reference("index.html", "/app.js", ""));

        assertThat(result).isInstanceOf(MatchResult.Ambiguous.class);
        assertThat(((MatchResult.Ambiguous) result).candidates()).containsExactly(first, second);
        assertThat(result.resources()).isEmpty();
    }

    @Test
    void match_longerSuffixDisambiguates() {
        StaticResource a = resource(0, "static", "a/app.js", "d1");
        StaticResource b = resource(0, "static", "b/app.js", "d2");
        ResourceMatcher matcher = matcher(MultibustRules.empty(), a, b);

        MatchResult result = matcher.match(reference("index.html", "/static/b/app.js", ""));

        assertThat(result).isEqualTo(new MatchResult.SingleMatch(b));
    }

    @Test
    void match_unknownPathIsUnmatched() {
        ResourceMatcher matcher = matcher(MultibustRules.empty(), resource(0, "static", "app.js", "d1"));

        MatchResult result = matcher.match(reference("index.html", "/static/missing.js", ""));

        assertThat(result).isInstanceOf(MatchResult.Unmatched.class);
        assertThat(((MatchResult.Unmatched) result).reason()).contains("/static/missing.js");
    }

    @Test
    void match_ignoresExistingMarkerAndHost() {
        StaticResource app = resource(0, "static", "app.js", "d1");
        ResourceMatcher matcher = matcher(MultibustRules.empty(), app);

        assertThat(matcher.match(reference("index.html", "/static/app_cb_12345678.js", "")))
                .isEqualTo(new MatchResult.SingleMatch(app));
        assertThat(matcher.match(reference("index.html", "https://cdn.example.com/static/app.js", "?_cb_=12345678")))
                .isEqualTo(new MatchResult.SingleMatch(app));
    }

    @Test
    void match_decodesPercentEscapes() {
        StaticResource app = resource(0, "static", "my app.js", "d1");
        ResourceMatcher matcher = matcher(MultibustRules.empty(), app);

        assertThat(matcher.match(reference("index.html", "/static/my%20app.js", "")))
                .isEqualTo(new MatchResult.SingleMatch(app));
    }

    @Test
    void match_relativeReferenceResolvesAgainstReferencingFile() {
        StaticResource direct = resource(0, ".", "img/bg.png", "d1");
        StaticResource other = resource(0, ".", "vendor/img/bg.png", "d2");
        ResourceMatcher matcher = matcher(MultibustRules.empty(), direct, other);

        MatchResult result = matcher.match(reference("css/site.css", "../img/bg.png", ""));

        assertThat(result).isEqualTo(new MatchResult.SingleMatch(direct));
    }

    @Test
    void match_relativeHitConflictsWithSamePathInOtherRoot() {
        StaticResource local = resource(0, "static", "js/app.js", "d1");
        StaticResource built = resource(1, "build", "js/app.js", "d2");
        ResourceMatcher matcher = matcher(MultibustRules.empty(), local, built);

        MatchResult result = matcher.match(reference("static/page.html", "js/app.js", ""));

        assertThat(result).isInstanceOf(MatchResult.Ambiguous.class);
        assertThat(((MatchResult.Ambiguous) result).candidates()).containsExactly(local, built);
    }

    @Test
    void match_relativeHitWithIdenticalCopyInOtherRootStaysSingle() {
        StaticResource local = resource(0, "static", "js/app.js", "same");
        StaticResource built = resource(1, "build", "js/app.js", "same");
        ResourceMatcher matcher = matcher(MultibustRules.empty(), built, local);

        MatchResult result = matcher.match(reference("build/page.html", "js/app.js", ""));

        assertThat(result).isEqualTo(new MatchResult.SingleMatch(built));
    }

    @Test
    void match_nulCharacterInPathIsUnmatched() {
        ResourceMatcher matcher = matcher(MultibustRules.empty(), resource(0, "static", "app.js", "d1"));

        assertThat(matcher.match(reference("index.html", "bad%00.js", ""))).isInstanceOf(MatchResult.Unmatched.class);
        assertThat(matcher.match(reference("index.html", "bad\0.js", ""))).isInstanceOf(MatchResult.Unmatched.class);
    }

    @Test
    void match_multibustFansOutAndRecordsMissingVariants() {
        StaticResource en = resource(0, "static", "i18n_en.png", "a");
        StaticResource de = resource(0, "static", "i18n_de.png", "b");
        MultibustRules rules = MultibustRules.from(Map.of("{{lang}}", List.of("en", "de", "fr")));
        ResourceMatcher matcher = matcher(rules, en, de);

        MatchResult result = matcher.match(reference("index.html", "/static/i18n_{{lang}}.png", ""));

        assertThat(result).isInstanceOf(MatchResult.MultiMatch.class);
        MatchResult.MultiMatch multi = (MatchResult.MultiMatch) result;
        assertThat(multi.byVariant()).containsExactly(Map.entry("en", en), Map.entry("de", de));
        assertThat(multi.missingVariants()).containsExactly("fr");
        assertThat(result.resources()).containsExactly(en, de);
    }

    @Test
    void match_multibustWithConflictingVariantIsAmbiguous() {
        StaticResource en = resource(0, "static", "i18n_en.png", "a");
        StaticResource enOther = resource(1, "build", "i18n_en.png", "x");
        StaticResource de = resource(0, "static", "i18n_de.png", "b");
        MultibustRules rules = MultibustRules.from(Map.of("{{lang}}", List.of("en", "de")));
        ResourceMatcher matcher = matcher(rules, en, enOther, de);

        MatchResult result = matcher.match(reference("index.html", "/i18n_{{lang}}.png", ""));

        assertThat(result).isInstanceOf(MatchResult.Ambiguous.class);
    }

    @Test
    void match_multibustWithoutAnyVariantIsUnmatched() {
        MultibustRules rules = MultibustRules.from(Map.of("{{lang}}", List.of("en", "de")));
        ResourceMatcher matcher = matcher(rules, resource(0, "static", "app.js", "d1"));

        assertThat(matcher.match(reference("index.html", "/static/i18n_{{lang}}.png", "")))
                .isInstanceOf(MatchResult.Unmatched.class);
    }

    @Test
    void match_unconfiguredPlaceholderIsUnmatched() {
        ResourceMatcher matcher = matcher(MultibustRules.empty(), resource(0, "static", "logo.png", "d1"));

        MatchResult result = matcher.match(reference("index.html", "/static/{{ theme }}/logo.png", ""));

        assertThat(result).isInstanceOf(MatchResult.Unmatched.class);
        assertThat(((MatchResult.Unmatched) result).reason()).contains("{{ theme }}");
    }

    @Test
    void normalizeSegments_collapsesDotsAndEmptySegments() {
        assertThat(ResourceMatcher.normalizeSegments("/static/./js//../css/site.css")).containsExactly("static", "css", "site.css");
        assertThat(ResourceMatcher.normalizeSegments("../../img/a.png")).containsExactly("img", "a.png");
    }

    private ResourceMatcher matcher(MultibustRules rules, StaticResource... resources) {
        return new ResourceMatcher(ResourceIndex.of(List.of(resources)), new MultibustExpander(rules), markers, StandardCharsets.UTF_8);
    }

    private static StaticResource resource(int rootOrder, String root, String relativePath, String digest) {
        Path rootPath = ".".equals(root) ? PROJECT : PROJECT.resolve(root);
        Path absolute = rootPath.resolve(relativePath);
        String display = PROJECT.relativize(absolute).toString();
        return new StaticResource(rootOrder, "static" + rootOrder, relativePath, absolute, display, 1, 1000L, digest);
    }

    private Reference reference(String sourceFile, String path, String query) {
        String literal = path + query;
        return new Reference(
                PROJECT.resolve(sourceFile),
                sourceFile,
                0,
                literal.length(),
                1,
                literal,
                path,
                query,
                "",
                markers.find(path, query)
        );
    }
}
