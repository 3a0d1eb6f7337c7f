package org.cachebust.engine;

import org.cachebust.engine.dto.InitReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;

/**
 * 项目初始化：扫描整个项目目录，推断 static/code 目录并生成 {@code cachebust.properties}。
 * <p>
 * 推断规则：
 * <ul>
 *   <li>整个项目同时作为静态资源根目录与代码目录扫描一遍。</li>
 *   <li>每个匹配成功的引用，其所在文件的目录记为代码目录。</li>
 *   <li>引用路径与资源路径按段从后往前对齐，对齐部分之前的目录记为静态资源根目录
 *       （例如 {@code /static/js/app.js} 对应 {@code web/static/js/app.js} 时，根目录为 {@code web}）。</li>
 *   <li>冲突与未匹配的引用不参与推断，只计入告警。</li>
 * </ul>
 */
public class ProjectInitializer {

    private static final Logger log = LoggerFactory.getLogger(ProjectInitializer.class);

    public static final String CONFIG_FILE_NAME = "cachebust.properties";

    private final CachebustProperties properties;
    private final MultibustRules multibustRules;

    public ProjectInitializer(CachebustProperties properties, MultibustRules multibustRules) {
        this.properties = properties;
        this.multibustRules = multibustRules;
    }

    /**
     * @param dryRun    只预览不写入；为 null 时使用 {@code app.cachebust.dry-run}
     * @param overwrite 配置文件已存在时是否覆盖
     */
    public InitReport init(Boolean dryRun, boolean overwrite) {
        boolean preview = dryRun != null ? dryRun : properties.isDryRun();
        CachebustProperties whole = wholeProject(properties);
        ProjectPathResolver resolver = new ProjectPathResolver(whole);
        Charset charset = CachebustConfiguration.fileCharset(whole.getFileEncoding());
        MarkerSyntax markers = new MarkerSyntax(whole.getMarkerToken());
        LimitedWarnings warnings = new LimitedWarnings(whole.getMaxWarnings());
        log.info("开始 init：project={}, dryRun={}", resolver.projectDir(), preview);

        Set<String> staticDirs = new TreeSet<>();
        Set<String> codeDirs = new TreeSet<>();
        Set<String> staticTypes = new TreeSet<>();
        Set<String> codeTypes = new TreeSet<>();
        int matchedReferences = 0;

        ExecutorService executor = CachebustEngine.newExecutor(whole.getWorkerThreads());
        try {
            ProjectWalker walker = new ProjectWalker(resolver, whole.isFollowSymlinks());
            ResourceIndex index = new ResourceIndexer(resolver, walker, whole.getHashFunction(), whole.getMaxWarnings())
                    .build(executor);
            index.warnings().forEach(warnings::add);

            ScanRule rule = new ScanRule(whole.getDelimiters(), resolver.staticExtensions(), multibustRules.placeholders());
            ReferenceScanner.ScanResult scan = new ReferenceScanner(resolver, walker, rule, markers,
                    whole.getMaxFileSize().toBytes(), whole.getMaxWarnings()).scan(executor);
            scan.warnings().forEach(warnings::add);

            ResourceMatcher matcher = new ResourceMatcher(index, new MultibustExpander(multibustRules), markers, charset);
            for (Reference reference : scan.references()) {
                MatchResult match = matcher.match(reference);
                if (match instanceof MatchResult.Ambiguous) {
                    warnings.add("引用匹配到多个内容不同的文件，未参与推断：" + reference.displayPath() + ":" + reference.line()
                            + " " + matcher.decode(reference.literal()));
                    continue;
                }
                if (match.resources().isEmpty()) {
                    continue;
                }
                matchedReferences++;
                codeDirs.add(parentDisplayPath(reference.displayPath()));
                codeTypes.add(ProjectPathResolver.extension(reference.sourceFile()));
                List<String> refSegments = ResourceMatcher.normalizeSegments(
                        ResourceMatcher.stripSchemeAndHost(matcher.decode(markers.stripFromPath(reference.path()))));
                for (StaticResource resource : match.resources()) {
                    staticDirs.add(staticRoot(refSegments, resource.relativePath()));
                    staticTypes.add(ProjectPathResolver.extension(resource.absolutePath()));
                }
            }
        } finally {
            executor.shutdownNow();
        }

        if (matchedReferences == 0) {
            warnings.add("未发现任何指向静态资源的引用，static-dirs/code-dirs 使用项目根目录");
            staticDirs.add(".");
            codeDirs.add(".");
        }

        List<String> staticList = List.copyOf(staticDirs);
        List<String> codeList = List.copyOf(codeDirs);
        List<String> staticTypeList = staticTypes.isEmpty() ? List.copyOf(whole.getStaticFiletypes()) : List.copyOf(staticTypes);
        List<String> codeTypeList = codeTypes.isEmpty() ? List.copyOf(whole.getCodeFiletypes()) : List.copyOf(codeTypes);
        String content = render(staticList, staticTypeList, codeList, codeTypeList);

        Path target = resolver.projectDir().resolve(CONFIG_FILE_NAME);
        boolean written = false;
        if (preview) {
            log.info("init 预览：未写入 {}", target);
        } else if (Files.exists(target) && !overwrite) {
            warnings.add("配置文件已存在，未覆盖：" + CONFIG_FILE_NAME + "（如需覆盖请传 overwrite=true）");
        } else {
            try {
                TextPatcher.writeAtomically(target, content.getBytes(StandardCharsets.UTF_8));
                written = true;
                log.info("已写入 {}：static-dirs={}, code-dirs={}", target, staticList, codeList);
            } catch (IOException e) {
                throw new IllegalStateException("写入配置文件失败：" + target, e);
            }
        }

        return new InitReport(
                CONFIG_FILE_NAME,
                written,
                staticList,
                codeList,
                staticTypeList,
                codeTypeList,
                matchedReferences,
                content,
                warnings.toList()
        );
    }

    /**
     * 资源路径与引用路径从最后一段开始对齐，返回对齐部分之前的目录（相对项目根目录）。
     * 含占位符的引用段视为与任意资源段对齐。
     */
    String staticRoot(List<String> refSegments, String resourcePath) {
        String[] resourceSegments = resourcePath.split("/");
        int aligned = 0;
        while (aligned < refSegments.size() && aligned < resourceSegments.length) {
            String ref = refSegments.get(refSegments.size() - 1 - aligned);
            String res = resourceSegments[resourceSegments.length - 1 - aligned];
            if (!ref.equals(res) && !containsPlaceholder(ref)) {
                break;
            }
            aligned++;
        }
        int rootLength = resourceSegments.length - Math.max(aligned, 1);
        if (rootLength <= 0) {
            return ".";
        }
        return String.join("/", List.of(resourceSegments).subList(0, rootLength));
    }

    private boolean containsPlaceholder(String segment) {
        for (String placeholder : multibustRules.placeholders()) {
            if (segment.contains(placeholder)) {
                return true;
            }
        }
        return MultibustExpander.TEMPLATE_PLACEHOLDER.matcher(segment).find();
    }

    private static String parentDisplayPath(String displayPath) {
        int slash = displayPath.lastIndexOf('/');
        return slash <= 0 ? "." : displayPath.substring(0, slash);
    }

    static String render(List<String> staticDirs, List<String> staticFiletypes, List<String> codeDirs, List<String> codeFiletypes) {
        StringBuilder sb = new StringBuilder();
        sb.append("# cachebust 项目配置（由 init 生成），目录均相对项目根目录\n");
        sb.append("# 静态资源根目录的顺序即引用查找时的优先顺序\n");
        sb.append("app.cachebust.static-dirs=").append(String.join(",", staticDirs)).append('\n');
        sb.append("app.cachebust.static-filetypes=").append(String.join(",", staticFiletypes)).append('\n');
        sb.append("app.cachebust.code-dirs=").append(String.join(",", codeDirs)).append('\n');
        sb.append("app.cachebust.code-filetypes=").append(String.join(",", codeFiletypes)).append('\n');
        sb.append('\n');
        sb.append("#app.cachebust.ignore-dirs=lib,lib64,.git,.hg,.svn,node_modules\n");
        sb.append("#app.cachebust.static-exclude=*.map\n");
        sb.append("#app.cachebust.code-exclude=*.min.js\n");
        sb.append("#app.cachebust.file-encoding=UTF-8\n");
        sb.append("#app.cachebust.hash-function=crc32\n");
        sb.append("#app.cachebust.hash-length=8\n");
        sb.append("#app.cachebust.marker-style=QUERY\n");
        sb.append('\n');
        sb.append("# multibust：含占位符的引用按每个替换值展开，缓存戳由全部展开后的资源共同决定。\n");
        sb.append("# 例如 <img src=\"/static/i18n_img_{{lang}}.png?_cb_=1234abcd\">，\n");
        sb.append("# /static/i18n_img_en.png 或 /static/i18n_img_de.png 任一变化都会刷新缓存戳。\n");
        sb.append("#app.cachebust.multibust.[{{lang}}]=en,de\n");
        return sb.toString();
    }

    /**
     * 以整个项目目录同时作为静态资源根目录与代码目录的配置副本。
     */
    private static CachebustProperties wholeProject(CachebustProperties source) {
        CachebustProperties copy = new CachebustProperties();
        copy.setProjectDir(source.getProjectDir());
        copy.setStaticDirs(new ArrayList<>(List.of(".")));
        copy.setCodeDirs(new ArrayList<>(List.of(".")));
        copy.setStaticFiletypes(new ArrayList<>(source.getStaticFiletypes()));
        copy.setCodeFiletypes(new ArrayList<>(source.getCodeFiletypes()));
        copy.setStaticExclude(new ArrayList<>(source.getStaticExclude()));
        copy.setCodeExclude(new ArrayList<>(source.getCodeExclude()));
        copy.setIgnoreDirs(new ArrayList<>(source.getIgnoreDirs()));
        copy.setFileEncoding(source.getFileEncoding());
        copy.setHashFunction(source.getHashFunction());
        copy.setMarkerToken(source.getMarkerToken());
        copy.setDelimiters(source.getDelimiters());
        copy.setMaxFileSize(source.getMaxFileSize());
        copy.setWorkerThreads(source.getWorkerThreads());
        copy.setFollowSymlinks(source.isFollowSymlinks());
        copy.setMaxWarnings(source.getMaxWarnings());
        return copy;
    }
}
