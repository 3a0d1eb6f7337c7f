package org.cachebust.engine;

import org.cachebust.engine.dto.CachebustReport;
import org.cachebust.engine.dto.FilePatchReport;
import org.cachebust.engine.dto.ReferenceReport;
import org.cachebust.engine.dto.RewriteAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 一次 scan/rewrite/update 运行的编排：
 * <ol>
 *   <li>构建静态资源索引（屏障：索引完成前不做任何匹配）；</li>
 *   <li>扫描代码/文本目录中的引用；</li>
 *   <li>逐个引用匹配并决策；</li>
 *   <li>把改写交给 {@link TextPatcher}（每个文件每次运行最多写一次）。</li>
 * </ol>
 * 每次运行都重新计算索引与摘要，不跨运行缓存任何状态；线程池也随运行创建、随运行关闭。
 */
public class CachebustEngine {

    private static final Logger log = LoggerFactory.getLogger(CachebustEngine.class);

    private final CachebustProperties properties;
    private final ProjectPathResolver resolver;
    private final MultibustRules multibustRules;
    private final TokenGenerator tokenGenerator;
    private final MarkerSyntax markers;
    private final Charset charset;

    public CachebustEngine(CachebustProperties properties, ProjectPathResolver resolver, MultibustRules multibustRules, TokenGenerator tokenGenerator) {
        this.properties = properties;
        this.resolver = resolver;
        this.multibustRules = multibustRules;
        this.tokenGenerator = tokenGenerator;
        this.markers = new MarkerSyntax(properties.getMarkerToken());
        this.charset = CachebustConfiguration.fileCharset(properties.getFileEncoding());
    }

    /**
     * 执行一次运行。
     *
     * @param mode          运行模式（scan/rewrite/update）
     * @param dryRun        是否只预览；为 null 时使用 {@code app.cachebust.dry-run}
     * @param markerStyle   新增缓存戳使用的写法；为 null 时使用 {@code app.cachebust.marker-style}
     */
    public CachebustReport run(RunMode mode, Boolean dryRun, MarkerStyle markerStyle) {
        if (mode == null || mode == RunMode.INIT) {
            throw new IllegalArgumentException("不支持的运行模式：" + mode + "（init 请使用 ProjectInitializer）");
        }
        boolean preview = dryRun != null ? dryRun : properties.isDryRun();
        MarkerStyle style = markerStyle != null ? markerStyle : properties.getMarkerStyle();
        Instant startedAt = Instant.now();
        long started = System.nanoTime();
        log.info("开始 {}：project={}, dryRun={}, markerStyle={}", name(mode), resolver.projectDir(), preview, style);

        ExecutorService executor = newExecutor(properties.getWorkerThreads());
        try {
            ProjectWalker walker = new ProjectWalker(resolver, properties.isFollowSymlinks());
            ResourceIndex index = new ResourceIndexer(resolver, walker, properties.getHashFunction(), properties.getMaxWarnings())
                    .build(executor);

            ScanRule rule = new ScanRule(properties.getDelimiters(), resolver.staticExtensions(), multibustRules.placeholders());
            ReferenceScanner scanner = new ReferenceScanner(resolver, walker, rule, markers,
                    properties.getMaxFileSize().toBytes(), properties.getMaxWarnings());
            ReferenceScanner.ScanResult scan = scanner.scan(executor);

            ResourceMatcher matcher = new ResourceMatcher(index, new MultibustExpander(multibustRules), markers, charset);
            RewritePlanner planner = new RewritePlanner(markers, tokenGenerator, style);
            Tally tally = new Tally();
            List<ReferenceReport> references = new ArrayList<>(scan.references().size());
            List<RewriteEdit> edits = new ArrayList<>();
            for (Reference reference : scan.references()) {
                RewritePlanner.Decision decision = planner.plan(mode, reference, matcher.match(reference));
                if (decision.edit() != null) {
                    edits.add(decision.edit());
                }
                tally.count(decision);
                references.add(toReport(decision));
                log.debug("{}:{} {} -> {} {}", reference.displayPath(), reference.line(), reference.literal(),
                        decision.outcome(), decision.action());
            }

            List<FilePatchReport> files = edits.isEmpty()
                    ? List.of()
                    : new TextPatcher(charset).apply(edits, preview);

            LimitedWarnings warnings = new LimitedWarnings(properties.getMaxWarnings());
            index.warnings().forEach(warnings::add);
            scan.warnings().forEach(warnings::add);

            long durationMillis = (System.nanoTime() - started) / 1_000_000;
            log.info("{} 完成：{} 个静态资源，{} 处引用（未匹配 {}，冲突 {}），新增 {}，更新 {}，改写 {} 个文件，耗时 {} ms",
                    name(mode), index.size(), references.size(), tally.unmatched, tally.ambiguous,
                    tally.inserted, tally.updated, files.size(), durationMillis);

            return new CachebustReport(
                    name(mode),
                    preview,
                    startedAt.toString(),
                    durationMillis,
                    index.size(),
                    scan.scannedFiles(),
                    scan.skippedFiles(),
                    tally.matched,
                    tally.current,
                    tally.stale,
                    tally.unmatched,
                    tally.ambiguous,
                    tally.inserted,
                    tally.updated,
                    List.copyOf(references),
                    List.copyOf(files),
                    warnings.toList()
            );
        } finally {
            executor.shutdownNow();
        }
    }

    private ReferenceReport toReport(RewritePlanner.Decision decision) {
        Reference reference = decision.reference();
        List<String> resources = new ArrayList<>();
        List<StaticResource> involved = decision.match() instanceof MatchResult.Ambiguous ambiguous
                ? ambiguous.candidates()
                : decision.match().resources();
        for (StaticResource resource : involved) {
            resources.add(resource.displayPath());
        }
        return new ReferenceReport(
                reference.displayPath(),
                reference.line(),
                reference.start(),
                text(reference.literal()),
                decision.outcome(),
                decision.action(),
                reference.hasMarker() ? reference.marker().token() : null,
                decision.token(),
                decision.edit() == null ? null : text(decision.edit().replacement()),
                List.copyOf(resources),
                decision.detail()
        );
    }

    /**
     * 字节视图 -> 配置编码的字符串（仅用于展示）。
     */
    private String text(String latin1) {
        return new String(latin1.getBytes(StandardCharsets.ISO_8859_1), charset);
    }

    private static String name(RunMode mode) {
        return mode.name().toLowerCase(Locale.ROOT);
    }

    static ExecutorService newExecutor(int threads) {
        return Executors.newFixedThreadPool(Math.max(1, threads), new WorkerThreadFactory());
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "cachebust-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    private static final class Tally {
        private int matched;
        private int current;
        private int stale;
        private int unmatched;
        private int ambiguous;
        private int inserted;
        private int updated;

        void count(RewritePlanner.Decision decision) {
            switch (decision.outcome()) {
                case MATCHED -> matched++;
                case CURRENT -> current++;
                case STALE -> stale++;
                case UNMATCHED -> unmatched++;
                case AMBIGUOUS -> ambiguous++;
            }
            if (decision.action() == RewriteAction.INSERT) {
                inserted++;
            } else if (decision.action() == RewriteAction.UPDATE) {
                updated++;
            }
        }
    }
}
