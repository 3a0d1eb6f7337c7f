package org.cachebust.mcp;

import org.cachebust.engine.CachebustEngine;
import org.cachebust.engine.MarkerStyle;
import org.cachebust.engine.ProjectInitializer;
import org.cachebust.engine.RunMode;
import org.cachebust.engine.dto.CachebustReport;
import org.cachebust.engine.dto.InitReport;
import org.cachebust.engine.dto.ReferenceOutcome;
import org.cachebust.engine.dto.ReferenceReport;
import org.cachebust.engine.dto.RewriteAction;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 缓存戳 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>初始化项目配置（{@code cachebust_init}）。</li>
 *   <li>只读扫描（{@code cachebust_scan}）。</li>
 *   <li>新增/更新缓存戳（{@code cachebust_rewrite}）与只更新已有缓存戳（{@code cachebust_update}）。</li>
 * </ul>
 * <p>
 * 同一时刻只允许一个运行在进行：保证每个文件在一次运行中最多被写一次，且不会与另一运行交错写入。
 */
@Component
public class CachebustMcpTools {

    private static final int DEFAULT_MAX_REFERENCES = 500;
    private static final int MAX_REFERENCES_LIMIT = 20_000;

    private final CachebustEngine engine;
    private final ProjectInitializer initializer;
    private final Object runLock = new Object();

    public CachebustMcpTools(CachebustEngine engine, ProjectInitializer initializer) {
        this.engine = engine;
        this.initializer = initializer;
    }

    @Tool(
            name = "cachebust_init",
            description = "扫描整个项目，推断静态资源目录与代码目录，生成 cachebust.properties（默认不覆盖已有文件）。"
    )
    public InitReport init(
            @ToolParam(required = false, description = "只预览不写入（默认 app.cachebust.dry-run）") Boolean dryRun,
            @ToolParam(required = false, description = "配置文件已存在时是否覆盖（默认 false）") Boolean overwrite
    ) {
        synchronized (runLock) {
            return initializer.init(dryRun, Boolean.TRUE.equals(overwrite));
        }
    }

    @Tool(
            name = "cachebust_scan",
            description = "只读扫描：列出所有静态资源引用及其状态（matched/current/stale/unmatched/ambiguous），不修改任何文件。"
    )
    public CachebustReport scan(
            @ToolParam(required = false, description = "只返回需要关注的引用（非 current；默认 false）") Boolean onlyProblems,
            @ToolParam(required = false, description = "最多返回的引用条数（默认 500，上限 20000）") Integer maxReferences
    ) {
        synchronized (runLock) {
            return limit(engine.run(RunMode.SCAN, Boolean.TRUE, null), onlyProblems, maxReferences);
        }
    }

    @Tool(
            name = "cachebust_rewrite",
            description = "为没有缓存戳的引用新增缓存戳，并更新过期的缓存戳；未匹配/冲突的引用只报告不修改。dryRun=true 时只返回 diff 预览。"
    )
    public CachebustReport rewrite(
            @ToolParam(required = false, description = "只预览不写入（默认 app.cachebust.dry-run）") Boolean dryRun,
            @ToolParam(required = false, description = "缓存戳写法：query（?_cb_=...）或 filename（app_cb_....js）；默认 app.cachebust.marker-style") String markerStyle,
            @ToolParam(required = false, description = "只返回发生改写或需要关注的引用（默认 true）") Boolean onlyProblems,
            @ToolParam(required = false, description = "最多返回的引用条数（默认 500，上限 20000）") Integer maxReferences
    ) {
        MarkerStyle style = parseMarkerStyle(markerStyle);
        synchronized (runLock) {
            return limit(engine.run(RunMode.REWRITE, dryRun, style), onlyProblems == null || onlyProblems, maxReferences);
        }
    }

    @Tool(
            name = "cachebust_update",
            description = "只更新已有且过期的缓存戳（保持原写法），不为没有缓存戳的引用新增。dryRun=true 时只返回 diff 预览。"
    )
    public CachebustReport update(
            @ToolParam(required = false, description = "只预览不写入（默认 app.cachebust.dry-run）") Boolean dryRun,
            @ToolParam(required = false, description = "只返回发生改写或需要关注的引用（默认 true）") Boolean onlyProblems,
            @ToolParam(required = false, description = "最多返回的引用条数（默认 500，上限 20000）") Integer maxReferences
    ) {
        synchronized (runLock) {
            return limit(engine.run(RunMode.UPDATE, dryRun, null), onlyProblems == null || onlyProblems, maxReferences);
        }
    }

    static MarkerStyle parseMarkerStyle(String markerStyle) {
        if (markerStyle == null || markerStyle.isBlank()) {
            return null;
        }
        try {
            return MarkerStyle.valueOf(markerStyle.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("markerStyle 仅支持 query/filename：" + markerStyle);
        }
    }

    /**
     * 按参数裁剪返回的引用列表（计数器保持完整）。
     */
    static CachebustReport limit(CachebustReport report, Boolean onlyProblems, Integer maxReferences) {
        int max = maxReferences == null || maxReferences <= 0
                ? DEFAULT_MAX_REFERENCES
                : Math.min(maxReferences, MAX_REFERENCES_LIMIT);
        boolean filter = Boolean.TRUE.equals(onlyProblems);

        List<ReferenceReport> kept = new ArrayList<>();
        int omitted = 0;
        for (ReferenceReport reference : report.references()) {
            if (filter && reference.outcome() == ReferenceOutcome.CURRENT && reference.action() == RewriteAction.LEAVE) {
                continue;
            }
            if (kept.size() >= max) {
                omitted++;
                continue;
            }
            kept.add(reference);
        }
        if (omitted == 0 && kept.size() == report.references().size()) {
            return report;
        }

        List<String> warnings = new ArrayList<>(report.warnings());
        if (omitted > 0) {
            warnings.add("引用过多，已省略 " + omitted + " 条（可调大 maxReferences 或设置 onlyProblems=true）");
        }
        return new CachebustReport(
                report.mode(),
                report.dryRun(),
                report.startedAt(),
                report.durationMillis(),
                report.staticResources(),
                report.scannedFiles(),
                report.skippedFiles(),
                report.matched(),
                report.current(),
                report.stale(),
                report.unmatched(),
                report.ambiguous(),
                report.inserted(),
                report.updated(),
                List.copyOf(kept),
                report.files(),
                List.copyOf(warnings)
        );
    }
}
