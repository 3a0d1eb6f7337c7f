package org.cachebust.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.cachebust.engine.CachebustEngine;
import org.cachebust.engine.CachebustProperties;
import org.cachebust.engine.ProjectInitializer;
import org.cachebust.engine.RunMode;
import org.cachebust.engine.dto.CachebustReport;
import org.cachebust.engine.dto.FilePatchReport;
import org.cachebust.engine.dto.InitReport;
import org.cachebust.engine.dto.ReferenceOutcome;
import org.cachebust.engine.dto.ReferenceReport;
import org.cachebust.engine.dto.RewriteAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Locale;

/**
 * 批处理入口：配置了 {@code app.cachebust.cli.mode} 时，启动后执行一次并把报告写到标准输出。
 * <p>
 * 退出码：0 = 成功；1 = 存在未匹配/冲突引用或有文件被跳过；2 = 运行失败。
 */
@Component
@ConditionalOnProperty(name = "app.cachebust.cli.mode")
public class CachebustBatchRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CachebustBatchRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PROBLEMS = 1;
    static final int EXIT_FAILED = 2;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final CachebustProperties properties;
    private final CachebustEngine engine;
    private final ProjectInitializer initializer;
    private final PrintStream out;
    private int exitCode = EXIT_OK;

    public CachebustBatchRunner(CachebustProperties properties, CachebustEngine engine, ProjectInitializer initializer) {
        this(properties, engine, initializer, System.out);
    }

    CachebustBatchRunner(CachebustProperties properties, CachebustEngine engine, ProjectInitializer initializer, PrintStream out) {
        this.properties = properties;
        this.engine = engine;
        this.initializer = initializer;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        RunMode mode = properties.getCli().getMode();
        boolean json = "json".equals(properties.getCli().getFormat());
        try {
            if (mode == RunMode.INIT) {
                InitReport report = initializer.init(null, false);
                out.println(json ? toJson(report) : render(report));
                exitCode = EXIT_OK;
                return;
            }
            CachebustReport report = engine.run(mode, null, null);
            out.println(json ? toJson(report) : render(report));
            exitCode = report.hasProblems() ? EXIT_PROBLEMS : EXIT_OK;
        } catch (RuntimeException e) {
            log.error("批处理运行失败：mode={}", mode, e);
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static String toJson(Object report) {
        try {
            return OBJECT_MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("报告序列化失败", e);
        }
    }

    static String render(InitReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(report.content());
        for (String warning : report.warnings()) {
            sb.append("warning: ").append(warning).append('\n');
        }
        sb.append(report.written() ? "已写入 " : "未写入 ").append(report.configPath())
                .append("：static-dirs=").append(report.staticDirs())
                .append("，code-dirs=").append(report.codeDirs())
                .append("，").append(report.references()).append(" 处引用");
        return sb.toString();
    }

    static String render(CachebustReport report) {
        StringBuilder sb = new StringBuilder();
        for (ReferenceReport reference : report.references()) {
            if (reference.outcome() == ReferenceOutcome.CURRENT && reference.action() == RewriteAction.LEAVE) {
                continue;
            }
            sb.append(String.format("%-9s %-6s %s:%d  %s",
                    reference.outcome().name().toLowerCase(Locale.ROOT), reference.action().name().toLowerCase(Locale.ROOT),
                    reference.path(), reference.lineNumber(), reference.literal()));
            if (reference.replacement() != null) {
                sb.append(" -> ").append(reference.replacement());
            }
            if (reference.detail() != null) {
                sb.append("  (").append(reference.detail()).append(')');
            }
            sb.append('\n');
        }
        for (FilePatchReport file : report.files()) {
            sb.append(String.format("%-19s %s（%d 处）", file.status().name().toLowerCase(Locale.ROOT), file.path(), file.edits()));
            if (file.message() != null) {
                sb.append("  ").append(file.message());
            }
            sb.append('\n');
            if (file.diff() != null && !file.diff().isEmpty()) {
                sb.append(file.diff()).append('\n');
            }
        }
        for (String warning : report.warnings()) {
            sb.append("warning: ").append(warning).append('\n');
        }
        sb.append(String.format("%s%s：%d 个静态资源，%d 个文件，已匹配 %d，最新 %d，过期 %d，未匹配 %d，冲突 %d，新增 %d，更新 %d",
                report.mode(), report.dryRun() ? "（预览）" : "",
                report.staticResources(), report.scannedFiles(),
                report.matched(), report.current(), report.stale(), report.unmatched(), report.ambiguous(),
                report.inserted(), report.updated()));
        return sb.toString();
    }
}
