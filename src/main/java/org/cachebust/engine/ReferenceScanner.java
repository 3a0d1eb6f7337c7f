package org.cachebust.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 引用扫描器：在代码/文本目录中查找指向静态资源的 URL 字面量。
 * <p>
 * 说明：
 * <ul>
 *   <li>文件按字节读取并以 ISO-8859-1 视图匹配，匹配结果的偏移量即字节偏移量，改写时不会破坏多字节字符。</li>
 *   <li>二进制文件（前 8KB 含 NUL 字节）与超过 {@code app.cachebust.max-file-size} 的文件跳过并记录告警。</li>
 *   <li>每个文件是独立的扫描任务，在有界线程池中执行；结果按文件顺序合并。</li>
 * </ul>
 */
public class ReferenceScanner {

    private static final Logger log = LoggerFactory.getLogger(ReferenceScanner.class);

    private static final int BINARY_PROBE_BYTES = 8192;

    private final ProjectPathResolver resolver;
    private final ProjectWalker walker;
    private final ScanRule rule;
    private final MarkerSyntax markers;
    private final long maxFileSize;
    private final int maxWarnings;

    public ReferenceScanner(ProjectPathResolver resolver, ProjectWalker walker, ScanRule rule, MarkerSyntax markers, long maxFileSize, int maxWarnings) {
        this.resolver = resolver;
        this.walker = walker;
        this.rule = rule;
        this.markers = markers;
        this.maxFileSize = maxFileSize;
        this.maxWarnings = maxWarnings;
    }

    public ScanResult scan(ExecutorService executor) {
        LimitedWarnings warnings = new LimitedWarnings(maxWarnings);
        Set<Path> files = new LinkedHashSet<>();
        int[] skipped = new int[]{0};
        for (ProjectPathResolver.SearchRoot root : resolver.codeRoots()) {
            walker.walk(root.path(), (file, attrs) -> {
                if (!resolver.isCodeFile(file)) {
                    return;
                }
                if (attrs.size() > maxFileSize) {
                    skipped[0]++;
                    log.warn("文件过大，已跳过扫描：{}（{} 字节）", resolver.displayPath(file), attrs.size());
                    warnings.add("文件过大，已跳过扫描：" + resolver.displayPath(file) + "（" + attrs.size() + " 字节）");
                    return;
                }
                // 代码目录可能相互嵌套，同一文件只扫描一次
                files.add(file.toAbsolutePath().normalize());
            }, warnings);
        }

        List<Future<FileScan>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            futures.add(executor.submit(() -> scanFile(file)));
        }

        List<Reference> references = new ArrayList<>();
        for (Future<FileScan> future : futures) {
            FileScan scan = ResourceIndexer.await(future);
            references.addAll(scan.references());
            warnings.addAll(scan.warnings());
            if (scan.skipped()) {
                skipped[0]++;
            }
        }
        log.info("引用扫描完成：{} 个文件，{} 处引用，跳过 {} 个文件", files.size(), references.size(), skipped[0]);
        return new ScanResult(List.copyOf(references), files.size(), skipped[0], warnings.toList());
    }

    FileScan scanFile(Path file) {
        LimitedWarnings warnings = new LimitedWarnings(maxWarnings);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            log.warn("文件无法读取，已跳过：{}", resolver.displayPath(file), e);
            warnings.add("文件无法读取，已跳过：" + resolver.displayPath(file) + "（" + e.getMessage() + "）");
            return new FileScan(List.of(), warnings, true);
        }
        if (isBinary(bytes)) {
            log.warn("疑似二进制文件，已跳过扫描：{}", resolver.displayPath(file));
            warnings.add("疑似二进制文件，已跳过扫描：" + resolver.displayPath(file));
            return new FileScan(List.of(), warnings, true);
        }
        return new FileScan(parse(file, new String(bytes, StandardCharsets.ISO_8859_1)), warnings, false);
    }

    /**
     * 把一段字节视图文本解析成引用列表（纯函数，便于单独测试）。
     */
    List<Reference> parse(Path file, String text) {
        String displayPath = resolver.displayPath(file);
        List<Reference> references = new ArrayList<>();
        int line = 1;
        int cursor = 0;
        for (ScanRule.LiteralSpan span : rule.find(text)) {
            for (int i = cursor; i < span.start(); i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                }
            }
            cursor = span.start();
            references.add(new Reference(
                    file,
                    displayPath,
                    span.start(),
                    span.end(),
                    line,
                    text.substring(span.start(), span.end()),
                    span.path(),
                    span.query(),
                    span.fragment(),
                    markers.find(span.path(), span.query())
            ));
        }
        return references;
    }

    static boolean isBinary(byte[] bytes) {
        int limit = Math.min(bytes.length, BINARY_PROBE_BYTES);
        for (int i = 0; i < limit; i++) {
            if (bytes[i] == 0) {
                return true;
            }
        }
        return false;
    }

    record FileScan(List<Reference> references, LimitedWarnings warnings, boolean skipped) {
    }

    /**
     * 一次扫描的汇总结果。
     *
     * @param references   所有引用（按文件、偏移顺序）
     * @param scannedFiles 纳入扫描的文件数
     * @param skippedFiles 跳过的文件数（过大/二进制/不可读）
     * @param warnings     非致命告警
     */
    public record ScanResult(List<Reference> references, int scannedFiles, int skippedFiles, List<String> warnings) {
    }
}
