package org.cachebust.engine;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.cachebust.engine.dto.FilePatchReport;
import org.cachebust.engine.dto.FilePatchStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 文本改写器：把一组字节区间改写应用到文件上。
 * <p>
 * 同一文件的改写一次性应用：先重新读取文件并逐个确认区间原文未变（任何一处不一致整个文件跳过），
 * 再按偏移量从后往前替换，最后写入同目录临时文件并原子替换。区间之外的字节保持原样。
 */
public class TextPatcher {

    private static final Logger log = LoggerFactory.getLogger(TextPatcher.class);

    private static final int DIFF_CONTEXT_LINES = 3;

    private final Charset charset;

    public TextPatcher(Charset charset) {
        this.charset = charset;
    }

    /**
     * 应用改写；dry-run 时只生成 unified diff 预览，不写任何文件。
     * <p>
     * 线程被中断时不再写入后续文件，已写入的文件保持完整。
     */
    public List<FilePatchReport> apply(List<RewriteEdit> edits, boolean dryRun) {
        Map<Path, List<RewriteEdit>> byFile = new LinkedHashMap<>();
        for (RewriteEdit edit : edits) {
            byFile.computeIfAbsent(edit.file(), k -> new ArrayList<>()).add(edit);
        }

        List<FilePatchReport> reports = new ArrayList<>(byFile.size());
        boolean interrupted = false;
        for (Map.Entry<Path, List<RewriteEdit>> entry : byFile.entrySet()) {
            List<RewriteEdit> fileEdits = entry.getValue();
            String displayPath = fileEdits.get(0).displayPath();
            if (interrupted || Thread.currentThread().isInterrupted()) {
                interrupted = true;
                reports.add(new FilePatchReport(displayPath, FilePatchStatus.SKIPPED_INTERRUPTED, fileEdits.size(), 0, null, "运行被中断，未写入"));
                continue;
            }
            reports.add(applyToFile(entry.getKey(), displayPath, fileEdits, dryRun));
        }
        return reports;
    }

    FilePatchReport applyToFile(Path file, String displayPath, List<RewriteEdit> edits, boolean dryRun) {
        byte[] original;
        try {
            original = Files.readAllBytes(file);
        } catch (IOException e) {
            log.warn("改写前读取文件失败：{}", displayPath, e);
            return new FilePatchReport(displayPath, FilePatchStatus.FAILED, edits.size(), 0, null, "读取文件失败：" + e.getMessage());
        }

        List<RewriteEdit> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparingInt(RewriteEdit::start).reversed());

        String mismatch = verify(original, ordered);
        if (mismatch != null) {
            log.warn("文件在扫描后被修改，已跳过：{}（{}）", displayPath, mismatch);
            return new FilePatchReport(displayPath, FilePatchStatus.SKIPPED_MODIFIED, edits.size(), 0, null, mismatch);
        }

        byte[] patched = splice(original, ordered);
        if (dryRun) {
            return new FilePatchReport(displayPath, FilePatchStatus.PREVIEW, edits.size(), patched.length, unifiedDiff(displayPath, original, patched), null);
        }

        try {
            writeAtomically(file, patched);
        } catch (IOException e) {
            log.error("写入文件失败：{}", displayPath, e);
            return new FilePatchReport(displayPath, FilePatchStatus.FAILED, edits.size(), 0, null, "写入文件失败：" + e.getMessage());
        }
        log.debug("已改写 {}：{} 处", displayPath, edits.size());
        return new FilePatchReport(displayPath, FilePatchStatus.WRITTEN, edits.size(), patched.length, null, null);
    }

    /**
     * 确认每个区间都在文件范围内、互不重叠且原文一致；不满足时返回原因。
     *
     * @param ordered 按起始偏移降序排列的改写
     */
    private static String verify(byte[] content, List<RewriteEdit> ordered) {
        int limit = content.length;
        for (RewriteEdit edit : ordered) {
            if (edit.end() > limit) {
                return edit.end() > content.length
                        ? "改写区间超出文件长度：[" + edit.start() + ", " + edit.end() + ")"
                        : "改写区间重叠：[" + edit.start() + ", " + edit.end() + ")";
            }
            String actual = new String(content, edit.start(), edit.end() - edit.start(), StandardCharsets.ISO_8859_1);
            if (!actual.equals(edit.expected())) {
                return "偏移 " + edit.start() + " 处内容与扫描时不一致";
            }
            limit = edit.start();
        }
        return null;
    }

    private static byte[] splice(byte[] content, List<RewriteEdit> ordered) {
        byte[] result = content;
        for (RewriteEdit edit : ordered) {
            byte[] replacement = edit.replacement().getBytes(StandardCharsets.ISO_8859_1);
            byte[] next = new byte[result.length - (edit.end() - edit.start()) + replacement.length];
            System.arraycopy(result, 0, next, 0, edit.start());
            System.arraycopy(replacement, 0, next, edit.start(), replacement.length);
            System.arraycopy(result, edit.end(), next, edit.start() + replacement.length, result.length - edit.end());
            result = next;
        }
        return result;
    }

    private String unifiedDiff(String displayPath, byte[] before, byte[] after) {
        List<String> original = lines(before);
        List<String> revised = lines(after);
        Patch<String> patch = DiffUtils.diff(original, revised);
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(displayPath, displayPath, original, patch, DIFF_CONTEXT_LINES);
        return String.join("\n", unified);
    }

    private List<String> lines(byte[] content) {
        return Arrays.asList(new String(content, charset).split("\r?\n", -1));
    }

    static void writeAtomically(Path target, byte[] bytes) throws IOException {
        // 先写同目录临时文件（与目标在同一文件系统内），再 move 替换；不支持 ATOMIC_MOVE 时降级为普通替换
        Path parent = target.getParent();
        if (parent == null) {
            throw new IllegalArgumentException("目标路径无效：" + target);
        }
        Path tmp = Files.createTempFile(parent, ".cachebust-", ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("清理临时文件失败：{}", tmp, e);
            }
        }
    }
}
