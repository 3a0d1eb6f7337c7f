package org.cachebust.engine;

import java.nio.file.Path;

/**
 * 对某个文件的一处字节区间改写。
 *
 * @param file        目标文件（绝对路径）
 * @param displayPath 目标文件相对项目根目录的路径
 * @param start       起始字节偏移（包含）
 * @param end         结束字节偏移（不包含）
 * @param expected    扫描时该区间的原文（ISO-8859-1 字节视图），落盘前用来确认文件未被改动
 * @param replacement 新字面量（ISO-8859-1 字节视图）
 */
public record RewriteEdit(Path file, String displayPath, int start, int end, String expected, String replacement) {

    public RewriteEdit {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("改写区间无效：[" + start + ", " + end + ")");
        }
        if (expected.length() != end - start) {
            throw new IllegalArgumentException("改写区间与原文长度不一致：" + displayPath);
        }
    }

    static RewriteEdit of(Reference reference, String replacement) {
        return new RewriteEdit(
                reference.sourceFile(),
                reference.displayPath(),
                reference.start(),
                reference.end(),
                reference.literal(),
                replacement
        );
    }
}
