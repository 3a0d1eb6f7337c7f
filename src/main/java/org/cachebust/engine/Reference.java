package org.cachebust.engine;

import java.nio.file.Path;

/**
 * 代码/文本文件中一次 URL 字面量出现（同一 URL 的每次出现各自独立）。
 * <p>
 * {@code start/end} 是字节偏移量，扫描时保证正好指向 {@link #literal}；
 * 文本字段均为 ISO-8859-1 字节视图（一个 char 对应一个字节）。
 *
 * @param sourceFile  所在文件（绝对路径）
 * @param displayPath 所在文件相对项目根目录的路径
 * @param start       起始字节偏移（包含）
 * @param end         结束字节偏移（不包含）
 * @param line        所在行号（1-based）
 * @param literal     字面量原文
 * @param path        路径部分
 * @param query       查询串（含 {@code ?}，可为空字符串）
 * @param fragment    片段（含 {@code #}，可为空字符串）
 * @param marker      已存在的缓存戳（没有时为 null）
 */
public record Reference(
        Path sourceFile,
        String displayPath,
        int start,
        int end,
        int line,
        String literal,
        String path,
        String query,
        String fragment,
        CachebustMarker marker
) {

    public boolean hasMarker() {
        return marker != null;
    }
}
