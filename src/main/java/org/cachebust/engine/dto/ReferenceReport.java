package org.cachebust.engine.dto;

import java.util.List;

/**
 * 单个引用在本次运行中的处理结果。
 *
 * @param path        所在文件（相对项目根目录，统一使用 / 分隔）
 * @param lineNumber  行号（1-based）
 * @param offset      字面量起始字节偏移
 * @param literal     字面量原文
 * @param outcome     解析结论
 * @param action      采取的动作（scan 模式固定为 LEAVE）
 * @param oldToken    原有缓存戳（没有时为 null）
 * @param newToken    按当前资源计算出的缓存戳（未匹配/冲突时为 null）
 * @param replacement 改写后的字面量（没有改写时为 null）
 * @param resources   参与计算的静态资源（冲突时为全部冲突候选）
 * @param detail      补充说明（未匹配原因、冲突提示、缺失的 multibust 变体等）
 */
public record ReferenceReport(
        String path,
        int lineNumber,
        int offset,
        String literal,
        ReferenceOutcome outcome,
        RewriteAction action,
        String oldToken,
        String newToken,
        String replacement,
        List<String> resources,
        String detail
) {
}
