package org.cachebust.engine.dto;

/**
 * 单个文件的改写结果。
 *
 * @param path    文件路径（相对项目根目录，统一使用 / 分隔）
 * @param status  结果状态
 * @param edits   计划/实际应用的改写数
 * @param bytes   改写后的文件字节数（跳过/失败时为 0）
 * @param diff    unified diff 预览（仅 dry-run 时返回）
 * @param message 跳过或失败原因
 */
public record FilePatchReport(
        String path,
        FilePatchStatus status,
        int edits,
        long bytes,
        String diff,
        String message
) {
}
