package org.cachebust.engine.dto;

import java.util.List;

/**
 * 一次运行的结构化报告（由 MCP 工具/批处理入口负责展示，引擎本身不输出）。
 *
 * @param mode             运行模式（scan/rewrite/update）
 * @param dryRun           是否只预览
 * @param startedAt        开始时间（ISO-8601）
 * @param durationMillis   耗时（毫秒）
 * @param staticResources  索引到的静态资源数
 * @param scannedFiles     扫描的代码/文本文件数
 * @param skippedFiles     跳过的文件数
 * @param matched          已匹配但没有缓存戳的引用数
 * @param current          缓存戳已是最新的引用数
 * @param stale            缓存戳过期的引用数
 * @param unmatched        未匹配的引用数
 * @param ambiguous        冲突的引用数
 * @param inserted         新增缓存戳的引用数
 * @param updated          更新缓存戳的引用数
 * @param references       每个引用的处理结果
 * @param files            每个被改写文件的结果
 * @param warnings         非致命告警
 */
public record CachebustReport(
        String mode,
        boolean dryRun,
        String startedAt,
        long durationMillis,
        int staticResources,
        int scannedFiles,
        int skippedFiles,
        int matched,
        int current,
        int stale,
        int unmatched,
        int ambiguous,
        int inserted,
        int updated,
        List<ReferenceReport> references,
        List<FilePatchReport> files,
        List<String> warnings
) {

    /**
     * 是否存在需要人工关注的问题（未匹配、冲突或文件被跳过/失败）。
     */
    public boolean hasProblems() {
        if (unmatched > 0 || ambiguous > 0) {
            return true;
        }
        for (FilePatchReport file : files) {
            if (file.status() != FilePatchStatus.WRITTEN && file.status() != FilePatchStatus.PREVIEW) {
                return true;
            }
        }
        return false;
    }
}
