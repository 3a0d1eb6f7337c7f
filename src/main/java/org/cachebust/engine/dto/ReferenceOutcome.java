package org.cachebust.engine.dto;

/**
 * 单个引用的解析结论。
 */
public enum ReferenceOutcome {

    /**
     * 找到了对应资源，但 URL 尚无缓存戳。
     */
    MATCHED,

    /**
     * 已有缓存戳且与当前资源状态一致。
     */
    CURRENT,

    /**
     * 已有缓存戳但资源已变化。
     */
    STALE,

    /**
     * 未找到对应资源（包括未配置的 multibust 占位符）。
     */
    UNMATCHED,

    /**
     * 匹配到多个内容不同的资源，需要人工调整配置。
     */
    AMBIGUOUS
}
