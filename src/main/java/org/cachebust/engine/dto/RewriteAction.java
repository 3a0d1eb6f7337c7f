package org.cachebust.engine.dto;

/**
 * 针对单个引用采取的动作。
 */
public enum RewriteAction {

    /**
     * 新增缓存戳。
     */
    INSERT,

    /**
     * 更新已有缓存戳（包括在两种写法之间转换）。
     */
    UPDATE,

    /**
     * 保持原样。
     */
    LEAVE
}
