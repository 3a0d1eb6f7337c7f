package org.cachebust.engine;

/**
 * 一次运行的工作模式。
 */
public enum RunMode {

    /**
     * 扫描整个项目并生成 {@code cachebust.properties} 初始配置。
     */
    INIT,

    /**
     * 只报告，不改写。
     */
    SCAN,

    /**
     * 为没有缓存戳的引用插入缓存戳，并更新已有的缓存戳。
     */
    REWRITE,

    /**
     * 只更新已有的缓存戳，不新增。
     */
    UPDATE;

    public boolean edits() {
        return this == REWRITE || this == UPDATE;
    }
}
