package org.cachebust.engine;

/**
 * 缓存戳在 URL 中的两种写法。
 */
public enum MarkerStyle {

    /**
     * 查询参数形式：{@code app.js?_cb_=0123abcd} 或 {@code app.js?v=1&_cb_=0123abcd}。
     */
    QUERY,

    /**
     * 文件名内嵌形式：{@code app_cb_0123abcd.js}（需要服务端重写规则把它映射回 {@code app.js}）。
     */
    FILENAME
}
