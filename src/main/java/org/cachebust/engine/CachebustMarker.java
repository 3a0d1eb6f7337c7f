package org.cachebust.engine;

/**
 * URL 中已存在的缓存戳。
 *
 * @param style 写法（查询参数或文件名内嵌）
 * @param token 缓存戳值（可能为空字符串，例如 {@code ?_cb_} 这样只写了标记没有值）
 */
public record CachebustMarker(MarkerStyle style, String token) {
}
