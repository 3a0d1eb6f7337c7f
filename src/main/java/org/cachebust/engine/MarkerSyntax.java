package org.cachebust.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 缓存戳语法：解析、剥离与改写 URL 字面量中的缓存戳。
 * <p>
 * 全部是作用于字符串的纯函数，改动只发生在字面量内部，不影响字面量之外的任何字节。
 * <ul>
 *   <li>查询参数形式：{@code path?_cb_=TOKEN&a=b}，新增时作为第一个参数插入。</li>
 *   <li>文件名形式：{@code dir/app_cb_TOKEN.js}，插入在最后一个扩展名之前。</li>
 * </ul>
 */
public final class MarkerSyntax {

    private final String markerToken;
    private final Pattern filenamePattern;

    public MarkerSyntax(String markerToken) {
        if (markerToken == null || markerToken.isBlank()) {
            throw new IllegalArgumentException("缓存戳标记不能为空（app.cachebust.marker-token）");
        }
        this.markerToken = markerToken;
        // 贪婪匹配 stem，取最后一次出现的标记；stem 不能为空
        this.filenamePattern = Pattern.compile(
                "^(?<stem>.+)" + Pattern.quote(markerToken) + "(?<token>[A-Za-z0-9]{0,64})(?<ext>\\.[^./]+)$");
    }

    public String markerToken() {
        return markerToken;
    }

    /**
     * 读取已存在的缓存戳；两种写法同时存在时以文件名形式为准。
     */
    public CachebustMarker find(String path, String query) {
        Matcher fn = filenamePattern.matcher(lastSegment(path));
        if (fn.matches()) {
            return new CachebustMarker(MarkerStyle.FILENAME, fn.group("token"));
        }
        for (String param : queryParams(query)) {
            String token = queryParamToken(param);
            if (token != null) {
                return new CachebustMarker(MarkerStyle.QUERY, token);
            }
        }
        return null;
    }

    /**
     * 去掉路径中的文件名形式缓存戳，得到用于查找的“干净”路径。
     */
    public String stripFromPath(String path) {
        String segment = lastSegment(path);
        Matcher fn = filenamePattern.matcher(segment);
        if (!fn.matches()) {
            return path;
        }
        String dir = path.substring(0, path.length() - segment.length());
        return dir + fn.group("stem") + fn.group("ext");
    }

    /**
     * 去掉查询串中的缓存戳参数；剩余参数为空时连同 {@code ?} 一起去掉。
     */
    public String stripFromQuery(String query) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String param : queryParams(query)) {
            if (queryParamToken(param) == null) {
                kept.add(param);
            }
        }
        if (kept.isEmpty()) {
            return "";
        }
        return "?" + String.join("&", kept);
    }

    /**
     * 生成带指定缓存戳的新字面量。
     * <p>
     * 已有同形式的缓存戳时原地替换值；已有另一种形式时先剥离再按目标形式插入（同一引用不会混用两种形式）。
     *
     * @param path     路径部分（可能含文件名形式缓存戳）
     * @param query    查询串（含前导 {@code ?}，可为空字符串）
     * @param fragment 片段（含前导 {@code #}，可为空字符串）
     * @param style    目标形式
     * @param token    新缓存戳
     */
    public String render(String path, String query, String fragment, MarkerStyle style, String token) {
        String q = query == null ? "" : query;
        String f = fragment == null ? "" : fragment;
        if (style == MarkerStyle.QUERY) {
            String cleanPath = stripFromPath(path);
            return cleanPath + setQueryToken(q, token) + f;
        }
        return setFilenameToken(path, token) + stripFromQuery(q) + f;
    }

    private String setQueryToken(String query, String token) {
        String assignment = markerToken + "=" + token;
        if (query.isEmpty() || "?".equals(query)) {
            return "?" + assignment;
        }
        List<String> params = queryParams(query);
        boolean replaced = false;
        List<String> result = new ArrayList<>(params.size() + 1);
        for (String param : params) {
            if (queryParamToken(param) != null) {
                if (!replaced) {
                    result.add(assignment);
                    replaced = true;
                }
                continue;
            }
            result.add(param);
        }
        if (!replaced) {
            result.add(0, assignment);
        }
        return "?" + String.join("&", result);
    }

    private String setFilenameToken(String path, String token) {
        String clean = stripFromPath(path);
        String segment = lastSegment(clean);
        String dir = clean.substring(0, clean.length() - segment.length());
        int dot = segment.lastIndexOf('.');
        if (dot <= 0) {
            return dir + segment + markerToken + token;
        }
        return dir + segment.substring(0, dot) + markerToken + token + segment.substring(dot);
    }

    /**
     * 查询参数是缓存戳时返回其值（{@code _cb_} 无值时为空字符串），否则返回 null。
     */
    private String queryParamToken(String param) {
        if (param.equals(markerToken)) {
            return "";
        }
        if (param.startsWith(markerToken + "=")) {
            String value = param.substring(markerToken.length() + 1);
            return value.chars().allMatch(c -> Character.isLetterOrDigit(c) && c < 128) ? value : null;
        }
        return null;
    }

    private static List<String> queryParams(String query) {
        if (query == null || query.length() <= 1) {
            return List.of();
        }
        String body = query.startsWith("?") ? query.substring(1) : query;
        List<String> params = new ArrayList<>();
        for (String part : body.split("&", -1)) {
            if (!part.isEmpty()) {
                params.add(part);
            }
        }
        return params;
    }

    static String lastSegment(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
