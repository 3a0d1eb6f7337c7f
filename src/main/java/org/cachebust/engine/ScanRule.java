package org.cachebust.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 声明式的引用识别规则：分隔符集合 + 静态资源后缀集合 + 占位符写法。
 * <p>
 * 一个“URL 字面量”是一段不含分隔符的连续字符（占位符作为整体，即使其中含有分隔符/空白），要求：
 * <ul>
 *   <li>前一个字符是分隔符、{@code =} 或文本开头；后一个字符是分隔符或文本结尾。</li>
 *   <li>路径部分以已知的静态资源后缀结尾（{@code =}、{@code ?}、{@code #} 不属于路径）。</li>
 *   <li>路径后可跟查询串（可能含 {@code _cb_=TOKEN}）与片段。</li>
 * </ul>
 * 不要求前面出现 {@code src=}、{@code url(} 之类的特定写法；规则按字符工作，与文件类型无关。
 * 传入的文本应是按 ISO-8859-1 解码的字节视图，这样匹配得到的偏移量就是字节偏移量。
 */
public final class ScanRule {

    private final Pattern pattern;

    public ScanRule(String delimiters, Collection<String> extensions, Collection<String> placeholders) {
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("静态资源后缀列表不能为空");
        }
        this.pattern = Pattern.compile(buildRegex(delimiters == null ? "" : delimiters, extensions, placeholders));
    }

    public Pattern pattern() {
        return pattern;
    }

    /**
     * 在文本中查找所有 URL 字面量（按出现顺序，互不重叠）。
     */
    public List<LiteralSpan> find(CharSequence text) {
        List<LiteralSpan> result = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String path = matcher.group("path");
            if (path.regionMatches(true, 0, "data:", 0, 5)) {
                continue;
            }
            result.add(new LiteralSpan(
                    matcher.start(),
                    matcher.end(),
                    path,
                    nullToEmpty(matcher.group("query")),
                    nullToEmpty(matcher.group("fragment"))
            ));
        }
        return result;
    }

    private static String buildRegex(String delimiters, Collection<String> extensions, Collection<String> placeholders) {
        StringBuilder delimClass = new StringBuilder("\\s");
        for (int i = 0; i < delimiters.length(); i++) {
            char c = delimiters.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            delimClass.append(escapeForClass(c));
        }
        String delims = delimClass.toString();

        StringBuilder units = new StringBuilder();
        if (placeholders != null) {
            List<String> sorted = new ArrayList<>(placeholders);
            sorted.sort(Comparator.comparingInt(String::length).reversed());
            for (String placeholder : sorted) {
                units.append(Pattern.quote(placeholder)).append('|');
            }
        }
        units.append(MultibustExpander.TEMPLATE_PLACEHOLDER.pattern()).append('|');

        String pathUnit = "(?:" + units + "[^" + delims + "=?#])";
        String queryUnit = "(?:" + units + "[^" + delims + "#])";

        List<String> exts = new ArrayList<>();
        for (String ext : extensions) {
            exts.add(Pattern.quote(ext.toLowerCase(Locale.ROOT)));
        }
        exts.sort(Comparator.comparingInt(String::length).reversed());

        return "(?<![^" + delims + "=])"
                + "(?<path>" + pathUnit + "+?\\.(?i:" + String.join("|", exts) + "))"
                + "(?<query>\\?" + queryUnit + "*)?"
                + "(?<fragment>#[^" + delims + "]*)?"
                + "(?![^" + delims + "])";
    }

    private static String escapeForClass(char c) {
        if ("\\[]^-&".indexOf(c) >= 0) {
            return "\\" + c;
        }
        return String.valueOf(c);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * 一个字面量在文本中的位置与分解结果。
     *
     * @param start    起始偏移（包含）
     * @param end      结束偏移（不包含）
     * @param path     路径部分
     * @param query    查询串（含 {@code ?}，可为空字符串）
     * @param fragment 片段（含 {@code #}，可为空字符串）
     */
    public record LiteralSpan(int start, int end, String path, String query, String fragment) {
    }
}
