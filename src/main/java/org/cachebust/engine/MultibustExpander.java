package org.cachebust.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * multibust 展开：把含占位符的路径按配置展开成一组候选路径。
 * <p>
 * 纯函数，无内部迭代状态：
 * <ul>
 *   <li>不含任何占位符：原样返回单个候选。</li>
 *   <li>含已配置的占位符：每个替换值生成一个候选（多个占位符按配置顺序做笛卡尔积）。</li>
 *   <li>含未配置的模板占位符（{@code {{..}}}、{@code ${..}}、{@code {%..%}}、{@code <%..%>}）：展开失败，不做猜测。</li>
 * </ul>
 */
public final class MultibustExpander {

    /**
     * 常见模板语言的变量写法，用于识别“未配置的占位符”。
     */
    public static final Pattern TEMPLATE_PLACEHOLDER = Pattern.compile(
            "\\{\\{[^{}\\r\\n]*\\}\\}|\\$\\{[^{}\\r\\n]*\\}|\\{%[^%\\r\\n]*%\\}|<%[^%\\r\\n]*%>");

    private final MultibustRules rules;

    public MultibustExpander(MultibustRules rules) {
        this.rules = rules;
    }

    public Expansion expand(String path) {
        List<MultibustRules.Rule> present = new ArrayList<>();
        String remainder = path;
        for (MultibustRules.Rule rule : rules.rules()) {
            if (path.contains(rule.placeholder())) {
                present.add(rule);
                remainder = remainder.replace(rule.placeholder(), "");
            }
        }

        Matcher unknown = TEMPLATE_PLACEHOLDER.matcher(remainder);
        if (unknown.find()) {
            return Expansion.failed("未配置的 multibust 占位符：" + unknown.group());
        }
        if (present.isEmpty()) {
            return new Expansion(false, List.of(new Candidate(path, "")), null);
        }

        List<Candidate> candidates = new ArrayList<>();
        candidates.add(new Candidate(path, ""));
        for (MultibustRules.Rule rule : present) {
            List<Candidate> next = new ArrayList<>(candidates.size() * rule.values().size());
            for (Candidate candidate : candidates) {
                for (String value : rule.values()) {
                    String key = candidate.variantKey().isEmpty() ? value : candidate.variantKey() + "," + value;
                    next.add(new Candidate(candidate.path().replace(rule.placeholder(), value), key));
                }
            }
            candidates = next;
        }
        return new Expansion(true, List.copyOf(candidates), null);
    }

    /**
     * 展开结果。
     *
     * @param multibust  是否由占位符展开得到
     * @param candidates 候选路径（保持配置顺序）
     * @param failure    展开失败原因（成功时为 null）
     */
    public record Expansion(boolean multibust, List<Candidate> candidates, String failure) {

        static Expansion failed(String reason) {
            return new Expansion(false, List.of(), reason);
        }

        public boolean failed() {
            return failure != null;
        }
    }

    /**
     * 单个候选路径。
     *
     * @param path       替换后的路径
     * @param variantKey 替换值组合（逗号分隔；非 multibust 时为空字符串）
     */
    public record Candidate(String path, String variantKey) {
    }
}
