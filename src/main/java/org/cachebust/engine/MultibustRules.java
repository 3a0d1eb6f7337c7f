package org.cachebust.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 经过校验的 multibust 配置：占位符 -> 有序替换值列表。
 * <p>
 * 校验规则（任何一条不满足都属于致命配置错误，启动阶段直接失败）：
 * <ul>
 *   <li>占位符不能为空白，也不能重复（去除首尾空白后比较）。</li>
 *   <li>一个占位符不能包含另一个占位符，否则替换顺序会影响结果。</li>
 *   <li>替换值列表不能为空，不能包含 null 或重复值。</li>
 * </ul>
 */
public final class MultibustRules {

    private static final MultibustRules EMPTY = new MultibustRules(List.of());

    private final List<Rule> rules;

    private MultibustRules(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static MultibustRules empty() {
        return EMPTY;
    }

    public static MultibustRules from(Map<String, List<String>> configured) {
        if (configured == null || configured.isEmpty()) {
            return EMPTY;
        }
        List<Rule> rules = new ArrayList<>(configured.size());
        Set<String> seenPlaceholders = new HashSet<>();
        for (Map.Entry<String, List<String>> entry : configured.entrySet()) {
            String placeholder = entry.getKey();
            if (placeholder == null || placeholder.isBlank()) {
                throw new IllegalStateException("multibust 占位符不能为空（app.cachebust.multibust）");
            }
            if (!seenPlaceholders.add(placeholder.trim())) {
                throw new IllegalStateException("multibust 占位符重复：" + placeholder);
            }
            List<String> values = entry.getValue();
            if (values == null || values.isEmpty()) {
                throw new IllegalStateException("multibust 占位符 " + placeholder + " 的替换值列表不能为空");
            }
            Set<String> unique = new LinkedHashSet<>();
            for (String value : values) {
                if (value == null) {
                    throw new IllegalStateException("multibust 占位符 " + placeholder + " 的替换值不能为 null");
                }
                if (!unique.add(value)) {
                    throw new IllegalStateException("multibust 占位符 " + placeholder + " 的替换值重复：" + value);
                }
            }
            rules.add(new Rule(placeholder, List.copyOf(unique)));
        }
        for (Rule a : rules) {
            for (Rule b : rules) {
                if (a != b && a.placeholder().contains(b.placeholder())) {
                    throw new IllegalStateException("multibust 占位符相互包含：" + a.placeholder() + " / " + b.placeholder());
                }
            }
        }
        return new MultibustRules(rules);
    }

    public List<Rule> rules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public List<String> placeholders() {
        List<String> result = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            result.add(rule.placeholder());
        }
        return result;
    }

    /**
     * 单条规则。
     *
     * @param placeholder 占位符（按字面量匹配，例如 {@code {{lang}}}）
     * @param values      替换值（有序、非空、无重复）
     */
    public record Rule(String placeholder, List<String> values) {
    }
}
