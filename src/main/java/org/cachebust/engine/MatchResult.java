package org.cachebust.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个引用的解析结果（每次运行对每个引用重新生成，创建后不可变）。
 */
public sealed interface MatchResult
        permits MatchResult.Unmatched, MatchResult.SingleMatch, MatchResult.MultiMatch, MatchResult.Ambiguous {

    /**
     * 参与计算缓存戳的资源（未匹配/冲突时为空）。
     */
    List<StaticResource> resources();

    /**
     * 未找到对应的静态资源（包括 multibust 占位符未配置）。
     */
    record Unmatched(String reason) implements MatchResult {
        @Override
        public List<StaticResource> resources() {
            return List.of();
        }
    }

    /**
     * 精确匹配到一个资源。
     */
    record SingleMatch(StaticResource resource) implements MatchResult {
        @Override
        public List<StaticResource> resources() {
            return List.of(resource);
        }
    }

    /**
     * multibust 展开后匹配到的一组资源。
     *
     * @param byVariant       替换值组合 -> 资源（保持配置顺序）
     * @param missingVariants 未找到资源的替换值组合
     */
    record MultiMatch(Map<String, StaticResource> byVariant, List<String> missingVariants) implements MatchResult {
        public MultiMatch {
            byVariant = Collections.unmodifiableMap(new LinkedHashMap<>(byVariant));
            missingVariants = List.copyOf(missingVariants);
        }

        @Override
        public List<StaticResource> resources() {
            return new ArrayList<>(byVariant.values());
        }
    }

    /**
     * 非 multibust 引用匹配到多个内容不同的资源：需要人工调整配置，永远不会自动改写。
     *
     * @param candidates 冲突的资源
     */
    record Ambiguous(List<StaticResource> candidates) implements MatchResult {
        public Ambiguous {
            candidates = List.copyOf(candidates);
        }

        @Override
        public List<StaticResource> resources() {
            return List.of();
        }
    }
}
