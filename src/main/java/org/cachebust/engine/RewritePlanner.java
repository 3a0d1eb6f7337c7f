package org.cachebust.engine;

import org.cachebust.engine.dto.ReferenceOutcome;
import org.cachebust.engine.dto.RewriteAction;

import java.util.ArrayList;
import java.util.List;

/**
 * 改写决策：根据运行模式、匹配结果与已有缓存戳，决定每个引用是新增、更新还是保持原样。
 * <ul>
 *   <li>{@code scan}：只报告，不产生任何改写。</li>
 *   <li>{@code rewrite}：没有缓存戳则新增；缓存戳过期或写法与配置不同则更新。</li>
 *   <li>{@code update}：只更新已有且过期的缓存戳，保持原写法，从不新增。</li>
 * </ul>
 * 未匹配与冲突的引用在任何模式下都不会被改写。
 */
public class RewritePlanner {

    private final MarkerSyntax markers;
    private final TokenGenerator tokens;
    private final MarkerStyle configuredStyle;

    public RewritePlanner(MarkerSyntax markers, TokenGenerator tokens, MarkerStyle configuredStyle) {
        this.markers = markers;
        this.tokens = tokens;
        this.configuredStyle = configuredStyle;
    }

    public Decision plan(RunMode mode, Reference reference, MatchResult match) {
        if (match instanceof MatchResult.Unmatched unmatched) {
            return Decision.leave(reference, match, ReferenceOutcome.UNMATCHED, null, unmatched.reason());
        }
        if (match instanceof MatchResult.Ambiguous ambiguous) {
            List<String> paths = new ArrayList<>();
            for (StaticResource candidate : ambiguous.candidates()) {
                paths.add(candidate.displayPath());
            }
            String detail = "匹配到多个内容不同的静态资源，请调整 static-dirs 或改用更完整的路径：" + String.join(", ", paths);
            return Decision.leave(reference, match, ReferenceOutcome.AMBIGUOUS, null, detail);
        }

        String token = tokens.token(match).value();
        String detail = null;
        if (match instanceof MatchResult.MultiMatch multi && !multi.missingVariants().isEmpty()) {
            detail = "以下 multibust 变体未找到静态资源：" + String.join(" | ", multi.missingVariants());
        }

        CachebustMarker existing = reference.marker();
        ReferenceOutcome outcome;
        if (existing == null) {
            outcome = ReferenceOutcome.MATCHED;
        } else if (token.equals(existing.token())) {
            outcome = ReferenceOutcome.CURRENT;
        } else {
            outcome = ReferenceOutcome.STALE;
        }

        MarkerStyle target = targetStyle(mode, outcome, existing);
        if (target == null) {
            return Decision.leave(reference, match, outcome, token, detail);
        }
        String replacement = markers.render(reference.path(), reference.query(), reference.fragment(), target, token);
        if (replacement.equals(reference.literal())) {
            return Decision.leave(reference, match, outcome, token, detail);
        }
        RewriteAction action = existing == null ? RewriteAction.INSERT : RewriteAction.UPDATE;
        return new Decision(reference, match, outcome, action, token, RewriteEdit.of(reference, replacement), detail);
    }

    /**
     * 需要改写时返回目标写法，否则返回 null。
     */
    private MarkerStyle targetStyle(RunMode mode, ReferenceOutcome outcome, CachebustMarker existing) {
        return switch (mode) {
            case REWRITE -> existing == null || outcome == ReferenceOutcome.STALE || existing.style() != configuredStyle
                    ? configuredStyle
                    : null;
            case UPDATE -> outcome == ReferenceOutcome.STALE ? existing.style() : null;
            default -> null;
        };
    }

    /**
     * 单个引用的决策结果。
     *
     * @param reference 引用
     * @param match     匹配结果
     * @param outcome   解析结论
     * @param action    采取的动作
     * @param token     按当前资源计算出的缓存戳（未匹配/冲突时为 null）
     * @param edit      需要落盘的改写（不改写时为 null）
     * @param detail    补充说明
     */
    public record Decision(
            Reference reference,
            MatchResult match,
            ReferenceOutcome outcome,
            RewriteAction action,
            String token,
            RewriteEdit edit,
            String detail
    ) {

        static Decision leave(Reference reference, MatchResult match, ReferenceOutcome outcome, String token, String detail) {
            return new Decision(reference, match, outcome, RewriteAction.LEAVE, token, null, detail);
        }
    }
}
