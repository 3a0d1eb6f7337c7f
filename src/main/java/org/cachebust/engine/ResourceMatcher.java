package org.cachebust.engine;

import java.net.URLDecoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 资源匹配器：把一个引用（必要时先做 multibust 展开）解析为 0 个、1 个或多个静态资源。
 * <p>
 * 单个候选路径的查找顺序：
 * <ol>
 *   <li>去掉已有缓存戳、协议与主机名。</li>
 *   <li>相对引用先按引用文件所在目录解析，命中索引即为结果。</li>
 *   <li>否则按路径段后缀在所有静态根目录中查找，最长后缀优先；同一长度下的多个命中若内容一致则取优先级最高的根目录，
 *       内容不一致则视为冲突。</li>
 * </ol>
 * 聚合策略：显式的一对一引用保持精确；只有 multibust 引用允许扇出到多个资源。
 */
public class ResourceMatcher {

    private static final Pattern SCHEME_AND_HOST = Pattern.compile("^(?:[A-Za-z][A-Za-z0-9+.\\-]*:)?//[^/]*");

    private final ResourceIndex index;
    private final MultibustExpander expander;
    private final MarkerSyntax markers;
    private final Charset charset;

    public ResourceMatcher(ResourceIndex index, MultibustExpander expander, MarkerSyntax markers, Charset charset) {
        this.index = index;
        this.expander = expander;
        this.markers = markers;
        this.charset = charset;
    }

    public MatchResult match(Reference reference) {
        String cleanPath = decode(markers.stripFromPath(reference.path()));
        MultibustExpander.Expansion expansion = expander.expand(cleanPath);
        if (expansion.failed()) {
            return new MatchResult.Unmatched(expansion.failure());
        }

        if (!expansion.multibust()) {
            Lookup lookup = resolveCandidate(reference, expansion.candidates().get(0).path());
            if (lookup.hits().isEmpty()) {
                return new MatchResult.Unmatched("未找到对应的静态资源：" + cleanPath);
            }
            if (lookup.conflict()) {
                return new MatchResult.Ambiguous(lookup.hits());
            }
            return new MatchResult.SingleMatch(lookup.hits().get(0));
        }

        Map<String, StaticResource> byVariant = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        Set<StaticResource> conflicts = new LinkedHashSet<>();
        for (MultibustExpander.Candidate candidate : expansion.candidates()) {
            Lookup lookup = resolveCandidate(reference, candidate.path());
            if (lookup.hits().isEmpty()) {
                missing.add(candidate.variantKey());
            } else if (lookup.conflict()) {
                conflicts.addAll(lookup.hits());
            } else {
                byVariant.put(candidate.variantKey(), lookup.hits().get(0));
            }
        }
        if (!conflicts.isEmpty()) {
            return new MatchResult.Ambiguous(new ArrayList<>(conflicts));
        }
        if (byVariant.isEmpty()) {
            return new MatchResult.Unmatched("multibust 展开后的候选路径均未找到对应的静态资源：" + cleanPath);
        }
        return new MatchResult.MultiMatch(byVariant, missing);
    }

    private Lookup resolveCandidate(Reference reference, String candidatePath) {
        String withoutHost = stripSchemeAndHost(candidatePath);
        boolean relative = withoutHost.equals(candidatePath) && !candidatePath.startsWith("/");

        if (relative && reference.sourceFile() != null && reference.sourceFile().getParent() != null) {
            StaticResource hit = index.byAbsolutePath(resolveSibling(reference.sourceFile().getParent(), candidatePath));
            if (hit != null) {
                return withSameRelativePath(hit);
            }
        }

        List<String> segments = normalizeSegments(withoutHost);
        for (int i = 0; i < segments.size(); i++) {
            String suffix = String.join("/", segments.subList(i, segments.size()));
            List<StaticResource> hits = index.lookupSuffix(suffix);
            if (hits.isEmpty()) {
                continue;
            }
            return aggregate(hits.get(0), hits);
        }
        return new Lookup(List.of(), false);
    }

    /**
     * 相对引用命中后，其它根目录下相同相对路径的资源若内容不同，同样视为冲突。
     */
    private Lookup withSameRelativePath(StaticResource hit) {
        List<StaticResource> hits = new ArrayList<>();
        hits.add(hit);
        for (StaticResource other : index.byRelativePath(hit.relativePath())) {
            if (!other.equals(hit)) {
                hits.add(other);
            }
        }
        return aggregate(hit, hits);
    }

    private static Lookup aggregate(StaticResource preferred, List<StaticResource> hits) {
        Set<String> digests = new LinkedHashSet<>();
        for (StaticResource hit : hits) {
            digests.add(hit.digest());
        }
        if (digests.size() == 1) {
            return new Lookup(List.of(preferred), false);
        }
        return new Lookup(hits, true);
    }

    /**
     * 按引用文件所在目录解析；路径中含 NUL 等非法字符时返回 null，交给后缀查找处理。
     */
    private static Path resolveSibling(Path dir, String candidatePath) {
        try {
            return dir.resolve(candidatePath).normalize();
        } catch (InvalidPathException e) {
            return null;
        }
    }

    static String stripSchemeAndHost(String path) {
        return SCHEME_AND_HOST.matcher(path).replaceFirst("");
    }

    /**
     * 去掉空段与 {@code .}，折叠 {@code ..}（越过开头的 {@code ..} 直接丢弃）。
     */
    static List<String> normalizeSegments(String path) {
        Deque<String> stack = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                stack.pollLast();
                continue;
            }
            stack.addLast(segment);
        }
        return new ArrayList<>(stack);
    }

    /**
     * 字节视图 -> 配置编码的字符串，并解码 {@code %xx} 转义。
     */
    String decode(String latin1) {
        String text = new String(latin1.getBytes(StandardCharsets.ISO_8859_1), charset);
        if (text.indexOf('%') < 0) {
            return text;
        }
        try {
            return URLDecoder.decode(text.replace("+", "%2B"), charset);
        } catch (IllegalArgumentException e) {
            // 非法的 % 转义按原文处理
            return text;
        }
    }

    private record Lookup(List<StaticResource> hits, boolean conflict) {
    }
}
