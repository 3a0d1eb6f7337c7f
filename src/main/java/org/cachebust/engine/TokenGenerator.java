package org.cachebust.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 缓存戳生成器。
 * <p>
 * 缓存戳 = 修改时间摘要的前 {@code statLength} 位 + 内容摘要的前 {@code hashLength - statLength} 位（十六进制），
 * 其中 {@code statLength = min(4, hashLength / 2)}。相同的（修改时间，内容摘要）总是得到相同的缓存戳，跨进程也一致。
 * <p>
 * multibust：修改时间取最大值，内容摘要取“排序后各摘要拼接”的摘要，与资源顺序无关；
 * 任意一个变体变化都会改变整体缓存戳（代价是其它未变化的变体也会随之失效）。
 */
public class TokenGenerator {

    private final String hashFunction;
    private final int statLength;
    private final int digestLength;

    public TokenGenerator(String hashFunction, int hashLength) {
        if (hashLength < 4 || hashLength > 64) {
            throw new IllegalArgumentException("缓存戳长度必须在 4~64 之间（app.cachebust.hash-length）：" + hashLength);
        }
        this.hashFunction = HashingUtils.normalizeAlgorithm(hashFunction);
        this.statLength = Math.min(4, hashLength / 2);
        this.digestLength = hashLength - statLength;
    }

    public CachebustToken token(StaticResource resource) {
        return encode(resource.modifiedMillis(), resource.digest());
    }

    public CachebustToken token(List<StaticResource> resources) {
        if (resources == null || resources.isEmpty()) {
            throw new IllegalArgumentException("计算缓存戳至少需要一个静态资源");
        }
        if (resources.size() == 1) {
            return token(resources.get(0));
        }
        long newest = Long.MIN_VALUE;
        List<String> digests = new ArrayList<>(resources.size());
        for (StaticResource resource : resources) {
            newest = Math.max(newest, resource.modifiedMillis());
            digests.add(resource.digest());
        }
        Collections.sort(digests);
        return encode(newest, HashingUtils.digestHex(hashFunction, String.join("", digests)));
    }

    public CachebustToken token(MatchResult match) {
        return token(match.resources());
    }

    CachebustToken encode(long modifiedMillis, String digest) {
        String stat = HashingUtils.digestHex(hashFunction, modifiedMillis);
        String value = fit(stat, statLength) + fit(digest, digestLength);
        return new CachebustToken(value, modifiedMillis, digest);
    }

    /**
     * 截取到指定长度；摘要本身较短（例如 crc32 只有 8 位）时循环补齐，保证缓存戳定长。
     */
    private static String fit(String hex, int length) {
        if (hex.length() >= length) {
            return hex.substring(0, length);
        }
        StringBuilder sb = new StringBuilder(length);
        while (sb.length() < length) {
            sb.append(hex);
        }
        return sb.substring(0, length);
    }

    /**
     * 缓存戳。
     *
     * @param value          缓存戳文本（定长，小写十六进制）
     * @param modifiedMillis 参与计算的修改时间（multibust 时为最大值）
     * @param digest         参与计算的内容摘要（multibust 时为组合摘要）
     */
    public record CachebustToken(String value, long modifiedMillis, String digest) {
    }
}
