package org.cachebust.engine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * 哈希工具类：计算文件/字节内容的摘要（十六进制字符串）。
 * <p>
 * 说明：
 * <ul>
 *   <li>支持 crc32（默认，速度快）以及 md5 / sha1 / sha256。</li>
 *   <li>对文件的哈希计算采用流式读取，避免一次性把大文件读入内存。</li>
 *   <li>输出统一为小写十六进制，天然 URL 安全。</li>
 * </ul>
 */
public final class HashingUtils {

    public static final List<String> SUPPORTED_ALGORITHMS = List.of("crc32", "md5", "sha1", "sha256");

    private static final HexFormat HEX = HexFormat.of();

    private HashingUtils() {
    }

    /**
     * 校验并规范化算法名（大小写不敏感，允许 {@code sha-1} 这样的写法）。
     */
    public static String normalizeAlgorithm(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) {
            throw new IllegalArgumentException("摘要算法不能为空");
        }
        String normalized = algorithm.trim().toLowerCase(Locale.ROOT).replace("-", "");
        if (!SUPPORTED_ALGORITHMS.contains(normalized)) {
            throw new IllegalArgumentException("不支持的摘要算法：" + algorithm + "（可选 " + SUPPORTED_ALGORITHMS + "）");
        }
        return normalized;
    }

    public static String digestHex(String algorithm, byte[] bytes) {
        Digester digester = newDigester(algorithm);
        digester.update(bytes, 0, bytes.length);
        return HEX.formatHex(digester.digest());
    }

    public static String digestHex(String algorithm, String text) {
        return digestHex(algorithm, text.getBytes(StandardCharsets.UTF_8));
    }

    public static String digestHex(String algorithm, long value) {
        return digestHex(algorithm, ByteBuffer.allocate(Long.BYTES).putLong(value).array());
    }

    public static String digestHex(String algorithm, Path file) throws IOException {
        Digester digester = newDigester(algorithm);
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) >= 0) {
                digester.update(buffer, 0, read);
            }
        }
        return HEX.formatHex(digester.digest());
    }

    private static Digester newDigester(String algorithm) {
        String normalized = normalizeAlgorithm(algorithm);
        if ("crc32".equals(normalized)) {
            return new Crc32Digester();
        }
        String jcaName = switch (normalized) {
            case "md5" -> "MD5";
            case "sha1" -> "SHA-1";
            default -> "SHA-256";
        };
        try {
            return new MessageDigester(MessageDigest.getInstance(jcaName));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("当前运行环境不支持 " + jcaName + " 摘要算法（MessageDigest）", e);
        }
    }

    private interface Digester {
        void update(byte[] bytes, int offset, int length);

        byte[] digest();
    }

    private static final class Crc32Digester implements Digester {
        private final CRC32 crc = new CRC32();

        @Override
        public void update(byte[] bytes, int offset, int length) {
            crc.update(bytes, offset, length);
        }

        @Override
        public byte[] digest() {
            return ByteBuffer.allocate(Integer.BYTES).putInt((int) crc.getValue()).array();
        }
    }

    private static final class MessageDigester implements Digester {
        private final MessageDigest digest;

        private MessageDigester(MessageDigest digest) {
            this.digest = digest;
        }

        @Override
        public void update(byte[] bytes, int offset, int length) {
            digest.update(bytes, offset, length);
        }

        @Override
        public byte[] digest() {
            return digest.digest();
        }
    }
}
