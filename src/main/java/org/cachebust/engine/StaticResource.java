package org.cachebust.engine;

import java.nio.file.Path;

/**
 * 静态资源根目录下的一个文件（一次运行内不可变）。
 *
 * @param rootOrder      所属根目录在配置中的顺序
 * @param rootId         所属根目录标识（static0、static1...）
 * @param relativePath   相对根目录的路径（统一使用 / 分隔，根目录内唯一）
 * @param absolutePath   绝对路径
 * @param displayPath    相对项目根目录的展示路径
 * @param size           文件大小（字节）
 * @param modifiedMillis 最后修改时间（毫秒时间戳）
 * @param digest         文件内容摘要（十六进制）
 */
public record StaticResource(
        int rootOrder,
        String rootId,
        String relativePath,
        Path absolutePath,
        String displayPath,
        long size,
        long modifiedMillis,
        String digest
) {

    public String fileName() {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? relativePath : relativePath.substring(slash + 1);
    }

    /**
     * 相对路径是否以给定的“段后缀”结尾（按 / 分段对齐，例如 {@code js/app.js} 匹配 {@code static/js/app.js}）。
     */
    public boolean endsWithSegments(String suffix) {
        if (relativePath.equals(suffix)) {
            return true;
        }
        return relativePath.endsWith("/" + suffix);
    }
}
