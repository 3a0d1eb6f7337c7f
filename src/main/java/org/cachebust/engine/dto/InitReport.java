package org.cachebust.engine.dto;

import java.util.List;

/**
 * {@code init} 的返回结果。
 *
 * @param configPath      配置文件路径（相对项目根目录）
 * @param written         是否已写入（dry-run 或文件已存在时为 false）
 * @param staticDirs      推断出的静态资源根目录
 * @param codeDirs        含有静态资源引用的代码目录
 * @param staticFiletypes 项目中实际出现的静态资源扩展名
 * @param codeFiletypes   含引用的代码文件扩展名
 * @param references      发现的引用数
 * @param content         配置文件内容
 * @param warnings        非致命告警
 */
public record InitReport(
        String configPath,
        boolean written,
        List<String> staticDirs,
        List<String> codeDirs,
        List<String> staticFiletypes,
        List<String> codeFiletypes,
        int references,
        String content,
        List<String> warnings
) {
}
