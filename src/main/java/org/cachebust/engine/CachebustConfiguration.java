package org.cachebust.engine;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;

/**
 * 缓存戳引擎的 Bean 装配。
 * <p>
 * 目录、multibust、摘要算法与缓存戳长度都在这里完成校验：非法配置会让容器启动失败，而不是等到第一次扫描时才暴露。
 */
@Configuration(proxyBeanMethods = false)
public class CachebustConfiguration {

    @Bean
    public ProjectPathResolver projectPathResolver(CachebustProperties properties) {
        return new ProjectPathResolver(properties);
    }

    @Bean
    public MultibustRules multibustRules(CachebustProperties properties) {
        return MultibustRules.from(properties.getMultibust());
    }

    @Bean
    public TokenGenerator tokenGenerator(CachebustProperties properties) {
        return new TokenGenerator(properties.getHashFunction(), properties.getHashLength());
    }

    @Bean
    public CachebustEngine cachebustEngine(CachebustProperties properties,
                                           ProjectPathResolver resolver,
                                           MultibustRules multibustRules,
                                           TokenGenerator tokenGenerator) {
        return new CachebustEngine(properties, resolver, multibustRules, tokenGenerator);
    }

    @Bean
    public ProjectInitializer projectInitializer(CachebustProperties properties, MultibustRules multibustRules) {
        return new ProjectInitializer(properties, multibustRules);
    }

    static Charset fileCharset(String fileEncoding) {
        try {
            return Charset.forName(fileEncoding);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new IllegalStateException("不支持的文件编码（app.cachebust.file-encoding）：" + fileEncoding, e);
        }
    }
}
