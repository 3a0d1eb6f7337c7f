package org.cachebust;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CachebustServerApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        ConfigurableApplicationContext context = SpringApplication.run(CachebustServerApplication.class, args);
        // 批处理模式执行完即退出；否则保持运行，作为 MCP Server 等待调用
        if (context.getEnvironment().containsProperty("app.cachebust.cli.mode")) {
            System.exit(SpringApplication.exit(context));
        }
    }

    /**
     * 提前创建日志目录（避免 logback 的 RollingFileAppender 因目录不存在而初始化失败）。
     * <p>
     * 规则与 logback-spring.xml 保持一致：优先读取系统属性/环境变量 LOG_PATH，默认使用 ./logs
     */
    private static void ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (Exception e) {
            // 目录创建失败时 logback 只会丢失文件输出，控制台输出不受影响
            System.err.println("无法创建日志目录 " + logPath + "：" + e.getMessage());
        }
    }
}
