package com.cubelayer.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 读取 .env 文件。查找顺序：工作目录、上级目录；找不到时只使用系统环境变量。
 */
@Configuration
public class EnvConfig {
    public static final String BEAN_NAME = "envConfig";
    private static final Logger logger = LoggerFactory.getLogger(EnvConfig.class);
    private static volatile Dotenv dotenv;

    @PostConstruct
    public void loadEnv() {
        Path workDir = Paths.get(System.getProperty("user.dir")).toAbsolutePath();
        Path envDir = null;
        for (Path candidate : new Path[]{workDir, workDir.getParent()}) {
            if (candidate != null && Files.isRegularFile(candidate.resolve(".env"))) {
                envDir = candidate;
                break;
            }
        }

        if (envDir == null) {
            logger.info(".env file not found, using system environment variables and defaults");
            dotenv = Dotenv.configure().ignoreIfMissing().load();
            return;
        }

        logger.info("Loading .env file from directory: {}", envDir);
        dotenv = Dotenv.configure()
            .directory(envDir.toString())
            .filename(".env")
            .ignoreIfMissing()
            .load();

        // .env 中的变量作为系统属性暴露给 Spring 占位符，已有的系统属性优先
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE).forEach(entry -> {
            if (System.getProperty(entry.getKey()) == null) {
                System.setProperty(entry.getKey(), entry.getValue());
            }
        });
    }

    public static String get(String key) {
        Dotenv current = dotenv;
        return current != null ? current.get(key) : System.getenv(key);
    }

    public static String get(String key, String defaultValue) {
        String value = get(key);
        return value != null && !value.isEmpty() ? value : defaultValue;
    }
}
