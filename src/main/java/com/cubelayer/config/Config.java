package com.cubelayer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import jakarta.annotation.PostConstruct;

@Configuration
@DependsOn(EnvConfig.BEAN_NAME)
public class Config {

    @Value("${schema.file.path:./model/cubes}")
    private String schemaFilePath;

    @Value("${schema.primary-key-policy:required}")
    private String primaryKeyPolicy;

    @Value("${compiler.dialect:postgresql}")
    private String dialect;

    @Value("${compiler.default-limit:10000}")
    private int defaultLimit;

    @Value("${compiler.max-limit:50000}")
    private int maxLimit;

    @PostConstruct
    public void init() {
        // .env 文件或环境变量覆盖 application.properties
        String envSchemaPath = EnvConfig.get("CUBE_SCHEMA_PATH");
        if (envSchemaPath != null && !envSchemaPath.isEmpty()) {
            this.schemaFilePath = envSchemaPath;
        }

        String envDialect = EnvConfig.get("CUBE_SQL_DIALECT");
        if (envDialect != null && !envDialect.isEmpty()) {
            this.dialect = envDialect;
        }
    }

    public String getSchemaFilePath() {
        return schemaFilePath;
    }

    public String getPrimaryKeyPolicy() {
        return primaryKeyPolicy;
    }

    public String getDialect() {
        return dialect;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }
}
