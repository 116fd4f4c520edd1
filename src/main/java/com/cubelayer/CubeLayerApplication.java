package com.cubelayer;

import com.cubelayer.config.Config;
import com.cubelayer.meta.Loader;
import com.cubelayer.meta.SchemaModel;
import com.cubelayer.model.PrimaryKeyPolicy;
import com.cubelayer.query.QueryAssembler;
import com.cubelayer.sql.SqlDialectAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.io.IOException;

@SpringBootApplication
public class CubeLayerApplication {
    private static final Logger logger = LoggerFactory.getLogger(CubeLayerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CubeLayerApplication.class, args);
    }

    @Bean
    public Loader cubeLoader(Config config) {
        String filePath = config.getSchemaFilePath();
        Loader loader = new Loader(filePath, PrimaryKeyPolicy.fromString(config.getPrimaryKeyPolicy()));
        try {
            SchemaModel schema = loader.load();
            logger.info("Cube schema loaded successfully: {} cubes active, {} rejected",
                schema.getCubes().size(), schema.getRejected().size());
        } catch (IOException e) {
            logger.error("Failed to load cube declarations from: {}", filePath, e);
            throw new RuntimeException("Failed to load cube declarations: " + e.getMessage(), e);
        }
        return loader;
    }

    @Bean
    public QueryAssembler queryAssembler(Config config) {
        SqlDialectAdapter dialect = SqlDialectAdapter.forName(config.getDialect());
        logger.info("SQL dialect: {}, default limit {}, max limit {}",
            dialect.getDatabaseType(), config.getDefaultLimit(), config.getMaxLimit());
        return new QueryAssembler(dialect, config.getDefaultLimit(), config.getMaxLimit());
    }
}
