package com.cubelayer.meta;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

public class Parser {
    private final Path path;
    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public Parser(String path) {
        this(Paths.get(path));
    }

    public Parser(Path path) {
        this.path = path;
        // 未知字段忽略（兼容 preAggregations 等不参与编译的声明）
        // 同一映射中重复的键直接判为解析失败
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.yamlMapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
        this.jsonMapper = new ObjectMapper();
        this.jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.jsonMapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    /**
     * 列出需要解析的声明文件：单个文件，或目录下的 *.yml / *.yaml / *.json（按文件名排序）
     */
    public List<Path> listFiles() throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("cube declarations not found: " + path);
        }
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }
        List<Path> files = new ArrayList<>();
        try (Stream<Path> stream = Files.list(path)) {
            stream.filter(Files::isRegularFile)
                .filter(Parser::isDeclarationFile)
                .sorted()
                .forEach(files::add);
        }
        return files;
    }

    public CubeSchema parse(Path file) throws IOException {
        ObjectMapper mapper = file.getFileName().toString().endsWith(".json") ? jsonMapper : yamlMapper;
        CubeSchema schema = mapper.readValue(file.toFile(), CubeSchema.class);
        if (schema == null) {
            schema = new CubeSchema();
        }
        if (schema.getCubes() != null) {
            for (CubeDeclaration cube : schema.getCubes()) {
                if (cube != null) {
                    cube.setSource(file.toString());
                }
            }
        }
        return schema;
    }

    public CubeSchema parseYaml(String yaml) throws IOException {
        return yamlMapper.readValue(yaml, CubeSchema.class);
    }

    public Path getPath() {
        return path;
    }

    private static boolean isDeclarationFile(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".yml") || name.endsWith(".yaml") || name.endsWith(".json");
    }
}
