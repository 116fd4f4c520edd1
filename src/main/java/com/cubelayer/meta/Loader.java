package com.cubelayer.meta;

import com.cubelayer.model.CubeDefinition;
import com.cubelayer.model.PrimaryKeyPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 声明加载器。每次 load 构建一个完整的新快照后整体替换，
 * 读者要么看到旧快照，要么看到新快照。
 */
public class Loader {
    private static final Logger logger = LoggerFactory.getLogger(Loader.class);

    private final Parser parser;
    private final PrimaryKeyPolicy primaryKeyPolicy;
    private final AtomicReference<SchemaModel> schema = new AtomicReference<>(SchemaModel.empty());

    public Loader(String path) {
        this(path, PrimaryKeyPolicy.REQUIRED);
    }

    public Loader(String path, PrimaryKeyPolicy primaryKeyPolicy) {
        this.parser = new Parser(path);
        this.primaryKeyPolicy = primaryKeyPolicy;
    }

    /**
     * 读取并校验全部声明文件，成功后发布新快照。
     * 只有声明路径本身不可读时才抛出异常，此时旧快照保持不变。
     */
    public SchemaModel load() throws IOException {
        List<CubeDeclaration> declarations = new ArrayList<>();
        List<Validator.ValidationException> unreadable = new ArrayList<>();

        for (Path file : parser.listFiles()) {
            try {
                CubeSchema cubeSchema = parser.parse(file);
                if (cubeSchema.getCubes() != null) {
                    for (CubeDeclaration cube : cubeSchema.getCubes()) {
                        if (cube != null) {
                            declarations.add(cube);
                        }
                    }
                }
            } catch (JsonProcessingException e) {
                Validator.Kind kind = e.getOriginalMessage() != null && e.getOriginalMessage().startsWith("Duplicate field")
                    ? Validator.Kind.DUPLICATE_NAME
                    : Validator.Kind.UNREADABLE_DECLARATION;
                unreadable.add(new Validator.ValidationException(kind, null,
                    "failed to parse " + file + ": " + e.getOriginalMessage(), e));
            } catch (IOException e) {
                logger.error("Failed to read cube declarations from: {}", file, e);
                unreadable.add(new Validator.ValidationException(Validator.Kind.UNREADABLE_DECLARATION, null,
                    "failed to read " + file + ": " + e.getMessage(), e));
            }
        }

        SchemaModel loaded = SchemaModel.load(declarations, primaryKeyPolicy, unreadable);
        for (Validator.ValidationException e : loaded.getRejected()) {
            logger.warn("Cube rejected [{}]: {}", e.getKind(), e.getMessage());
        }
        schema.set(loaded);
        logger.info("Cube declarations loaded from {}: {} active, {} rejected",
            parser.getPath(), loaded.getCubes().size(), loaded.getRejected().size());
        return loaded;
    }

    public SchemaModel reload() throws IOException {
        return load();
    }

    public SchemaModel getSchema() {
        return schema.get();
    }

    public CubeDefinition getCube(String name) throws NotFoundException {
        CubeDefinition cube = getSchema().getCube(name);
        if (cube == null) {
            throw new NotFoundException("cube '" + name + "' not found");
        }
        return cube;
    }

    public List<CubeDefinition> listCubes() {
        return List.copyOf(getSchema().getCubes());
    }

    public static class NotFoundException extends Exception {
        public NotFoundException(String message) {
            super(message);
        }
    }
}
