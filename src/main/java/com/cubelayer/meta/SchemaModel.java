package com.cubelayer.meta;

import com.cubelayer.model.*;
import com.cubelayer.sql.DivisionGuard;
import org.apache.calcite.sql.parser.SqlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.regex.Pattern;

/**
 * 一次加载得到的不可变快照：通过校验的立方体，以及被拒绝的立方体和原因。
 * 构建与校验在 {@link #load} 中一次完成，快照发布后不再修改。
 */
public final class SchemaModel {
    private static final Logger logger = LoggerFactory.getLogger(SchemaModel.class);
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");

    private final Map<String, CubeDefinition> cubes;
    private final List<Validator.ValidationException> rejected;
    private final Instant loadedAt;

    private SchemaModel(Map<String, CubeDefinition> cubes, List<Validator.ValidationException> rejected) {
        this.cubes = Collections.unmodifiableMap(cubes);
        this.rejected = List.copyOf(rejected);
        this.loadedAt = Instant.now();
    }

    public static SchemaModel empty() {
        return new SchemaModel(new LinkedHashMap<>(), List.of());
    }

    public static SchemaModel load(List<CubeDeclaration> declarations, PrimaryKeyPolicy policy) {
        return load(declarations, policy, List.of());
    }

    /**
     * 校验并构建所有立方体。单个立方体失败只会把它排除在外，其余立方体照常加载。
     *
     * @param unreadable 解析阶段已失败的声明（例如文件中存在重复键），原样计入拒绝列表
     */
    public static SchemaModel load(List<CubeDeclaration> declarations, PrimaryKeyPolicy policy,
                                   List<Validator.ValidationException> unreadable) {
        Validator validator = new Validator(policy);
        List<Validator.ValidationException> rejected = new ArrayList<>(unreadable);
        Map<String, CubeDeclaration> valid = new LinkedHashMap<>();

        for (CubeDeclaration declaration : declarations) {
            try {
                validator.validate(declaration);
                if (valid.containsKey(declaration.getName())) {
                    throw new Validator.ValidationException(Validator.Kind.DUPLICATE_NAME, declaration.getName(),
                        "duplicate cube name: " + declaration.getName());
                }
                valid.put(declaration.getName(), declaration);
            } catch (Validator.ValidationException e) {
                rejected.add(e);
            }
        }

        // 被拒绝的关联目标会连带拒绝引用它的立方体，直到集合稳定
        boolean changed = true;
        while (changed) {
            changed = false;
            for (CubeDeclaration declaration : new ArrayList<>(valid.values())) {
                try {
                    validator.validateJoins(declaration, valid);
                } catch (Validator.ValidationException e) {
                    rejected.add(e);
                    valid.remove(declaration.getName());
                    changed = true;
                }
            }
        }

        Map<String, CubeDefinition> cubes = new LinkedHashMap<>();
        for (CubeDeclaration declaration : valid.values()) {
            cubes.put(declaration.getName(), toDefinition(declaration));
        }
        return new SchemaModel(cubes, rejected);
    }

    private static CubeDefinition toDefinition(CubeDeclaration declaration) {
        List<MeasureDefinition> measures = new ArrayList<>();
        for (MeasureDeclaration measure : nullToEmpty(declaration.getMeasures())) {
            AggregationKind kind = AggregationKind.fromDeclared(measure.getType());
            String sql = trimToNull(measure.getSql());
            if (kind == AggregationKind.NUMBER) {
                sql = guardDivisions(declaration.getName(), measure.getName(), sql);
            }
            List<String> filters = new ArrayList<>();
            for (FilterDeclaration filter : nullToEmpty(measure.getFilters())) {
                filters.add(filter.getSql().trim());
            }
            measures.add(new MeasureDefinition(
                measure.getName(),
                kind,
                sql,
                filters,
                measure.getDrillMembers(),
                measure.getTitle() != null ? measure.getTitle() : humanize(measure.getName()),
                measure.getDescription(),
                DisplayFormat.fromDeclared(measure.getFormat())));
        }

        List<DimensionDefinition> dimensions = new ArrayList<>();
        for (DimensionDeclaration dimension : nullToEmpty(declaration.getDimensions())) {
            dimensions.add(new DimensionDefinition(
                dimension.getName(),
                ValueType.fromDeclared(dimension.getType()),
                dimension.getSql().trim(),
                dimension.isPrimaryKey(),
                dimension.getTitle() != null ? dimension.getTitle() : humanize(dimension.getName()),
                dimension.getDescription(),
                DisplayFormat.fromDeclared(dimension.getFormat())));
        }

        List<SegmentDefinition> segments = new ArrayList<>();
        for (SegmentDeclaration segment : nullToEmpty(declaration.getSegments())) {
            segments.add(new SegmentDefinition(segment.getName(), segment.getSql().trim(),
                segment.getTitle() != null ? segment.getTitle() : humanize(segment.getName())));
        }

        List<JoinDefinition> joins = new ArrayList<>();
        for (JoinDeclaration join : nullToEmpty(declaration.getJoins())) {
            joins.add(new JoinDefinition(join.getName(), Relationship.fromDeclared(join.getRelationship()),
                join.getSql().trim()));
        }

        boolean table = declaration.getSqlTable() != null && !declaration.getSqlTable().isBlank();
        return new CubeDefinition(
            declaration.getName(),
            declaration.getTitle() != null ? declaration.getTitle() : humanize(declaration.getName()),
            declaration.getDescription(),
            table ? declaration.getSqlTable().trim() : declaration.getSql().trim(),
            table,
            measures, dimensions, segments, joins);
    }

    /**
     * 数值度量的除数统一加 NULLIF 保护；表达式无法解析时原样保留
     */
    private static String guardDivisions(String cubeName, String measureName, String sql) {
        try {
            return DivisionGuard.guard(sql);
        } catch (SqlParseException e) {
            logger.warn("Measure '{}.{}' could not be parsed, its divisions are left unguarded: {}",
                cubeName, measureName, e.getMessage());
            return sql;
        }
    }

    /**
     * avgQualityScore -> Avg Quality Score
     */
    static String humanize(String name) {
        String spaced = CAMEL_BOUNDARY.matcher(name).replaceAll("$1 $2").replace('_', ' ');
        StringBuilder result = new StringBuilder(spaced.length());
        boolean upper = true;
        for (char c : spaced.toCharArray()) {
            result.append(upper ? Character.toUpperCase(c) : c);
            upper = c == ' ';
        }
        return result.toString();
    }

    public CubeDefinition getCube(String name) {
        return name != null ? cubes.get(name) : null;
    }

    public Collection<CubeDefinition> getCubes() {
        return cubes.values();
    }

    public boolean contains(String cubeName) {
        return cubes.containsKey(cubeName);
    }

    public List<Validator.ValidationException> getRejected() {
        return rejected;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : List.of();
    }
}
