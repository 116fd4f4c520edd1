package com.cubelayer.query;

import com.cubelayer.meta.SchemaModel;
import com.cubelayer.model.CubeDefinition;
import com.cubelayer.model.DimensionDefinition;
import com.cubelayer.model.DisplayFormat;
import com.cubelayer.model.MeasureDefinition;
import com.cubelayer.model.SegmentDefinition;
import com.cubelayer.model.ValueType;
import com.cubelayer.sql.SqlDialectAdapter;
import com.cubelayer.sql.SqlFragment;
import com.cubelayer.sql.TimeGrain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 查询组装：把一个查询请求编译成单条 SQL 及列清单。
 * <p>
 * SQL 结构：
 * <pre>
 * SELECT 维度, 时间维度, 度量（按请求顺序）
 * FROM 源 AS 别名
 * WHERE 分段 AND 过滤条件 AND 时间范围
 * GROUP BY 维度表达式
 * HAVING 度量过滤
 * ORDER BY "别名"
 * OFFSET n ROWS FETCH NEXT m ROWS ONLY（按方言改写）
 * </pre>
 * 无状态，相同的 (立方体, 请求) 总是得到相同的 SQL。
 */
public class QueryAssembler {
    private static final Logger logger = LoggerFactory.getLogger(QueryAssembler.class);

    public static final int DEFAULT_LIMIT = 10000;
    public static final int MAX_LIMIT = 50000;

    private final SqlDialectAdapter dialect;
    private final int defaultLimit;
    private final int maxLimit;
    private final MeasureCompiler measureCompiler = new MeasureCompiler();
    private final DimensionCompiler dimensionCompiler = new DimensionCompiler();
    private final SegmentCompiler segmentCompiler = new SegmentCompiler();
    private final FilterCompiler filterCompiler = new FilterCompiler();

    public QueryAssembler(SqlDialectAdapter dialect) {
        this(dialect, DEFAULT_LIMIT, MAX_LIMIT);
    }

    public QueryAssembler(SqlDialectAdapter dialect, int defaultLimit, int maxLimit) {
        if (defaultLimit < 1 || maxLimit < defaultLimit) {
            throw new IllegalArgumentException("invalid limits: default " + defaultLimit + ", max " + maxLimit);
        }
        this.dialect = dialect;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    public SqlDialectAdapter getDialect() {
        return dialect;
    }

    /**
     * 从快照中定位请求的立方体并编译
     */
    public CompiledQuery assemble(SchemaModel schema, QueryRequest request) throws QueryException {
        CubeDefinition cube = resolveCube(schema, request);
        return compile(cube, request, schema::contains);
    }

    public CompiledQuery assemble(CubeDefinition cube, QueryRequest request) throws QueryException {
        return compile(cube, request, name -> false);
    }

    /**
     * 请求的立方体：显式给出的 cube，否则取第一个带限定名的成员
     */
    public CubeDefinition resolveCube(SchemaModel schema, QueryRequest request) throws QueryException {
        requireEntries(request);
        String cubeName = request.getCube();
        if (cubeName == null || cubeName.isEmpty()) {
            cubeName = firstCubePrefix(request);
        }
        if (cubeName == null) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "cube is not specified and no member is qualified with a cube name");
        }
        CubeDefinition cube = schema.getCube(cubeName);
        if (cube == null) {
            throw new QueryException(QueryException.Kind.UNKNOWN_CUBE, "cube '" + cubeName + "' not found");
        }
        return cube;
    }

    private CompiledQuery compile(CubeDefinition cube, QueryRequest request, Predicate<String> otherCube)
            throws QueryException {
        requireEntries(request);
        if (request.getCube() != null && !request.getCube().isEmpty() && !request.getCube().equals(cube.getName())) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "request targets cube '" + request.getCube() + "' but was compiled against '" + cube.getName() + "'");
        }
        CompileContext ctx = new CompileContext(cube, dialect, measureCompiler, dimensionCompiler);

        List<String> selects = new ArrayList<>();
        List<String> groupBy = new ArrayList<>();
        List<ColumnManifest> columns = new ArrayList<>();
        Set<String> aliases = new HashSet<>();
        Map<String, String> orderable = new LinkedHashMap<>();
        String firstGrainAlias = null;
        String firstMeasureAlias = null;
        String firstDimensionAlias = null;

        for (String name : request.getDimensions()) {
            String member = localName(cube, name, otherCube);
            DimensionDefinition dimension = requireDimension(cube, member);
            requireLocal(ctx, member);
            claimAlias(aliases, member);
            selects.add(dimensionCompiler.compile(dimension, ctx).getSql());
            groupBy.add(dimensionCompiler.expression(dimension, ctx));
            columns.add(new ColumnManifest(member, qualified(cube, member), ColumnManifest.Kind.DIMENSION,
                dimension.getValueType().getDeclaredName(), dimension.getTitle(),
                formatName(dimension.getFormat()), null));
            orderable.put(member, ctx.quote(member));
            if (firstDimensionAlias == null) {
                firstDimensionAlias = ctx.quote(member);
            }
        }

        List<SqlFragment> timeRanges = new ArrayList<>();
        for (QueryRequest.TimeDimension timeDimension : request.getTimeDimensions()) {
            if (timeDimension.getDimension() == null) {
                throw new QueryException(QueryException.Kind.INVALID_REQUEST, "time dimension without a member");
            }
            String member = localName(cube, timeDimension.getDimension(), otherCube);
            DimensionDefinition dimension = requireDimension(cube, member);
            if (dimension.getValueType() != ValueType.TIME) {
                throw new QueryException(QueryException.Kind.TYPE_MISMATCH,
                    "'" + timeDimension.getDimension() + "' is a " + dimension.getValueType().getDeclaredName()
                        + " dimension, time dimensions require type time");
            }
            requireLocal(ctx, member);

            if (timeDimension.getGranularity() != null) {
                TimeGrain grain = TimeGrain.fromDeclared(timeDimension.getGranularity());
                if (grain == null) {
                    throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                        "unknown granularity '" + timeDimension.getGranularity() + "'");
                }
                String alias = DimensionCompiler.grainAlias(member, grain);
                claimAlias(aliases, alias);
                String truncated = dimensionCompiler.truncateToGrain(dimension, grain, ctx);
                selects.add(truncated + " AS " + ctx.quote(alias));
                groupBy.add(truncated);
                columns.add(new ColumnManifest(alias, qualified(cube, member), ColumnManifest.Kind.TIME_DIMENSION,
                    ValueType.TIME.getDeclaredName(), dimension.getTitle(),
                    formatName(dimension.getFormat()), grain.getDeclaredName()));
                orderable.putIfAbsent(member, ctx.quote(alias));
                if (firstGrainAlias == null) {
                    firstGrainAlias = ctx.quote(alias);
                }
            }
            if (timeDimension.getDateRange() != null) {
                timeRanges.add(filterCompiler.compile(timeDimension.getDimension(),
                    dimensionCompiler.expression(dimension, ctx), ValueType.TIME,
                    FilterOperator.IN_DATE_RANGE, new ArrayList<>(timeDimension.getDateRange())));
            }
        }

        for (String name : request.getMeasures()) {
            String member = localName(cube, name, otherCube);
            MeasureDefinition measure = requireMeasure(cube, member);
            requireLocal(ctx, member);
            claimAlias(aliases, member);
            selects.add(measureCompiler.compile(measure, ctx).getSql());
            columns.add(new ColumnManifest(member, qualified(cube, member), ColumnManifest.Kind.MEASURE,
                measure.getAggregationKind().getDeclaredName(), measure.getTitle(),
                formatName(measure.getFormat()), null));
            orderable.put(member, ctx.quote(member));
            if (firstMeasureAlias == null) {
                firstMeasureAlias = ctx.quote(member);
            }
        }

        if (selects.isEmpty()) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "query must request at least one measure, dimension or time dimension with granularity");
        }

        List<String> where = new ArrayList<>();
        List<Object> parameters = new ArrayList<>();

        List<String> segmentNames = new ArrayList<>();
        for (String name : request.getSegments()) {
            String segmentName = localName(cube, name, otherCube);
            SegmentDefinition segment = cube.getSegment(segmentName);
            if (segment != null) {
                String foreign = ctx.foreignReference(segment.getPredicate());
                if (foreign != null) {
                    throw crossCube(name, foreign);
                }
            }
            segmentNames.add(segmentName);
        }
        if (!segmentNames.isEmpty()) {
            where.add(segmentCompiler.compile(segmentNames, ctx).getSql());
        }

        List<String> having = new ArrayList<>();
        List<Object> havingParameters = new ArrayList<>();
        for (QueryRequest.Filter filter : request.getFilters()) {
            if (filter.getMember() == null) {
                throw new QueryException(QueryException.Kind.INVALID_REQUEST, "filter without a member");
            }
            FilterOperator operator = FilterOperator.fromDeclared(filter.getOperator());
            if (operator == null) {
                throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                    "unknown filter operator '" + filter.getOperator() + "'");
            }
            String member = localName(cube, filter.getMember(), otherCube);
            MeasureDefinition measure = cube.getMeasure(member);
            if (measure != null) {
                requireLocal(ctx, member);
                if (operator == FilterOperator.MEASURE_FILTER) {
                    String predicate = measureCompiler.filterPredicate(measure, ctx);
                    if (predicate != null) {
                        where.add(predicate);
                    }
                } else {
                    SqlFragment fragment = filterCompiler.compile(filter.getMember(),
                        measureCompiler.aggregate(measure, ctx), ValueType.NUMBER, operator, filter.getValues());
                    having.add(fragment.getSql());
                    havingParameters.addAll(fragment.getParameters());
                }
                continue;
            }
            DimensionDefinition dimension = requireDimension(cube, member);
            requireLocal(ctx, member);
            SqlFragment fragment = filterCompiler.compile(filter.getMember(),
                dimensionCompiler.expression(dimension, ctx), dimension.getValueType(), operator, filter.getValues());
            where.add(fragment.getSql());
            parameters.addAll(fragment.getParameters());
        }

        for (SqlFragment range : timeRanges) {
            where.add(range.getSql());
            parameters.addAll(range.getParameters());
        }
        parameters.addAll(havingParameters);

        List<String> orderBy = orderBy(cube, request, orderable, otherCube,
            firstGrainAlias, firstMeasureAlias, firstDimensionAlias);
        int limit = limit(request);
        int offset = offset(request);

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT\n  ").append(String.join(",\n  ", selects));
        sql.append("\nFROM ").append(from(cube));
        if (!where.isEmpty()) {
            sql.append("\nWHERE ").append(String.join("\n  AND ", where));
        }
        if (!groupBy.isEmpty()) {
            sql.append("\nGROUP BY ").append(String.join(", ", groupBy));
        }
        if (!having.isEmpty()) {
            sql.append("\nHAVING ").append(String.join("\n  AND ", having));
        }
        if (!orderBy.isEmpty()) {
            sql.append("\nORDER BY ").append(String.join(", ", orderBy));
        }
        sql.append('\n').append(SqlDialectAdapter.pagingClause(limit, offset));

        String adapted = dialect.adaptSql(sql.toString());
        logger.debug("Compiled query on cube '{}' [{}]:\n{}\nparameters: {}",
            cube.getName(), dialect.getDatabaseType(), adapted, parameters);
        return new CompiledQuery(cube.getName(), adapted, parameters, columns);
    }

    private List<String> orderBy(CubeDefinition cube, QueryRequest request, Map<String, String> orderable,
                                 Predicate<String> otherCube, String firstGrainAlias,
                                 String firstMeasureAlias, String firstDimensionAlias) throws QueryException {
        List<String> orderBy = new ArrayList<>();
        if (request.getOrder().isEmpty()) {
            if (firstGrainAlias != null) {
                orderBy.add(firstGrainAlias + " ASC");
            } else if (firstMeasureAlias != null) {
                orderBy.add(firstMeasureAlias + " DESC");
            } else if (firstDimensionAlias != null) {
                orderBy.add(firstDimensionAlias + " ASC");
            }
            return orderBy;
        }
        for (Map.Entry<String, String> entry : request.getOrder().entrySet()) {
            String member = localName(cube, entry.getKey(), otherCube);
            String alias = orderable.get(member);
            if (alias == null) {
                throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                    "order member '" + entry.getKey() + "' is not part of the query");
            }
            String direction = entry.getValue() == null ? "asc" : entry.getValue().trim().toLowerCase();
            if (!direction.equals("asc") && !direction.equals("desc")) {
                throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                    "invalid order direction '" + entry.getValue() + "' for '" + entry.getKey() + "'");
            }
            orderBy.add(alias + " " + direction.toUpperCase());
        }
        return orderBy;
    }

    private int limit(QueryRequest request) throws QueryException {
        if (request.getLimit() == null) {
            return defaultLimit;
        }
        int limit = request.getLimit();
        if (limit < 1 || limit > maxLimit) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "limit must be between 1 and " + maxLimit + ", got " + limit);
        }
        return limit;
    }

    private int offset(QueryRequest request) throws QueryException {
        if (request.getOffset() == null) {
            return 0;
        }
        if (request.getOffset() < 0) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "offset must not be negative, got " + request.getOffset());
        }
        return request.getOffset();
    }

    private static String from(CubeDefinition cube) {
        if (cube.isSourceTable()) {
            return cube.getSourceRelation() + " AS " + cube.getAlias();
        }
        return "(" + cube.getSourceRelation() + ") AS " + cube.getAlias();
    }

    /**
     * Cube.member -> member。其他立方体的成员不支持，未知立方体报 UNKNOWN_CUBE
     */
    static String localName(CubeDefinition cube, String name, Predicate<String> otherCube) throws QueryException {
        if (name == null || name.isEmpty()) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST, "empty member name");
        }
        int dot = name.indexOf('.');
        if (dot < 0) {
            return name;
        }
        String prefix = name.substring(0, dot);
        if (prefix.equals(cube.getName())) {
            return name.substring(dot + 1);
        }
        if (cube.getJoins().containsKey(prefix) || otherCube.test(prefix)) {
            throw new QueryException(QueryException.Kind.UNSUPPORTED,
                "member '" + name + "' belongs to cube '" + prefix
                    + "'; queries spanning more than one cube are not supported");
        }
        throw new QueryException(QueryException.Kind.UNKNOWN_CUBE, "cube '" + prefix + "' not found");
    }

    /**
     * filters / timeDimensions 中的 null 元素（例如 "filters": [null]）
     */
    private static void requireEntries(QueryRequest request) throws QueryException {
        if (request.getFilters().stream().anyMatch(Objects::isNull)) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST, "filters must not contain null entries");
        }
        if (request.getTimeDimensions().stream().anyMatch(Objects::isNull)) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "timeDimensions must not contain null entries");
        }
    }

    private static String firstCubePrefix(QueryRequest request) {
        List<String> names = new ArrayList<>();
        names.addAll(request.getMeasures());
        names.addAll(request.getDimensions());
        for (QueryRequest.TimeDimension timeDimension : request.getTimeDimensions()) {
            names.add(timeDimension.getDimension());
        }
        names.addAll(request.getSegments());
        for (QueryRequest.Filter filter : request.getFilters()) {
            names.add(filter.getMember());
        }
        for (String name : names) {
            if (name != null && name.indexOf('.') > 0) {
                return name.substring(0, name.indexOf('.'));
            }
        }
        return null;
    }

    private static DimensionDefinition requireDimension(CubeDefinition cube, String member) throws QueryException {
        DimensionDefinition dimension = cube.getDimension(member);
        if (dimension == null) {
            String detail = cube.getMeasure(member) != null ? " is a measure, not a dimension" : " not found";
            throw new QueryException(QueryException.Kind.UNKNOWN_FIELD,
                "dimension '" + member + "'" + detail + " in cube '" + cube.getName() + "'");
        }
        return dimension;
    }

    private static MeasureDefinition requireMeasure(CubeDefinition cube, String member) throws QueryException {
        MeasureDefinition measure = cube.getMeasure(member);
        if (measure == null) {
            String detail = cube.getDimension(member) != null ? " is a dimension, not a measure" : " not found";
            throw new QueryException(QueryException.Kind.UNKNOWN_FIELD,
                "measure '" + member + "'" + detail + " in cube '" + cube.getName() + "'");
        }
        return measure;
    }

    private static void requireLocal(CompileContext ctx, String member) throws QueryException {
        String foreign = ctx.foreignReferenceOfMember(member);
        if (foreign != null) {
            throw crossCube(qualified(ctx.getCube(), member), foreign);
        }
    }

    private static QueryException crossCube(String member, String reference) {
        return new QueryException(QueryException.Kind.UNSUPPORTED,
            "'" + member + "' references '${" + reference + "}' in another cube; cross-cube queries are not supported");
    }

    private static void claimAlias(Set<String> aliases, String alias) throws QueryException {
        if (!aliases.add(alias)) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST, "member '" + alias + "' is requested twice");
        }
    }

    private static String qualified(CubeDefinition cube, String member) {
        return cube.getName() + "." + member;
    }

    private static String formatName(DisplayFormat format) {
        return format != null ? format.getDeclaredName() : null;
    }
}
