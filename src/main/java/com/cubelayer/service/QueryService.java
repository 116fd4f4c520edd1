package com.cubelayer.service;

import com.cubelayer.meta.Loader;
import com.cubelayer.meta.SchemaModel;
import com.cubelayer.model.CubeDefinition;
import com.cubelayer.query.CompiledQuery;
import com.cubelayer.query.DrillDownBuilder;
import com.cubelayer.query.QueryAssembler;
import com.cubelayer.query.QueryException;
import com.cubelayer.query.QueryParser;
import com.cubelayer.query.QueryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 查询服务：解析请求并编译为 SQL，不执行
 */
@Service
public class QueryService {
    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    private final Loader loader;
    private final QueryAssembler assembler;
    private final QueryParser parser;
    private final DrillDownBuilder drillDownBuilder;

    public QueryService(Loader loader, QueryAssembler assembler) {
        this.loader = loader;
        this.assembler = assembler;
        this.parser = new QueryParser();
        this.drillDownBuilder = new DrillDownBuilder();
    }

    public CompiledQuery compile(Map<String, Object> queryMap) throws QueryException {
        QueryRequest request = parser.parseMap(queryMap);
        // 同一次编译始终使用同一个快照
        SchemaModel schema = loader.getSchema();
        CompiledQuery compiled = assembler.assemble(schema, request);
        logger.info("Compiled query on cube '{}': {} columns, {} parameters",
            compiled.getCube(), compiled.getColumns().size(), compiled.getParameters().size());
        return compiled;
    }

    /**
     * 下钻：body = {query: 原请求, measure: 被下钻的度量, row: 结果行}
     *
     * @return {query: 派生的请求, sql: 派生请求的编译结果}
     */
    public Map<String, Object> drillDown(Map<String, Object> body) throws QueryException {
        Object query = body != null ? body.get("query") : null;
        Object measure = body != null ? body.get("measure") : null;
        Object row = body != null ? body.get("row") : null;
        if (!(query instanceof Map) || !(measure instanceof String) || !(row instanceof Map)) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "drill-down requires 'query' (object), 'measure' (string) and 'row' (object)");
        }
        @SuppressWarnings("unchecked")
        QueryRequest original = parser.parseMap((Map<String, Object>) query);
        @SuppressWarnings("unchecked")
        Map<String, Object> rowValues = (Map<String, Object>) row;

        SchemaModel schema = loader.getSchema();
        CubeDefinition cube = assembler.resolveCube(schema, original);
        QueryRequest drill = drillDownBuilder.build(cube, original, (String) measure, rowValues);
        CompiledQuery compiled = assembler.assemble(schema, drill);
        logger.info("Drill-down on '{}' derived {} measures, {} dimensions, {} filters",
            measure, drill.getMeasures().size(), drill.getDimensions().size(), drill.getFilters().size());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("query", drill);
        result.put("sql", compiled);
        return result;
    }
}
