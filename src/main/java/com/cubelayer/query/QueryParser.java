package com.cubelayer.query;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 查询请求解析器
 * 支持 JSON 和 YAML 格式，以及 HTTP 请求体反序列化得到的 Map
 */
public class QueryParser {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public QueryParser() {
        this.jsonMapper = new ObjectMapper()
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * 解析 JSON 格式的查询
     */
    public QueryRequest parseJson(String json) throws IOException, QueryException {
        return parseMap(jsonMapper.readValue(json, MAP_TYPE));
    }

    /**
     * 解析 YAML 格式的查询
     */
    public QueryRequest parseYaml(String yaml) throws IOException, QueryException {
        return parseMap(yamlMapper.readValue(yaml, MAP_TYPE));
    }

    /**
     * 解析 Map 格式的查询（从 HTTP 请求体）
     * order 既可以是 {"member": "desc"}，也可以是 [["member", "desc"], ...]
     */
    public QueryRequest parseMap(Map<String, Object> map) throws QueryException {
        if (map == null) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST, "query is empty");
        }
        Map<String, Object> normalized = new LinkedHashMap<>(map);
        if (normalized.containsKey("order")) {
            normalized.put("order", parseOrder(normalized.get("order")));
        }
        try {
            return jsonMapper.convertValue(normalized, QueryRequest.class);
        } catch (IllegalArgumentException e) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "malformed query: " + rootMessage(e), e);
        }
    }

    private Map<String, String> parseOrder(Object order) throws QueryException {
        Map<String, String> result = new LinkedHashMap<>();
        if (order == null) {
            return result;
        }
        if (order instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) order).entrySet()) {
                result.put(String.valueOf(entry.getKey()), entry.getValue() != null ? entry.getValue().toString() : null);
            }
            return result;
        }
        if (order instanceof List) {
            for (Object item : (List<?>) order) {
                if (!(item instanceof List) || ((List<?>) item).isEmpty() || ((List<?>) item).size() > 2) {
                    throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                        "order entries must be [member, direction] pairs");
                }
                List<?> pair = (List<?>) item;
                result.put(String.valueOf(pair.get(0)), pair.size() > 1 && pair.get(1) != null ? pair.get(1).toString() : null);
            }
            return result;
        }
        throw new QueryException(QueryException.Kind.INVALID_REQUEST, "order must be an object or a list of pairs");
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
