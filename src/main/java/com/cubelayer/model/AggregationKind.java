package com.cubelayer.model;

/**
 * 度量的聚合方式，对应声明中的 {@code type} 字段
 */
public enum AggregationKind {
    COUNT("count", "COUNT"),
    COUNT_DISTINCT("countDistinct", "COUNT"),
    AVG("avg", "AVG"),
    SUM("sum", "SUM"),
    MIN("min", "MIN"),
    MAX("max", "MAX"),
    NUMBER("number", null);

    private final String declaredName;
    private final String sqlFunction;

    AggregationKind(String declaredName, String sqlFunction) {
        this.declaredName = declaredName;
        this.sqlFunction = sqlFunction;
    }

    public String getDeclaredName() {
        return declaredName;
    }

    /**
     * 聚合函数名；number 类型的度量由声明自身给出完整表达式，返回 null
     */
    public String getSqlFunction() {
        return sqlFunction;
    }

    public static AggregationKind fromDeclared(String value) {
        if (value == null) {
            return null;
        }
        for (AggregationKind kind : values()) {
            if (kind.declaredName.equals(value)) {
                return kind;
            }
        }
        // count_distinct 作为 countDistinct 的别名
        if ("count_distinct".equals(value)) {
            return COUNT_DISTINCT;
        }
        return null;
    }
}
