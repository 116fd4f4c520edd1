package com.cubelayer.query;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 输出列的描述：调用方据此渲染结果，无需再查询立方体定义
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnManifest {
    public enum Kind {
        DIMENSION,
        TIME_DIMENSION,
        MEASURE
    }

    private final String alias;
    private final String member;
    private final Kind kind;
    private final String semanticType;
    private final String title;
    private final String format;
    private final String granularity;

    public ColumnManifest(String alias, String member, Kind kind, String semanticType,
                          String title, String format, String granularity) {
        this.alias = alias;
        this.member = member;
        this.kind = kind;
        this.semanticType = semanticType;
        this.title = title;
        this.format = format;
        this.granularity = granularity;
    }

    /**
     * SQL 中的列别名（不含引号）
     */
    public String getAlias() {
        return alias;
    }

    /**
     * 限定成员名，例如 RadiologyAudits.modality
     */
    public String getMember() {
        return member;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 维度为值类型（number/string/time），度量为聚合方式（count/avg/number...）
     */
    public String getSemanticType() {
        return semanticType;
    }

    public String getTitle() {
        return title;
    }

    public String getFormat() {
        return format;
    }

    public String getGranularity() {
        return granularity;
    }
}
