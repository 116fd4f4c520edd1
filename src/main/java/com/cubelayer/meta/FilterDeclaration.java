package com.cubelayer.meta;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 度量上的过滤谓词：filters[].sql
 */
public class FilterDeclaration {
    @JsonProperty("sql")
    private String sql;

    public FilterDeclaration() {
    }

    public FilterDeclaration(String sql) {
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }
}
