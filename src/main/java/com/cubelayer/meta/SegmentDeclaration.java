package com.cubelayer.meta;

import com.fasterxml.jackson.annotation.JsonProperty;

public class SegmentDeclaration {
    @JsonProperty("name")
    private String name;

    @JsonProperty("sql")
    private String sql;

    @JsonProperty("title")
    private String title;

    public SegmentDeclaration() {
    }

    public SegmentDeclaration(String name, String sql) {
        this.name = name;
        this.sql = sql;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }
}
