package com.cubelayer.meta;

import com.fasterxml.jackson.annotation.JsonProperty;

public class JoinDeclaration {
    /**
     * 目标立方体名称
     */
    @JsonProperty("name")
    private String name;

    /**
     * one_to_one | one_to_many | many_to_one（兼容 hasOne / hasMany / belongsTo）
     */
    @JsonProperty("relationship")
    private String relationship;

    @JsonProperty("sql")
    private String sql;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getRelationship() {
        return relationship;
    }

    public void setRelationship(String relationship) {
        this.relationship = relationship;
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }
}
