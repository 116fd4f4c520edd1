package com.cubelayer.meta;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class CubeDeclaration {
    @JsonProperty("name")
    private String name;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @JsonProperty("sql")
    private String sql;

    @JsonProperty("sql_table")
    private String sqlTable;

    @JsonProperty("joins")
    private List<JoinDeclaration> joins;

    @JsonProperty("measures")
    private List<MeasureDeclaration> measures;

    @JsonProperty("dimensions")
    private List<DimensionDeclaration> dimensions;

    @JsonProperty("segments")
    private List<SegmentDeclaration> segments;

    /**
     * 声明来源（文件路径），仅用于日志
     */
    @JsonIgnore
    private String source;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public String getSqlTable() {
        return sqlTable;
    }

    public void setSqlTable(String sqlTable) {
        this.sqlTable = sqlTable;
    }

    public List<JoinDeclaration> getJoins() {
        return joins;
    }

    public void setJoins(List<JoinDeclaration> joins) {
        this.joins = joins;
    }

    public List<MeasureDeclaration> getMeasures() {
        return measures;
    }

    public void setMeasures(List<MeasureDeclaration> measures) {
        this.measures = measures;
    }

    public List<DimensionDeclaration> getDimensions() {
        return dimensions;
    }

    public void setDimensions(List<DimensionDeclaration> dimensions) {
        this.dimensions = dimensions;
    }

    public List<SegmentDeclaration> getSegments() {
        return segments;
    }

    public void setSegments(List<SegmentDeclaration> segments) {
        this.segments = segments;
    }

    @JsonIgnore
    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }
}
