package com.cubelayer.meta;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class MeasureDeclaration {
    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private String type;

    @JsonProperty("sql")
    private String sql;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @JsonProperty("format")
    private String format;

    @JsonProperty("filters")
    private List<FilterDeclaration> filters;

    @JsonProperty("drillMembers")
    @JsonAlias("drill_members")
    private List<String> drillMembers;

    public MeasureDeclaration() {
    }

    public MeasureDeclaration(String name, String type, String sql) {
        this.name = name;
        this.type = type;
        this.sql = sql;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
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

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public List<FilterDeclaration> getFilters() {
        return filters;
    }

    public void setFilters(List<FilterDeclaration> filters) {
        this.filters = filters;
    }

    public List<String> getDrillMembers() {
        return drillMembers;
    }

    public void setDrillMembers(List<String> drillMembers) {
        this.drillMembers = drillMembers;
    }
}
