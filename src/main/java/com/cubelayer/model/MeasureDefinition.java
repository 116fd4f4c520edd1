package com.cubelayer.model;

import java.util.List;

/**
 * 度量定义（加载后不可变）
 */
public final class MeasureDefinition {
    private final String name;
    private final AggregationKind aggregationKind;
    private final String sourceExpression;
    private final List<String> filters;
    private final List<String> drillMembers;
    private final String title;
    private final String description;
    private final DisplayFormat format;

    public MeasureDefinition(String name, AggregationKind aggregationKind, String sourceExpression,
                             List<String> filters, List<String> drillMembers,
                             String title, String description, DisplayFormat format) {
        this.name = name;
        this.aggregationKind = aggregationKind;
        this.sourceExpression = sourceExpression;
        this.filters = filters != null ? List.copyOf(filters) : List.of();
        this.drillMembers = drillMembers != null ? List.copyOf(drillMembers) : List.of();
        this.title = title;
        this.description = description;
        this.format = format;
    }

    public String getName() {
        return name;
    }

    public AggregationKind getAggregationKind() {
        return aggregationKind;
    }

    /**
     * 聚合参数；count 类型可以为 null，表示 COUNT(*)
     */
    public String getSourceExpression() {
        return sourceExpression;
    }

    public List<String> getFilters() {
        return filters;
    }

    public List<String> getDrillMembers() {
        return drillMembers;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public DisplayFormat getFormat() {
        return format;
    }
}
