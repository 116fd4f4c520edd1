package com.cubelayer.model;

/**
 * 维度定义（加载后不可变）
 */
public final class DimensionDefinition {
    private final String name;
    private final ValueType valueType;
    private final String sourceExpression;
    private final boolean primaryKey;
    private final String title;
    private final String description;
    private final DisplayFormat format;

    public DimensionDefinition(String name, ValueType valueType, String sourceExpression, boolean primaryKey,
                               String title, String description, DisplayFormat format) {
        this.name = name;
        this.valueType = valueType;
        this.sourceExpression = sourceExpression;
        this.primaryKey = primaryKey;
        this.title = title;
        this.description = description;
        this.format = format;
    }

    public String getName() {
        return name;
    }

    public ValueType getValueType() {
        return valueType;
    }

    public String getSourceExpression() {
        return sourceExpression;
    }

    public boolean isPrimaryKey() {
        return primaryKey;
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
