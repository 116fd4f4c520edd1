package com.cubelayer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 立方体定义：单一数据源上的度量、维度、分段与关联。
 * 由 {@link com.cubelayer.meta.SchemaModel} 在校验通过后构建，此后不可变。
 */
public final class CubeDefinition {
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");

    private final String name;
    private final String title;
    private final String description;
    private final String sourceRelation;
    private final boolean sourceTable;
    private final String alias;
    private final Map<String, MeasureDefinition> measures;
    private final Map<String, DimensionDefinition> dimensions;
    private final Map<String, SegmentDefinition> segments;
    private final Map<String, JoinDefinition> joins;

    public CubeDefinition(String name, String title, String description,
                          String sourceRelation, boolean sourceTable,
                          List<MeasureDefinition> measures,
                          List<DimensionDefinition> dimensions,
                          List<SegmentDefinition> segments,
                          List<JoinDefinition> joins) {
        this.name = name;
        this.title = title;
        this.description = description;
        this.sourceRelation = sourceRelation;
        this.sourceTable = sourceTable;
        this.alias = aliasOf(name);

        Map<String, MeasureDefinition> measureMap = new LinkedHashMap<>();
        for (MeasureDefinition measure : measures) {
            measureMap.put(measure.getName(), measure);
        }
        this.measures = Collections.unmodifiableMap(measureMap);

        Map<String, DimensionDefinition> dimensionMap = new LinkedHashMap<>();
        for (DimensionDefinition dimension : dimensions) {
            dimensionMap.put(dimension.getName(), dimension);
        }
        this.dimensions = Collections.unmodifiableMap(dimensionMap);

        Map<String, SegmentDefinition> segmentMap = new LinkedHashMap<>();
        for (SegmentDefinition segment : segments) {
            segmentMap.put(segment.getName(), segment);
        }
        this.segments = Collections.unmodifiableMap(segmentMap);

        Map<String, JoinDefinition> joinMap = new LinkedHashMap<>();
        for (JoinDefinition join : joins) {
            joinMap.put(join.getTargetCube(), join);
        }
        this.joins = Collections.unmodifiableMap(joinMap);
    }

    /**
     * 立方体在 SQL 中的表别名：RadiologyAudits -> radiology_audits
     */
    public static String aliasOf(String cubeName) {
        return CAMEL_BOUNDARY.matcher(cubeName).replaceAll("$1_$2").toLowerCase();
    }

    public String getName() {
        return name;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 数据来源：SELECT 语句或表名，见 {@link #isSourceTable()}
     */
    public String getSourceRelation() {
        return sourceRelation;
    }

    public boolean isSourceTable() {
        return sourceTable;
    }

    public String getAlias() {
        return alias;
    }

    public Map<String, MeasureDefinition> getMeasures() {
        return measures;
    }

    public Map<String, DimensionDefinition> getDimensions() {
        return dimensions;
    }

    public Map<String, SegmentDefinition> getSegments() {
        return segments;
    }

    public Map<String, JoinDefinition> getJoins() {
        return joins;
    }

    public MeasureDefinition getMeasure(String measureName) {
        return measures.get(measureName);
    }

    public DimensionDefinition getDimension(String dimensionName) {
        return dimensions.get(dimensionName);
    }

    public SegmentDefinition getSegment(String segmentName) {
        return segments.get(segmentName);
    }
}
