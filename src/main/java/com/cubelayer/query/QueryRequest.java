package com.cubelayer.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 查询请求，结构与 Cube.js 的 REST 查询一致。
 * 成员名可以写成 Cube.member，也可以在给出 cube 时只写 member。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryRequest {
    /**
     * 目标立方体，成员全部带限定名时可省略
     */
    private String cube;

    private List<String> measures = new ArrayList<>();

    private List<String> dimensions = new ArrayList<>();

    private List<String> segments = new ArrayList<>();

    private List<Filter> filters = new ArrayList<>();

    private List<TimeDimension> timeDimensions = new ArrayList<>();

    /**
     * 成员 -> asc / desc，保持插入顺序
     */
    private Map<String, String> order = new LinkedHashMap<>();

    private Integer limit;

    private Integer offset;

    public QueryRequest() {
    }

    /**
     * 深拷贝，供下钻派生新请求使用
     */
    public QueryRequest copy() {
        QueryRequest copy = new QueryRequest();
        copy.cube = cube;
        copy.measures = new ArrayList<>(measures);
        copy.dimensions = new ArrayList<>(dimensions);
        copy.segments = new ArrayList<>(segments);
        for (Filter filter : filters) {
            copy.filters.add(new Filter(filter.getMember(), filter.getOperator(),
                filter.getValues() != null ? new ArrayList<>(filter.getValues()) : null));
        }
        for (TimeDimension timeDimension : timeDimensions) {
            copy.timeDimensions.add(new TimeDimension(timeDimension.getDimension(), timeDimension.getGranularity(),
                timeDimension.getDateRange() != null ? new ArrayList<>(timeDimension.getDateRange()) : null));
        }
        copy.order = new LinkedHashMap<>(order);
        copy.limit = limit;
        copy.offset = offset;
        return copy;
    }

    public String getCube() {
        return cube;
    }

    public void setCube(String cube) {
        this.cube = cube;
    }

    public List<String> getMeasures() {
        return measures;
    }

    public void setMeasures(List<String> measures) {
        this.measures = measures != null ? measures : new ArrayList<>();
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public void setDimensions(List<String> dimensions) {
        this.dimensions = dimensions != null ? dimensions : new ArrayList<>();
    }

    public List<String> getSegments() {
        return segments;
    }

    public void setSegments(List<String> segments) {
        this.segments = segments != null ? segments : new ArrayList<>();
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public void setFilters(List<Filter> filters) {
        this.filters = filters != null ? filters : new ArrayList<>();
    }

    public List<TimeDimension> getTimeDimensions() {
        return timeDimensions;
    }

    public void setTimeDimensions(List<TimeDimension> timeDimensions) {
        this.timeDimensions = timeDimensions != null ? timeDimensions : new ArrayList<>();
    }

    public Map<String, String> getOrder() {
        return order;
    }

    public void setOrder(Map<String, String> order) {
        this.order = order != null ? new LinkedHashMap<>(order) : new LinkedHashMap<>();
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public void setOffset(Integer offset) {
        this.offset = offset;
    }

    /**
     * 过滤条件
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Filter {
        private String member;
        private String operator;
        private List<Object> values;

        public Filter() {
        }

        public Filter(String member, String operator, List<Object> values) {
            this.member = member;
            this.operator = operator;
            this.values = values;
        }

        public String getMember() {
            return member;
        }

        public void setMember(String member) {
            this.member = member;
        }

        /**
         * Cube.js 旧写法 dimension 等同于 member
         */
        public void setDimension(String dimension) {
            this.member = dimension;
        }

        public String getOperator() {
            return operator;
        }

        public void setOperator(String operator) {
            this.operator = operator;
        }

        public List<Object> getValues() {
            return values;
        }

        public void setValues(List<Object> values) {
            this.values = values;
        }
    }

    /**
     * 时间维度：可选粒度与左闭右开的日期范围
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TimeDimension {
        private String dimension;
        private String granularity;
        private List<String> dateRange;

        public TimeDimension() {
        }

        public TimeDimension(String dimension, String granularity, List<String> dateRange) {
            this.dimension = dimension;
            this.granularity = granularity;
            this.dateRange = dateRange;
        }

        public String getDimension() {
            return dimension;
        }

        public void setDimension(String dimension) {
            this.dimension = dimension;
        }

        public String getGranularity() {
            return granularity;
        }

        public void setGranularity(String granularity) {
            this.granularity = granularity;
        }

        public List<String> getDateRange() {
            return dateRange;
        }

        public void setDateRange(List<String> dateRange) {
            this.dateRange = dateRange;
        }
    }
}
