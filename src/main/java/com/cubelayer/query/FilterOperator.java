package com.cubelayer.query;

import com.cubelayer.model.ValueType;

import java.util.EnumSet;
import java.util.Set;

/**
 * 过滤运算符及其适用的值类型。度量一律按 number 处理。
 */
public enum FilterOperator {
    EQUALS("equals", EnumSet.of(ValueType.STRING, ValueType.NUMBER, ValueType.TIME)),
    NOT_EQUALS("notEquals", EnumSet.of(ValueType.STRING, ValueType.NUMBER, ValueType.TIME)),
    CONTAINS("contains", EnumSet.of(ValueType.STRING)),
    NOT_CONTAINS("notContains", EnumSet.of(ValueType.STRING)),
    STARTS_WITH("startsWith", EnumSet.of(ValueType.STRING)),
    ENDS_WITH("endsWith", EnumSet.of(ValueType.STRING)),
    GT("gt", EnumSet.of(ValueType.NUMBER)),
    GTE("gte", EnumSet.of(ValueType.NUMBER)),
    LT("lt", EnumSet.of(ValueType.NUMBER)),
    LTE("lte", EnumSet.of(ValueType.NUMBER)),
    SET("set", EnumSet.allOf(ValueType.class)),
    NOT_SET("notSet", EnumSet.allOf(ValueType.class)),
    IN_DATE_RANGE("inDateRange", EnumSet.of(ValueType.TIME)),
    NOT_IN_DATE_RANGE("notInDateRange", EnumSet.of(ValueType.TIME)),
    BEFORE_DATE("beforeDate", EnumSet.of(ValueType.TIME)),
    AFTER_DATE("afterDate", EnumSet.of(ValueType.TIME)),
    /**
     * 把度量自身声明的过滤条件加到 WHERE，只能用于度量
     */
    MEASURE_FILTER("measureFilter", EnumSet.noneOf(ValueType.class));

    private final String declaredName;
    private final Set<ValueType> valueTypes;

    FilterOperator(String declaredName, Set<ValueType> valueTypes) {
        this.declaredName = declaredName;
        this.valueTypes = valueTypes;
    }

    public String getDeclaredName() {
        return declaredName;
    }

    public boolean supports(ValueType valueType) {
        return valueTypes.contains(valueType);
    }

    /**
     * 是否不需要 values
     */
    public boolean isUnary() {
        return this == SET || this == NOT_SET || this == MEASURE_FILTER;
    }

    public static FilterOperator fromDeclared(String value) {
        if (value == null) {
            return null;
        }
        for (FilterOperator operator : values()) {
            if (operator.declaredName.equals(value)) {
                return operator;
            }
        }
        return null;
    }
}
