package com.cubelayer.model;

/**
 * 立方体缺少主键维度时的处理策略；多于一个主键始终是错误
 */
public enum PrimaryKeyPolicy {
    REQUIRED,
    OPTIONAL;

    public static PrimaryKeyPolicy fromString(String value) {
        if (value == null || value.isEmpty()) {
            return REQUIRED;
        }
        return PrimaryKeyPolicy.valueOf(value.trim().toUpperCase());
    }
}
