package com.cubelayer.model;

/**
 * 维度的值类型
 */
public enum ValueType {
    NUMBER("number"),
    STRING("string"),
    TIME("time");

    private final String declaredName;

    ValueType(String declaredName) {
        this.declaredName = declaredName;
    }

    public String getDeclaredName() {
        return declaredName;
    }

    public static ValueType fromDeclared(String value) {
        if (value == null) {
            return null;
        }
        for (ValueType type : values()) {
            if (type.declaredName.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
