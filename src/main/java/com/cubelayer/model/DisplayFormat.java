package com.cubelayer.model;

/**
 * 展示格式提示，只影响调用方渲染，不参与 SQL 生成
 */
public enum DisplayFormat {
    PERCENT("percent", true),
    CURRENCY("currency", true),
    ID("id", false),
    LINK("link", false),
    IMAGE_URL("imageUrl", false);

    private final String declaredName;
    private final boolean allowedOnMeasures;

    DisplayFormat(String declaredName, boolean allowedOnMeasures) {
        this.declaredName = declaredName;
        this.allowedOnMeasures = allowedOnMeasures;
    }

    public String getDeclaredName() {
        return declaredName;
    }

    public boolean isAllowedOnMeasures() {
        return allowedOnMeasures;
    }

    public static DisplayFormat fromDeclared(String value) {
        if (value == null) {
            return null;
        }
        for (DisplayFormat format : values()) {
            if (format.declaredName.equals(value)) {
                return format;
            }
        }
        return null;
    }
}
