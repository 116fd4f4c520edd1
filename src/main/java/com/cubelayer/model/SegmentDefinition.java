package com.cubelayer.model;

public final class SegmentDefinition {
    private final String name;
    private final String predicate;
    private final String title;

    public SegmentDefinition(String name, String predicate, String title) {
        this.name = name;
        this.predicate = predicate;
        this.title = title;
    }

    public String getName() {
        return name;
    }

    /**
     * 布尔谓词模板，可包含 ${CUBE}
     */
    public String getPredicate() {
        return predicate;
    }

    public String getTitle() {
        return title;
    }
}
