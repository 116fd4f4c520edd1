package com.cubelayer.model;

public final class JoinDefinition {
    private final String targetCube;
    private final Relationship relationship;
    private final String sql;

    public JoinDefinition(String targetCube, Relationship relationship, String sql) {
        this.targetCube = targetCube;
        this.relationship = relationship;
        this.sql = sql;
    }

    public String getTargetCube() {
        return targetCube;
    }

    public Relationship getRelationship() {
        return relationship;
    }

    public String getSql() {
        return sql;
    }
}
