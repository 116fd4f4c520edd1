package com.cubelayer.model;

public enum Relationship {
    ONE_TO_ONE("one_to_one", "hasOne"),
    ONE_TO_MANY("one_to_many", "hasMany"),
    MANY_TO_ONE("many_to_one", "belongsTo");

    private final String declaredName;
    private final String legacyName;

    Relationship(String declaredName, String legacyName) {
        this.declaredName = declaredName;
        this.legacyName = legacyName;
    }

    public String getDeclaredName() {
        return declaredName;
    }

    public static Relationship fromDeclared(String value) {
        if (value == null) {
            return null;
        }
        for (Relationship relationship : values()) {
            if (relationship.declaredName.equals(value) || relationship.legacyName.equals(value)) {
                return relationship;
            }
        }
        return null;
    }
}
