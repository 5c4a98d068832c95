package com.apispec.schemaGraph.relationship;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RelationshipType {
    HAS_MANY("hasMany"),
    HAS_ONE("hasOne"),
    BELONGS_TO("belongsTo");

    private final String value;

    RelationshipType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
