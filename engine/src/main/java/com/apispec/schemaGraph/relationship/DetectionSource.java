package com.apispec.schemaGraph.relationship;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The heuristic that produced a piece of evidence. Declaration order is the
 * order in which sources are listed in {@code detectedBy}.
 */
public enum DetectionSource {
    SCHEMA_REF("schema_ref"),
    NAMING_PATTERN("naming_pattern"),
    PATH_PATTERN("path_pattern");

    private final String value;

    DetectionSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
