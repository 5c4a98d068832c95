package com.apispec.schemaGraph.relationship;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordinal strength of a relationship, weakest first. Labels, not probabilities.
 */
public enum Confidence {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    Confidence(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
