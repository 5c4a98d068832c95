package com.apispec.schemaGraph.catalog;

public enum ParameterLocation {
    PATH("path"),
    QUERY("query"),
    HEADER("header"),
    COOKIE("cookie");

    private final String value;

    ParameterLocation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** @return the location for an {@code in} value, or {@code null} when unknown */
    public static ParameterLocation fromValue(String value) {
        for (ParameterLocation location : values()) {
            if (location.value.equals(value)) {
                return location;
            }
        }
        return null;
    }
}
