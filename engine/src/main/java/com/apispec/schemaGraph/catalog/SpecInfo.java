package com.apispec.schemaGraph.catalog;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Title and version from the specification's {@code info} object; either may be {@code null}.
 */
public record SpecInfo(String title, String version) {

    public static SpecInfo unknown() {
        return new SpecInfo(null, null);
    }

    public static SpecInfo from(JsonNode document) {
        if (document == null) {
            return unknown();
        }
        JsonNode info = document.path("info");
        return new SpecInfo(text(info.get("title")), text(info.get("version")));
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
