package com.apispec.schemaGraph.catalog;

import java.util.Locale;

public enum HttpMethod {
    GET, POST, PUT, DELETE, PATCH, HEAD, OPTIONS, TRACE;

    /**
     * @return the method for a path-item key such as {@code "get"}, or {@code null}
     *         for keys that are not verbs ({@code parameters}, {@code summary}, ...)
     */
    public static HttpMethod fromKey(String key) {
        if (key == null) {
            return null;
        }
        for (HttpMethod method : values()) {
            if (method.name().equals(key.toUpperCase(Locale.ROOT))) {
                return method;
            }
        }
        return null;
    }

    public String lowerCase() {
        return name().toLowerCase(Locale.ROOT);
    }
}
