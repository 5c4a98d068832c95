package com.apispec.schemaGraph.export;

/**
 * One structural problem in a relationships export.
 *
 * @param path JSON-path-like location, e.g. {@code $.relationships[0].evidence}
 */
public record ExportViolation(String path, String message) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
