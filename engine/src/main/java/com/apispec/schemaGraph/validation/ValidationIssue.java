package com.apispec.schemaGraph.validation;

/**
 * A defect found in a specification document.
 *
 * @param path location in the document, e.g. {@code $.paths./pets.get.operationId}
 */
public record ValidationIssue(ValidationSeverity severity, String path, String message) {

    @Override
    public String toString() {
        return severity + " " + path + ": " + message;
    }
}
