package com.apispec.schemaGraph.exceptions;

import com.apispec.schemaGraph.export.ExportViolation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a relationships export is assembled from values that break the
 * export contract. The message lists every offending field path, one per line.
 */
public class InvalidExportException extends SchemaGraphException {
    private final List<ExportViolation> violations;

    public InvalidExportException(List<ExportViolation> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    public List<ExportViolation> getViolations() {
        return violations;
    }

    private static String buildMessage(List<ExportViolation> violations) {
        return "Invalid RelationshipsExport structure:\n" + violations.stream()
                .map(violation -> violation.path() + ": " + violation.message())
                .collect(Collectors.joining("\n"));
    }
}
