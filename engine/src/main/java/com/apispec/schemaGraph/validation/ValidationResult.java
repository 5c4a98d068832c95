package com.apispec.schemaGraph.validation;

import java.util.List;

public record ValidationResult(List<ValidationIssue> issues, boolean strict) {
    public ValidationResult {
        issues = List.copyOf(issues);
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(issue -> issue.severity() == ValidationSeverity.ERROR).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(issue -> issue.severity() == ValidationSeverity.WARNING).toList();
    }

    public boolean isValid() {
        return errors().isEmpty() && (!strict || warnings().isEmpty());
    }
}
