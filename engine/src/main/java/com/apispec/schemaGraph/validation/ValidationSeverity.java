package com.apispec.schemaGraph.validation;

public enum ValidationSeverity {
    ERROR,
    WARNING
}
