package com.apispec.schemaGraph.relationship;

import com.apispec.schemaGraph.catalog.OperationDescriptor;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * An operation as listed under its entity in the export. The description is the
 * operation's {@code description}, or its {@code summary} when it has none.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"method", "path", "operationId", "description"})
public record EndpointDescriptor(String method, String path, String operationId, String description) {

    public static EndpointDescriptor of(OperationDescriptor operation) {
        String description = operation.description() != null ? operation.description() : operation.summary();
        return new EndpointDescriptor(operation.httpMethod().name(), operation.rawPath(), operation.operationId(), description);
    }
}
