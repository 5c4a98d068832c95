package com.apispec.schemaGraph.catalog;

import com.apispec.schemaGraph.naming.NamingConvention;
import com.apispec.schemaGraph.schema.SchemaRef;

import java.util.List;

/**
 * A resolved (path, method) pair.
 *
 * {@code bodyType} is {@code null} when the operation takes no typed body;
 * {@code responseType} is never {@code null} ({@code void} or {@code any} at worst).
 */
public record OperationDescriptor(
    HttpMethod httpMethod,
    String rawPath,
    String operationId,
    String normalizedName,
    NamingConvention convention,
    String tag,
    String summary,
    String description,
    boolean deprecated,
    List<ParameterDescriptor> parameters,
    SchemaRef bodySchema,
    String bodyType,
    boolean bodyRequired,
    SchemaRef responseSchema,
    String responseType,
    boolean multipart,
    String fileFieldName,
    boolean binaryResponse
) {
    public OperationDescriptor {
        parameters = List.copyOf(parameters);
    }

    public List<ParameterDescriptor> requiredParameters() {
        return parameters.stream().filter(p -> !p.optional()).toList();
    }

    public List<ParameterDescriptor> optionalParameters() {
        return parameters.stream().filter(ParameterDescriptor::optional).toList();
    }

    public List<ParameterDescriptor> parametersIn(ParameterLocation location) {
        return parameters.stream().filter(p -> p.location() == location).toList();
    }
}
