package com.apispec.schemaGraph.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * One parameter of an operation signature.
 *
 * @param sourceName    name as declared in the specification
 * @param sanitizedName identifier-safe name, unique within the operation
 * @param location      where the value travels
 * @param inferredType  resolved type name ({@code string}, {@code number}, an enum type, ...)
 * @param optional      {@code false} for path parameters and explicitly required ones
 * @param description   declared description, or {@code null}
 */
public record ParameterDescriptor(
    String sourceName,
    String sanitizedName,
    ParameterLocation location,
    String inferredType,
    boolean optional,
    String description
) {

    /**
     * Stable partition: required parameters first, each group keeping its relative order.
     */
    public static List<ParameterDescriptor> requiredFirst(List<ParameterDescriptor> parameters) {
        List<ParameterDescriptor> ordered = new ArrayList<>(parameters.size());
        for (ParameterDescriptor parameter : parameters) {
            if (!parameter.optional()) {
                ordered.add(parameter);
            }
        }
        for (ParameterDescriptor parameter : parameters) {
            if (parameter.optional()) {
                ordered.add(parameter);
            }
        }
        return ordered;
    }
}
