package com.apispec.schemaGraph.schema;

/**
 * Where a parameter appears: the entity owning the operation, the parameter's source
 * name and the named-schema table. Lets enum parameters resolve to the enumeration
 * declared on the entity's own schema.
 */
public record ParameterContext(String entityName, String parameterName, NamedSchemas schemas) {
}
