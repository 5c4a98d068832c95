package com.apispec.schemaGraph;

import com.apispec.schemaGraph.catalog.OperationCatalog;
import com.apispec.schemaGraph.catalog.SpecInfo;
import com.apispec.schemaGraph.export.RelationshipsExport;
import com.apispec.schemaGraph.schema.NamedSchemas;

/**
 * Immutable container for everything one resolution pass derives from a specification.
 *
 * The result is the intermediate model handed to emitters:
 * - the operation catalog (tag -> operations with resolved names, signatures and types)
 * - the named-schema table the types were resolved against
 * - the validated relationship graph, already sorted for serialization
 *
 * Typical usage:
 * ```java
 * ResolutionResult result = new SpecResolver().resolve(document);
 *
 * // result.catalog().operations("pets") lists the pet operations
 * // result.relationships().relationships() lists the inferred graph edges
 * ```
 *
 * @param specInfo      title and version from the document's info object
 * @param catalog       operations grouped by primary tag
 * @param schemas       the named-schema table
 * @param relationships the relationship export
 */
public record ResolutionResult(
    SpecInfo specInfo,
    OperationCatalog catalog,
    NamedSchemas schemas,
    RelationshipsExport relationships
) {
}
