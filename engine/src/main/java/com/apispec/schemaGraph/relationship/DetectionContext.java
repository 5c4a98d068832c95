package com.apispec.schemaGraph.relationship;

import com.apispec.schemaGraph.catalog.OperationCatalog;
import com.apispec.schemaGraph.schema.NamedSchemas;

import java.util.Set;

/**
 * Read-only inputs shared by all detectors.
 *
 * @param entityNames entity names derived from the catalog's tags
 */
public record DetectionContext(OperationCatalog catalog, NamedSchemas schemas, Set<String> entityNames) {

    public DetectionContext {
        entityNames = Set.copyOf(entityNames);
    }

    /**
     * Maps a candidate name onto a known entity or schema name, exact match first,
     * then ignoring case.
     *
     * @return the known name, or {@code null} when the candidate names nothing known
     */
    public String canonicalEntity(String candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return null;
        }
        if (entityNames.contains(candidate) || schemas.contains(candidate)) {
            return candidate;
        }
        for (String name : schemas.names()) {
            if (name.equalsIgnoreCase(candidate)) {
                return name;
            }
        }
        return entityNames.stream()
                .filter(name -> name.equalsIgnoreCase(candidate))
                .sorted()
                .findFirst()
                .orElse(null);
    }
}
