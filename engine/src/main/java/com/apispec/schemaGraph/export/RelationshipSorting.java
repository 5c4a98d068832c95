package com.apispec.schemaGraph.export;

import com.apispec.schemaGraph.relationship.EntityDescriptor;
import com.apispec.schemaGraph.relationship.RelationshipRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic ordering for serialization. Both operations return new collections
 * and leave their argument untouched.
 */
public final class RelationshipSorting {
    private static final Comparator<RelationshipRecord> BY_SOURCE_THEN_TARGET = Comparator
            .comparing(RelationshipRecord::sourceEntity)
            .thenComparing(RelationshipRecord::targetEntity)
            .thenComparing(record -> record.type().getValue());

    private RelationshipSorting() {
    }

    /** Sorts by (sourceEntity, targetEntity), with the type as a final tie-breaker. */
    public static List<RelationshipRecord> sortRelationships(List<RelationshipRecord> relationships) {
        List<RelationshipRecord> sorted = new ArrayList<>(relationships);
        sorted.sort(BY_SOURCE_THEN_TARGET);
        return sorted;
    }

    /** Orders the entity map by name. */
    public static Map<String, EntityDescriptor> sortEntities(Map<String, EntityDescriptor> entities) {
        return new LinkedHashMap<>(new TreeMap<>(entities));
    }
}
