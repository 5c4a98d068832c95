package com.apispec.schemaGraph.export;

import com.apispec.schemaGraph.relationship.EntityDescriptor;
import com.apispec.schemaGraph.relationship.MutualRelationships;
import com.apispec.schemaGraph.relationship.RelationshipRecord;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The persisted relationship graph. Instances handed out by
 * {@link RelationshipsExportFactory} have passed {@link RelationshipsExportValidator}.
 */
@JsonPropertyOrder({"metadata", "entities", "relationships"})
public record RelationshipsExport(
    ExportMetadata metadata,
    Map<String, EntityDescriptor> entities,
    List<RelationshipRecord> relationships
) {
    public RelationshipsExport {
        entities = entities == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        relationships = relationships == null ? null : Collections.unmodifiableList(new ArrayList<>(relationships));
    }

    /** Entity pairs related in both directions; derived, never serialized. */
    @JsonIgnore
    public List<MutualRelationships.MutualPair> mutualPairs() {
        return MutualRelationships.findMutualPairs(relationships);
    }
}
