package com.apispec.schemaGraph.relationship;

/**
 * A single detector finding, before merging.
 */
public record RelationshipCandidate(String sourceEntity, String targetEntity, RelationshipType type, Evidence evidence) {

    public DetectionSource source() {
        return evidence.source();
    }
}
