package com.apispec.schemaGraph.relationship;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A merged, scored relationship between two entities.
 * {@code detectedBy} is the union of the evidence sources, in {@link DetectionSource} order.
 */
@JsonPropertyOrder({"sourceEntity", "targetEntity", "type", "confidence", "detectedBy", "evidence"})
public record RelationshipRecord(
    String sourceEntity,
    String targetEntity,
    RelationshipType type,
    Confidence confidence,
    List<DetectionSource> detectedBy,
    List<Evidence> evidence
) {
    public RelationshipRecord {
        detectedBy = detectedBy == null ? null : Collections.unmodifiableList(new ArrayList<>(detectedBy));
        evidence = evidence == null ? null : Collections.unmodifiableList(new ArrayList<>(evidence));
    }
}
