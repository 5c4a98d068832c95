package com.apispec.schemaGraph.relationship;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One heuristic observation supporting a relationship.
 *
 * @param location where it was observed, e.g. {@code components.schemas.Order.properties.userId}
 * @param details  human-readable explanation
 */
@JsonPropertyOrder({"source", "location", "details"})
public record Evidence(DetectionSource source, String location, String details) {
}
