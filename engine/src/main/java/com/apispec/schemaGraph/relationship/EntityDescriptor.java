package com.apispec.schemaGraph.relationship;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the relationship graph: the entity name, its endpoints and the
 * relationships it is the source of.
 */
@JsonPropertyOrder({"name", "endpoints", "relationships"})
public record EntityDescriptor(String name, List<EndpointDescriptor> endpoints, List<RelationshipRecord> relationships) {
    public EntityDescriptor {
        endpoints = endpoints == null ? null : Collections.unmodifiableList(new ArrayList<>(endpoints));
        relationships = relationships == null ? null : Collections.unmodifiableList(new ArrayList<>(relationships));
    }
}
