package com.apispec.schemaGraph.relationship;

import java.util.Set;

/**
 * Scores a merged relationship from the set of heuristics that agree on it.
 *
 * | sources                   | confidence |
 * |---------------------------|------------|
 * | two or more               | high       |
 * | schema_ref alone          | medium     |
 * | naming or path alone      | low        |
 *
 * Adding a source never lowers the score.
 */
public class ConfidencePolicy {

    public Confidence assess(Set<DetectionSource> sources) {
        if (sources.size() >= 2) {
            return Confidence.HIGH;
        }
        if (sources.contains(DetectionSource.SCHEMA_REF)) {
            return Confidence.MEDIUM;
        }
        return Confidence.LOW;
    }
}
