package com.apispec.schemaGraph.relationship;

import java.util.List;

/**
 * One relationship heuristic. Detectors are independent of each other and abstain
 * (return nothing) when their pattern does not match.
 */
public interface RelationshipDetector {

    DetectionSource source();

    List<RelationshipCandidate> detect(DetectionContext context);
}
