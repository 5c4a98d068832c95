package com.apispec.schemaGraph.relationship;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges detector candidates into one {@link RelationshipRecord} per (source, target) pair.
 *
 * A {@code belongsTo} candidate whose inverse pair was found by another candidate is folded
 * into that inverse record: {@code Order belongsTo User} corroborates {@code User hasMany Order}.
 * When candidates for one pair disagree on the type, the strongest heuristic's type wins
 * (schema_ref, then path_pattern, then naming_pattern). Evidence with the same location and
 * details is kept once.
 */
public class RelationshipMerger {
    private static final Logger logger = LoggerFactory.getLogger(RelationshipMerger.class);

    private static final List<DetectionSource> TYPE_PRIORITY = List.of(
        DetectionSource.SCHEMA_REF, DetectionSource.PATH_PATTERN, DetectionSource.NAMING_PATTERN
    );

    private final ConfidencePolicy confidencePolicy;

    public RelationshipMerger() {
        this(new ConfidencePolicy());
    }

    public RelationshipMerger(ConfidencePolicy confidencePolicy) {
        this.confidencePolicy = confidencePolicy;
    }

    public List<RelationshipRecord> merge(List<RelationshipCandidate> candidates) {
        Set<PairKey> nonBelongsToPairs = new HashSet<>();
        for (RelationshipCandidate candidate : candidates) {
            if (candidate.type() != RelationshipType.BELONGS_TO) {
                nonBelongsToPairs.add(new PairKey(candidate.sourceEntity(), candidate.targetEntity()));
            }
        }

        Map<PairKey, List<RelationshipCandidate>> grouped = new LinkedHashMap<>();
        for (RelationshipCandidate candidate : candidates) {
            PairKey key = new PairKey(candidate.sourceEntity(), candidate.targetEntity());
            if (candidate.type() == RelationshipType.BELONGS_TO) {
                PairKey inverse = new PairKey(candidate.targetEntity(), candidate.sourceEntity());
                if (nonBelongsToPairs.contains(inverse)) {
                    logger.debug("Folding {} belongsTo {} into the inverse relationship", key.source(), key.target());
                    key = inverse;
                }
            }
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(candidate);
        }

        List<RelationshipRecord> records = new ArrayList<>();
        for (Map.Entry<PairKey, List<RelationshipCandidate>> entry : grouped.entrySet()) {
            records.add(toRecord(entry.getKey(), entry.getValue()));
        }
        logger.debug("Merged {} candidates into {} relationships", candidates.size(), records.size());
        return records;
    }

    private RelationshipRecord toRecord(PairKey key, List<RelationshipCandidate> candidates) {
        EnumSet<DetectionSource> sources = EnumSet.noneOf(DetectionSource.class);
        List<Evidence> evidence = new ArrayList<>();
        Set<String> seenEvidence = new HashSet<>();
        for (RelationshipCandidate candidate : candidates) {
            sources.add(candidate.source());
            Evidence item = candidate.evidence();
            if (seenEvidence.add(item.location() + "\u0000" + item.details())) {
                evidence.add(item);
            }
        }

        return new RelationshipRecord(key.source(), key.target(), chooseType(key, candidates),
                confidencePolicy.assess(sources), new ArrayList<>(sources), evidence);
    }

    private RelationshipType chooseType(PairKey key, List<RelationshipCandidate> candidates) {
        for (DetectionSource source : TYPE_PRIORITY) {
            for (RelationshipCandidate candidate : candidates) {
                boolean sameDirection = candidate.sourceEntity().equals(key.source());
                if (candidate.source() == source && sameDirection) {
                    return candidate.type();
                }
            }
        }
        return candidates.get(0).type();
    }

    private record PairKey(String source, String target) {
    }
}
