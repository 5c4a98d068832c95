package com.apispec.schemaGraph.relationship;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RelationshipMergerTest {

    private final RelationshipMerger merger = new RelationshipMerger();

    private static RelationshipCandidate candidate(String source, String target, RelationshipType type,
                                                   DetectionSource detectionSource, String location) {
        return new RelationshipCandidate(source, target, type,
                new Evidence(detectionSource, location, detectionSource.getValue() + " evidence"));
    }

    @Test
    @DisplayName("Should merge schema_ref and naming_pattern agreement into one high-confidence record")
    void testIndependentHeuristicsAgree() {
        List<RelationshipRecord> records = merger.merge(List.of(
                candidate("Order", "Product", RelationshipType.HAS_MANY, DetectionSource.SCHEMA_REF,
                        "components.schemas.Order.properties.products.items"),
                candidate("Order", "Product", RelationshipType.HAS_MANY, DetectionSource.NAMING_PATTERN,
                        "components.schemas.Order.properties.productIds")));

        assertThat(records).hasSize(1);
        RelationshipRecord record = records.get(0);
        assertThat(record.confidence()).isEqualTo(Confidence.HIGH);
        assertThat(record.detectedBy()).containsExactly(DetectionSource.SCHEMA_REF, DetectionSource.NAMING_PATTERN);
        assertThat(record.evidence()).hasSize(2);
    }

    @Test
    @DisplayName("Should fold a belongsTo candidate into the inverse relationship")
    void testBelongsToFoldsIntoInverse() {
        List<RelationshipRecord> records = merger.merge(List.of(
                candidate("Order", "User", RelationshipType.BELONGS_TO, DetectionSource.NAMING_PATTERN,
                        "components.schemas.Order.properties.userId"),
                candidate("User", "Order", RelationshipType.HAS_MANY, DetectionSource.PATH_PATTERN,
                        "paths./users/{userId}/orders")));

        assertThat(records).hasSize(1);
        RelationshipRecord record = records.get(0);
        assertThat(record.sourceEntity()).isEqualTo("User");
        assertThat(record.targetEntity()).isEqualTo("Order");
        assertThat(record.type()).isEqualTo(RelationshipType.HAS_MANY);
        assertThat(record.confidence()).isEqualTo(Confidence.HIGH);
        assertThat(record.detectedBy()).containsExactly(DetectionSource.NAMING_PATTERN, DetectionSource.PATH_PATTERN);
        assertThat(record.evidence()).extracting(Evidence::location)
                .containsExactly("components.schemas.Order.properties.userId", "paths./users/{userId}/orders");
    }

    @Test
    void testUnmatchedBelongsToStays() {
        List<RelationshipRecord> records = merger.merge(List.of(
                candidate("Order", "User", RelationshipType.BELONGS_TO, DetectionSource.NAMING_PATTERN,
                        "components.schemas.Order.properties.userId")));

        assertThat(records).hasSize(1);
        assertThat(records.get(0).type()).isEqualTo(RelationshipType.BELONGS_TO);
        assertThat(records.get(0).confidence()).isEqualTo(Confidence.LOW);
    }

    @Test
    void testDuplicateEvidenceIsSuppressed() {
        RelationshipCandidate path = candidate("User", "Order", RelationshipType.HAS_MANY, DetectionSource.PATH_PATTERN,
                "paths./users/{userId}/orders");

        List<RelationshipRecord> records = merger.merge(List.of(path, path));

        assertThat(records).hasSize(1);
        assertThat(records.get(0).evidence()).hasSize(1);
        assertThat(records.get(0).confidence()).isEqualTo(Confidence.LOW);
    }

    @Test
    void testStrongestHeuristicDecidesType() {
        List<RelationshipRecord> records = merger.merge(List.of(
                candidate("User", "Profile", RelationshipType.HAS_MANY, DetectionSource.PATH_PATTERN, "paths./users/{id}/profiles"),
                candidate("User", "Profile", RelationshipType.HAS_ONE, DetectionSource.SCHEMA_REF,
                        "components.schemas.User.properties.profile")));

        assertThat(records).hasSize(1);
        assertThat(records.get(0).type()).isEqualTo(RelationshipType.HAS_ONE);
        assertThat(records.get(0).detectedBy()).containsExactly(DetectionSource.SCHEMA_REF, DetectionSource.PATH_PATTERN);
    }

    @Test
    void testSchemaRefAloneIsMedium() {
        List<RelationshipRecord> records = merger.merge(List.of(
                candidate("Order", "Customer", RelationshipType.HAS_ONE, DetectionSource.SCHEMA_REF,
                        "components.schemas.Order.properties.customer")));

        assertThat(records.get(0).confidence()).isEqualTo(Confidence.MEDIUM);
    }

    @Test
    @DisplayName("Should never lower confidence when a source is added")
    void testConfidenceIsMonotonic() {
        ConfidencePolicy policy = new ConfidencePolicy();
        List<EnumSet<DetectionSource>> subsets = List.of(
                EnumSet.of(DetectionSource.SCHEMA_REF),
                EnumSet.of(DetectionSource.NAMING_PATTERN),
                EnumSet.of(DetectionSource.PATH_PATTERN),
                EnumSet.of(DetectionSource.SCHEMA_REF, DetectionSource.NAMING_PATTERN),
                EnumSet.of(DetectionSource.NAMING_PATTERN, DetectionSource.PATH_PATTERN),
                EnumSet.allOf(DetectionSource.class));

        for (EnumSet<DetectionSource> subset : subsets) {
            for (DetectionSource extra : DetectionSource.values()) {
                EnumSet<DetectionSource> larger = EnumSet.copyOf(subset);
                larger.add(extra);
                assertThat(policy.assess(larger).compareTo(policy.assess(subset)))
                        .as("%s + %s", subset, extra)
                        .isGreaterThanOrEqualTo(0);
            }
        }
        assertThat(policy.assess(EnumSet.of(DetectionSource.NAMING_PATTERN))).isEqualTo(Confidence.LOW);
        assertThat(policy.assess(EnumSet.of(DetectionSource.PATH_PATTERN))).isEqualTo(Confidence.LOW);
    }

    @Test
    void testMutualRelationships() {
        List<RelationshipRecord> records = merger.merge(List.of(
                candidate("Team", "Member", RelationshipType.HAS_MANY, DetectionSource.SCHEMA_REF, "a"),
                candidate("Member", "Team", RelationshipType.HAS_ONE, DetectionSource.SCHEMA_REF, "b"),
                candidate("Team", "Project", RelationshipType.HAS_MANY, DetectionSource.SCHEMA_REF, "c"),
                candidate("Node", "Node", RelationshipType.HAS_ONE, DetectionSource.SCHEMA_REF, "d")));

        assertThat(MutualRelationships.findMutualPairs(records))
                .containsExactly(new MutualRelationships.MutualPair("Member", "Team"));
        assertThat(MutualRelationships.isMutual(records.get(0), records)).isTrue();
        assertThat(MutualRelationships.isMutual(records.get(2), records)).isFalse();
        assertThat(MutualRelationships.isMutual(records.get(3), records)).isFalse();
    }
}
