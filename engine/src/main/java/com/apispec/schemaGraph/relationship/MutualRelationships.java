package com.apispec.schemaGraph.relationship;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Bidirectional pairs, derived on demand from a merged relationship list.
 */
public final class MutualRelationships {

    private MutualRelationships() {
    }

    /**
     * An unordered entity pair, stored with {@code first <= second}.
     */
    public record MutualPair(String first, String second) implements Comparable<MutualPair> {

        static MutualPair of(String a, String b) {
            return a.compareTo(b) <= 0 ? new MutualPair(a, b) : new MutualPair(b, a);
        }

        @Override
        public int compareTo(MutualPair other) {
            int byFirst = first.compareTo(other.first);
            return byFirst != 0 ? byFirst : second.compareTo(other.second);
        }
    }

    /** @return the pairs related in both directions, sorted */
    public static List<MutualPair> findMutualPairs(List<RelationshipRecord> relationships) {
        Set<String> directed = new HashSet<>();
        for (RelationshipRecord record : relationships) {
            directed.add(record.sourceEntity() + "\u0000" + record.targetEntity());
        }

        Set<MutualPair> pairs = new TreeSet<>();
        for (RelationshipRecord record : relationships) {
            if (record.sourceEntity().equals(record.targetEntity())) {
                continue;
            }
            if (directed.contains(record.targetEntity() + "\u0000" + record.sourceEntity())) {
                pairs.add(MutualPair.of(record.sourceEntity(), record.targetEntity()));
            }
        }
        return List.copyOf(pairs);
    }

    public static boolean isMutual(RelationshipRecord record, List<RelationshipRecord> relationships) {
        for (RelationshipRecord other : relationships) {
            if (other.sourceEntity().equals(record.targetEntity()) && other.targetEntity().equals(record.sourceEntity())
                    && !record.sourceEntity().equals(record.targetEntity())) {
                return true;
            }
        }
        return false;
    }
}
