package com.apispec.schemaGraph.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Operations grouped by primary tag. Tags keep first-appearance order and
 * operations keep document declaration order within a tag.
 */
public final class OperationCatalog {
    private final Map<String, List<OperationDescriptor>> operationsByTag;

    public OperationCatalog(Map<String, List<OperationDescriptor>> operationsByTag) {
        Map<String, List<OperationDescriptor>> copy = new LinkedHashMap<>();
        operationsByTag.forEach((tag, operations) -> copy.put(tag, List.copyOf(operations)));
        this.operationsByTag = Collections.unmodifiableMap(copy);
    }

    public static OperationCatalog empty() {
        return new OperationCatalog(Map.of());
    }

    public Set<String> tags() {
        return operationsByTag.keySet();
    }

    /** @return the tag's operations, empty for an unknown tag */
    public List<OperationDescriptor> operations(String tag) {
        return operationsByTag.getOrDefault(tag, List.of());
    }

    public List<OperationDescriptor> allOperations() {
        List<OperationDescriptor> all = new ArrayList<>();
        operationsByTag.values().forEach(all::addAll);
        return all;
    }

    public Map<String, List<OperationDescriptor>> asMap() {
        return operationsByTag;
    }

    public int size() {
        return operationsByTag.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return operationsByTag.isEmpty();
    }
}
