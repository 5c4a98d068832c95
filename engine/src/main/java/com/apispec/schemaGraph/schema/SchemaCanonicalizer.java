package com.apispec.schemaGraph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Produces order-independent structural fingerprints of schema nodes.
 *
 * Object keys are sorted, display and example annotations are dropped, arrays keep
 * their order. Names under {@code properties} are data, not keywords, so a property
 * called "description" survives. Numeric and string constraints ({@code minimum},
 * {@code maxLength}, ...) take part in equality.
 */
public final class SchemaCanonicalizer {
    private static final Set<String> METADATA_KEYWORDS = Set.of(
        "title", "description", "example", "examples", "externalDocs", "deprecated", "xml", "$comment"
    );
    private static final Set<String> NAME_MAP_KEYWORDS = Set.of(
        "properties", "patternProperties", "definitions", "$defs"
    );
    private static final Set<String> SCHEMA_KEYWORDS = Set.of(
        "items", "additionalProperties", "not", "additionalItems", "contains", "propertyNames"
    );
    private static final Set<String> SCHEMA_LIST_KEYWORDS = Set.of(
        "allOf", "oneOf", "anyOf", "prefixItems"
    );

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private SchemaCanonicalizer() {
    }

    /**
     * @return the canonical JSON text of {@code node}, or {@code "null"} when it is absent
     */
    public static String fingerprint(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return "null";
        }
        return canonicalizeSchema(node).toString();
    }

    public static boolean structurallyEqual(JsonNode a, JsonNode b) {
        return fingerprint(a).equals(fingerprint(b));
    }

    private static JsonNode canonicalizeSchema(JsonNode node) {
        if (node.isArray()) {
            return canonicalizeList(node);
        }
        if (!node.isObject()) {
            return node;
        }

        TreeMap<String, JsonNode> sorted = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (METADATA_KEYWORDS.contains(key) || key.startsWith("x-")) {
                continue;
            }
            JsonNode value = field.getValue();
            if (NAME_MAP_KEYWORDS.contains(key) && value.isObject()) {
                sorted.put(key, canonicalizeNameMap(value));
            } else if (SCHEMA_KEYWORDS.contains(key) || SCHEMA_LIST_KEYWORDS.contains(key)) {
                sorted.put(key, canonicalizeSchema(value));
            } else {
                sorted.put(key, canonicalizeLiteral(value));
            }
        }
        return toObject(sorted);
    }

    private static JsonNode canonicalizeNameMap(JsonNode node) {
        TreeMap<String, JsonNode> sorted = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            sorted.put(field.getKey(), canonicalizeSchema(field.getValue()));
        }
        return toObject(sorted);
    }

    private static JsonNode canonicalizeList(JsonNode node) {
        ArrayNode array = NODES.arrayNode();
        for (JsonNode element : node) {
            array.add(canonicalizeSchema(element));
        }
        return array;
    }

    // enum, const, default, required: key order normalized, nothing dropped
    private static JsonNode canonicalizeLiteral(JsonNode node) {
        if (node.isArray()) {
            ArrayNode array = NODES.arrayNode();
            for (JsonNode element : node) {
                array.add(canonicalizeLiteral(element));
            }
            return array;
        }
        if (!node.isObject()) {
            return node;
        }
        TreeMap<String, JsonNode> sorted = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            sorted.put(field.getKey(), canonicalizeLiteral(field.getValue()));
        }
        return toObject(sorted);
    }

    private static ObjectNode toObject(TreeMap<String, JsonNode> sorted) {
        ObjectNode object = NODES.objectNode();
        sorted.forEach(object::set);
        return object;
    }
}
