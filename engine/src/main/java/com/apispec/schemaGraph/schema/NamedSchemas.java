package com.apispec.schemaGraph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The named-schema table of a specification, in declaration order, with the
 * structural fingerprint of every entry precomputed.
 */
public final class NamedSchemas {
    private static final Logger logger = LoggerFactory.getLogger(NamedSchemas.class);

    private static final String COMPONENTS_LOCATION = "components.schemas";
    private static final String DEFINITIONS_LOCATION = "definitions";

    private final Map<String, JsonNode> schemas;
    private final Map<String, String> fingerprints;
    private final String location;

    private NamedSchemas(Map<String, JsonNode> schemas, String location) {
        this.schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
        this.location = location;
        Map<String, String> computed = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : this.schemas.entrySet()) {
            computed.put(entry.getKey(), SchemaCanonicalizer.fingerprint(entry.getValue()));
        }
        this.fingerprints = Collections.unmodifiableMap(computed);
    }

    /**
     * Reads {@code components.schemas}, or Swagger 2 {@code definitions} when the
     * document has no components section.
     */
    public static NamedSchemas fromDocument(JsonNode document) {
        if (document == null || !document.isObject()) {
            return empty();
        }
        JsonNode components = document.path("components").path("schemas");
        if (components.isObject()) {
            return new NamedSchemas(collect(components), COMPONENTS_LOCATION);
        }
        JsonNode definitions = document.path("definitions");
        if (definitions.isObject()) {
            return new NamedSchemas(collect(definitions), DEFINITIONS_LOCATION);
        }
        logger.debug("Document declares no named schemas");
        return empty();
    }

    public static NamedSchemas of(Map<String, JsonNode> schemas) {
        return new NamedSchemas(schemas, COMPONENTS_LOCATION);
    }

    public static NamedSchemas empty() {
        return new NamedSchemas(Map.of(), COMPONENTS_LOCATION);
    }

    private static Map<String, JsonNode> collect(JsonNode table) {
        Map<String, JsonNode> collected = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = table.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().isBlank()) {
                logger.warn("Skipping schema with a blank name");
            } else if (field.getValue().isObject()) {
                collected.put(field.getKey(), field.getValue());
            } else {
                logger.warn("Skipping schema '{}': not an object", field.getKey());
            }
        }
        return collected;
    }

    /** @return the schema node, or {@code null} when no schema has that name */
    public JsonNode get(String name) {
        return name == null ? null : schemas.get(name);
    }

    public boolean contains(String name) {
        return name != null && schemas.containsKey(name);
    }

    public Set<String> names() {
        return schemas.keySet();
    }

    public Map<String, JsonNode> asMap() {
        return schemas;
    }

    public int size() {
        return schemas.size();
    }

    public boolean isEmpty() {
        return schemas.isEmpty();
    }

    /** Dotted location prefix of a schema, e.g. {@code components.schemas.User}. */
    public String locationOf(String name) {
        return location + "." + name;
    }

    /**
     * Follows {@code $ref}s between named schemas.
     *
     * @return the first non-reference node, or {@code null} for a dangling or cyclic chain
     */
    public JsonNode dereference(JsonNode node) {
        JsonNode current = node;
        int hops = 0;
        while (DocumentRefs.isReference(current)) {
            if (hops++ > schemas.size()) {
                logger.warn("Reference cycle while dereferencing {}", node.get("$ref").asText());
                return null;
            }
            current = get(DocumentRefs.refName(current.get("$ref").asText()));
        }
        return current;
    }

    /**
     * Finds the first named schema, in declaration order, whose fingerprint equals {@code fingerprint}.
     */
    public String findByFingerprint(String fingerprint) {
        for (Map.Entry<String, String> entry : fingerprints.entrySet()) {
            if (entry.getValue().equals(fingerprint)) {
                return entry.getKey();
            }
        }
        return null;
    }
}
