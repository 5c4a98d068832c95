package com.apispec.schemaGraph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Resolves local {@code $ref} pointers ("#/components/parameters/Limit") against the
 * specification document. External references are not followed.
 */
public final class DocumentRefs {
    private static final Logger logger = LoggerFactory.getLogger(DocumentRefs.class);

    private DocumentRefs() {
    }

    public static boolean isReference(JsonNode node) {
        return node != null && node.isObject() && node.has("$ref") && node.get("$ref").isTextual();
    }

    public static boolean isLocalReference(String ref) {
        return ref != null && ref.startsWith("#/");
    }

    /**
     * Follows a chain of local references until a non-reference node is reached.
     *
     * @return the target node, {@code node} itself when it is not a reference, or
     *         {@code null} when the chain is broken, external or cyclic
     */
    public static JsonNode resolve(JsonNode document, JsonNode node) {
        JsonNode current = node;
        Set<String> visited = new HashSet<>();
        while (isReference(current)) {
            String ref = current.get("$ref").asText();
            if (!isLocalReference(ref)) {
                logger.debug("External reference {} is not followed", ref);
                return null;
            }
            if (!visited.add(ref)) {
                logger.warn("Reference cycle detected at {}", ref);
                return null;
            }
            JsonNode target = document == null ? null : document.at(ref.substring(1));
            if (target == null || target.isMissingNode()) {
                logger.warn("Unresolvable reference {}", ref);
                return null;
            }
            current = target;
        }
        return current;
    }

    /**
     * Extracts the referenced name: the last pointer segment with "~1" and "~0" unescaped.
     * E.g. "#/components/schemas/User" -> "User". Returns {@code null} for blank references.
     */
    public static String refName(String ref) {
        if (ref == null || ref.isBlank()) {
            return null;
        }
        String segment = ref.substring(ref.lastIndexOf('/') + 1);
        segment = segment.replace("~1", "/").replace("~0", "~");
        return segment.isEmpty() ? null : segment;
    }
}
