package com.apispec.schemaGraph.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A schema node classified once into one of four shapes. Every variant keeps
 * the node it was built from so the canonicalizer can fingerprint it.
 */
public sealed interface SchemaRef permits SchemaRef.NamedReference, SchemaRef.InlineObject,
        SchemaRef.InlineArray, SchemaRef.Primitive {

    JsonNode node();

    /** The node's {@code title}, or {@code null}. */
    default String title() {
        JsonNode title = node().get("title");
        if (title != null && title.isTextual() && !title.asText().isBlank()) {
            return title.asText().trim();
        }
        return null;
    }

    /** {@code {"$ref": "#/components/schemas/User"}}. */
    record NamedReference(String name, String ref, JsonNode node) implements SchemaRef {
    }

    /** Object shape: {@code type: object}, {@code properties}, composition keywords or {@code additionalProperties}. */
    record InlineObject(Map<String, SchemaRef> properties, JsonNode node) implements SchemaRef {
        public InlineObject {
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }
    }

    /** Array shape; {@code items} is {@code null} when the array declares no usable item schema. */
    record InlineArray(SchemaRef items, JsonNode node) implements SchemaRef {
    }

    /** Scalar or untyped schema; {@code kind} is {@code null} for an empty schema. */
    record Primitive(String kind, String format, List<String> enumValues, JsonNode node) implements SchemaRef {
        public Primitive {
            enumValues = List.copyOf(enumValues);
        }

        public boolean isEnum() {
            return !enumValues.isEmpty();
        }
    }

    /**
     * Classifies a schema node.
     *
     * @return the classified schema, or {@code null} when {@code node} is absent or not a JSON object
     */
    static SchemaRef of(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }

        JsonNode ref = node.get("$ref");
        if (ref != null && ref.isTextual()) {
            return new NamedReference(DocumentRefs.refName(ref.asText()), ref.asText(), node);
        }

        String type = typeOf(node);
        if ("array".equals(type) || (type == null && node.has("items"))) {
            return new InlineArray(of(node.get("items")), node);
        }

        if ("object".equals(type) || node.has("properties") || node.has("allOf")
                || node.has("oneOf") || node.has("anyOf") || node.has("additionalProperties")) {
            Map<String, SchemaRef> properties = new LinkedHashMap<>();
            JsonNode propertiesNode = node.get("properties");
            if (propertiesNode != null && propertiesNode.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = propertiesNode.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    SchemaRef property = of(field.getValue());
                    if (property != null) {
                        properties.put(field.getKey(), property);
                    }
                }
            }
            return new InlineObject(properties, node);
        }

        List<String> enumValues = new ArrayList<>();
        JsonNode enumNode = node.get("enum");
        if (enumNode != null && enumNode.isArray()) {
            for (JsonNode value : enumNode) {
                if (!value.isNull()) {
                    enumValues.add(value.asText());
                }
            }
        }
        JsonNode format = node.get("format");
        return new Primitive(type, format != null && format.isTextual() ? format.asText() : null, enumValues, node);
    }

    /**
     * Reads {@code type}, accepting the list form ({@code ["string", "null"]}) by taking
     * its first non-null entry.
     */
    static String typeOf(JsonNode node) {
        JsonNode type = node == null ? null : node.get("type");
        if (type == null) {
            return null;
        }
        if (type.isTextual()) {
            return type.asText();
        }
        if (type.isArray()) {
            for (JsonNode entry : type) {
                if (entry.isTextual() && !"null".equals(entry.asText())) {
                    return entry.asText();
                }
            }
        }
        return null;
    }
}
