package com.apispec.schemaGraph.relationship;

import com.apispec.schemaGraph.schema.DocumentRefs;
import com.apispec.schemaGraph.schema.NamedSchemas;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A named schema property referencing another named schema: {@code hasOne} for a scalar
 * reference, {@code hasMany} for an array of references.
 */
public class SchemaRefDetector implements RelationshipDetector {
    private static final Logger logger = LoggerFactory.getLogger(SchemaRefDetector.class);

    @Override
    public DetectionSource source() {
        return DetectionSource.SCHEMA_REF;
    }

    @Override
    public List<RelationshipCandidate> detect(DetectionContext context) {
        NamedSchemas schemas = context.schemas();
        List<RelationshipCandidate> candidates = new ArrayList<>();

        for (String schemaName : schemas.names()) {
            JsonNode schema = schemas.dereference(schemas.get(schemaName));
            if (schema == null || !schema.isObject()) {
                continue;
            }
            String location = schemas.locationOf(schemaName);
            scanProperties(schemaName, schema.get("properties"), location + ".properties", schemas, candidates);

            JsonNode allOf = schema.get("allOf");
            if (allOf != null && allOf.isArray()) {
                for (int i = 0; i < allOf.size(); i++) {
                    JsonNode member = allOf.get(i);
                    if (!DocumentRefs.isReference(member)) {
                        scanProperties(schemaName, member.get("properties"),
                                location + ".allOf[" + i + "].properties", schemas, candidates);
                    }
                }
            }
        }

        logger.debug("Schema references produced {} candidates", candidates.size());
        return candidates;
    }

    private void scanProperties(String schemaName, JsonNode properties, String location, NamedSchemas schemas,
                                List<RelationshipCandidate> candidates) {
        if (properties == null || !properties.isObject()) {
            return;
        }
        for (Iterator<Map.Entry<String, JsonNode>> iterator = properties.fields(); iterator.hasNext(); ) {
            Map.Entry<String, JsonNode> property = iterator.next();
            String propertyName = property.getKey();
            JsonNode propertySchema = property.getValue();

            String target = referencedName(propertySchema);
            RelationshipType type = RelationshipType.HAS_ONE;
            String propertyLocation = location + "." + propertyName;
            if (target == null && propertySchema.has("items")) {
                target = referencedName(propertySchema.get("items"));
                type = RelationshipType.HAS_MANY;
                propertyLocation = propertyLocation + ".items";
            }
            if (target == null) {
                continue;
            }
            if (!schemas.contains(target)) {
                logger.debug("Property {}.{} references unknown schema {}", schemaName, propertyName, target);
                continue;
            }

            candidates.add(new RelationshipCandidate(schemaName, target, type,
                    new Evidence(DetectionSource.SCHEMA_REF, propertyLocation,
                            "Property \"" + propertyName + "\" references schema " + target)));
        }
    }

    /** Name referenced by a {@code $ref}, or by a single-reference {@code allOf} wrapper. */
    private String referencedName(JsonNode schema) {
        if (schema == null || !schema.isObject()) {
            return null;
        }
        if (DocumentRefs.isReference(schema)) {
            return DocumentRefs.refName(schema.get("$ref").asText());
        }
        JsonNode allOf = schema.get("allOf");
        if (allOf != null && allOf.isArray() && allOf.size() == 1 && DocumentRefs.isReference(allOf.get(0))) {
            return DocumentRefs.refName(allOf.get(0).get("$ref").asText());
        }
        return null;
    }
}
