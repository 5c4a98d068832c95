package com.apispec.schemaGraph.relationship;

import com.apispec.schemaGraph.naming.EntityNames;
import com.apispec.schemaGraph.schema.DocumentRefs;
import com.apispec.schemaGraph.schema.NamedSchemas;
import com.apispec.schemaGraph.schema.SchemaRef;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Foreign-key naming conventions on schema properties without a {@code $ref}:
 * {@code userId} / {@code user_id} means the schema {@code belongsTo} User;
 * {@code tagIds} / {@code tag_ids}, or an array-typed {@code tagId}, means it {@code hasMany} Tag.
 *
 * The prefix must name a known entity or schema, and never the declaring schema itself.
 */
public class NamingPatternDetector implements RelationshipDetector {
    private static final Logger logger = LoggerFactory.getLogger(NamingPatternDetector.class);

    private static final Pattern PLURAL_KEY_PATTERN = Pattern.compile("^(.+?)(?:Ids|_ids|IDs)$");
    private static final Pattern SINGULAR_KEY_PATTERN = Pattern.compile("^(.+?)(?:Id|_id|ID)$");

    @Override
    public DetectionSource source() {
        return DetectionSource.NAMING_PATTERN;
    }

    @Override
    public List<RelationshipCandidate> detect(DetectionContext context) {
        NamedSchemas schemas = context.schemas();
        List<RelationshipCandidate> candidates = new ArrayList<>();

        for (String schemaName : schemas.names()) {
            JsonNode schema = schemas.dereference(schemas.get(schemaName));
            if (schema == null || !schema.path("properties").isObject()) {
                continue;
            }
            for (Iterator<Map.Entry<String, JsonNode>> iterator = schema.get("properties").fields(); iterator.hasNext(); ) {
                Map.Entry<String, JsonNode> property = iterator.next();
                RelationshipCandidate candidate = inspect(context, schemaName, property.getKey(), property.getValue());
                if (candidate != null) {
                    candidates.add(candidate);
                }
            }
        }

        logger.debug("Naming patterns produced {} candidates", candidates.size());
        return candidates;
    }

    private RelationshipCandidate inspect(DetectionContext context, String schemaName, String propertyName, JsonNode property) {
        if (DocumentRefs.isReference(property) || DocumentRefs.isReference(property.get("items"))) {
            return null;
        }
        boolean isArray = "array".equals(SchemaRef.typeOf(property));

        String prefix;
        RelationshipType type;
        Matcher plural = PLURAL_KEY_PATTERN.matcher(propertyName);
        Matcher singular = SINGULAR_KEY_PATTERN.matcher(propertyName);
        if (plural.matches() && (isArray || !property.has("type"))) {
            prefix = plural.group(1);
            type = RelationshipType.HAS_MANY;
        } else if (singular.matches()) {
            prefix = singular.group(1);
            type = isArray ? RelationshipType.HAS_MANY : RelationshipType.BELONGS_TO;
        } else {
            return null;
        }

        String candidateName = EntityNames.toPascalCase(prefix);
        String target = context.canonicalEntity(candidateName);
        if (target == null) {
            target = context.canonicalEntity(EntityNames.singularize(candidateName));
        }
        if (target == null || target.equals(schemaName)) {
            return null;
        }

        String details = type == RelationshipType.BELONGS_TO
                ? "Property \"" + propertyName + "\" follows the foreign key naming convention for " + target
                : "Property \"" + propertyName + "\" holds a list of " + target + " keys";
        return new RelationshipCandidate(schemaName, target, type,
                new Evidence(DetectionSource.NAMING_PATTERN,
                        context.schemas().locationOf(schemaName) + ".properties." + propertyName, details));
    }
}
