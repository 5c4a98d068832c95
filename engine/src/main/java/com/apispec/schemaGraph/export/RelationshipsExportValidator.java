package com.apispec.schemaGraph.export;

import com.apispec.schemaGraph.relationship.DetectionSource;
import com.apispec.schemaGraph.relationship.EndpointDescriptor;
import com.apispec.schemaGraph.relationship.EntityDescriptor;
import com.apispec.schemaGraph.relationship.Evidence;
import com.apispec.schemaGraph.relationship.RelationshipRecord;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks the shape of a relationships export and reports every violation found.
 * Validation never stops at the first problem.
 */
public class RelationshipsExportValidator {
    private static final Pattern SEMVER_PATTERN = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");
    private static final Pattern TIMESTAMP_PATTERN = Pattern.compile(
        "^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}(?::\\d{2}(?:\\.\\d+)?)?)(Z|[+-]\\d{2}:?\\d{2})$");
    private static final Set<String> HTTP_METHODS = Set.of(
        "GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS", "TRACE");

    public List<ExportViolation> validate(ExportMetadata metadata, Map<String, EntityDescriptor> entities,
                                          List<RelationshipRecord> relationships) {
        List<ExportViolation> violations = new ArrayList<>();
        validateMetadata(metadata, entities, relationships, violations);
        validateEntities(entities, violations);
        validateRelationships("$.relationships", relationships, violations);
        return violations;
    }

    public List<ExportViolation> validate(RelationshipsExport export) {
        return validate(export.metadata(), export.entities(), export.relationships());
    }

    private void validateMetadata(ExportMetadata metadata, Map<String, EntityDescriptor> entities,
                                  List<RelationshipRecord> relationships, List<ExportViolation> violations) {
        if (metadata == null) {
            violations.add(new ExportViolation("$.metadata", "is required"));
            return;
        }
        if (!isTimestamp(metadata.generatedAt())) {
            violations.add(new ExportViolation("$.metadata.generatedAt",
                    "must be an ISO-8601 timestamp with a time part and a UTC offset, got " + quote(metadata.generatedAt())));
        }
        if (metadata.exportVersion() == null || !SEMVER_PATTERN.matcher(metadata.exportVersion()).matches()) {
            violations.add(new ExportViolation("$.metadata.exportVersion",
                    "must match MAJOR.MINOR.PATCH, got " + quote(metadata.exportVersion())));
        }
        if (metadata.totalEntities() < 0) {
            violations.add(new ExportViolation("$.metadata.totalEntities", "must be non-negative"));
        } else if (entities != null && metadata.totalEntities() != entities.size()) {
            violations.add(new ExportViolation("$.metadata.totalEntities",
                    "is " + metadata.totalEntities() + " but there are " + entities.size() + " entities"));
        }
        if (metadata.totalRelationships() < 0) {
            violations.add(new ExportViolation("$.metadata.totalRelationships", "must be non-negative"));
        } else if (relationships != null && metadata.totalRelationships() != relationships.size()) {
            violations.add(new ExportViolation("$.metadata.totalRelationships",
                    "is " + metadata.totalRelationships() + " but there are " + relationships.size() + " relationships"));
        }
    }

    private void validateEntities(Map<String, EntityDescriptor> entities, List<ExportViolation> violations) {
        if (entities == null) {
            violations.add(new ExportViolation("$.entities", "is required"));
            return;
        }
        for (Map.Entry<String, EntityDescriptor> entry : entities.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isEmpty()) {
                violations.add(new ExportViolation("$.entities", "entity keys must be non-empty"));
                continue;
            }
            String path = "$.entities." + key;
            EntityDescriptor entity = entry.getValue();
            if (entity == null) {
                violations.add(new ExportViolation(path, "is null"));
                continue;
            }
            if (!key.equals(entity.name())) {
                violations.add(new ExportViolation(path + ".name",
                        "must equal its key " + quote(key) + ", got " + quote(entity.name())));
            }
            validateEndpoints(path + ".endpoints", entity.endpoints(), violations);
            validateRelationships(path + ".relationships", entity.relationships(), violations);
        }
    }

    private void validateEndpoints(String path, List<EndpointDescriptor> endpoints, List<ExportViolation> violations) {
        if (endpoints == null) {
            violations.add(new ExportViolation(path, "is required"));
            return;
        }
        for (int i = 0; i < endpoints.size(); i++) {
            String endpointPath = path + "[" + i + "]";
            EndpointDescriptor endpoint = endpoints.get(i);
            if (endpoint == null) {
                violations.add(new ExportViolation(endpointPath, "is null"));
                continue;
            }
            if (endpoint.method() == null || !HTTP_METHODS.contains(endpoint.method())) {
                violations.add(new ExportViolation(endpointPath + ".method",
                        "must be an upper-case HTTP method, got " + quote(endpoint.method())));
            }
            if (isBlank(endpoint.path())) {
                violations.add(new ExportViolation(endpointPath + ".path", "must be non-empty"));
            }
        }
    }

    private void validateRelationships(String path, List<RelationshipRecord> relationships, List<ExportViolation> violations) {
        if (relationships == null) {
            violations.add(new ExportViolation(path, "is required"));
            return;
        }
        for (int i = 0; i < relationships.size(); i++) {
            validateRelationship(path + "[" + i + "]", relationships.get(i), violations);
        }
    }

    private void validateRelationship(String path, RelationshipRecord relationship, List<ExportViolation> violations) {
        if (relationship == null) {
            violations.add(new ExportViolation(path, "is null"));
            return;
        }
        if (isBlank(relationship.sourceEntity())) {
            violations.add(new ExportViolation(path + ".sourceEntity", "must be non-empty"));
        }
        if (isBlank(relationship.targetEntity())) {
            violations.add(new ExportViolation(path + ".targetEntity", "must be non-empty"));
        }
        if (relationship.type() == null) {
            violations.add(new ExportViolation(path + ".type", "is required"));
        }
        if (relationship.confidence() == null) {
            violations.add(new ExportViolation(path + ".confidence", "is required"));
        }

        Set<DetectionSource> evidenceSources = EnumSet.noneOf(DetectionSource.class);
        List<Evidence> evidence = relationship.evidence();
        if (evidence == null || evidence.isEmpty()) {
            violations.add(new ExportViolation(path + ".evidence", "must contain at least one item"));
        } else {
            for (int i = 0; i < evidence.size(); i++) {
                String itemPath = path + ".evidence[" + i + "]";
                Evidence item = evidence.get(i);
                if (item == null) {
                    violations.add(new ExportViolation(itemPath, "is null"));
                    continue;
                }
                if (item.source() == null) {
                    violations.add(new ExportViolation(itemPath + ".source", "is required"));
                } else {
                    evidenceSources.add(item.source());
                }
                if (isBlank(item.location())) {
                    violations.add(new ExportViolation(itemPath + ".location", "must be non-empty"));
                }
                if (isBlank(item.details())) {
                    violations.add(new ExportViolation(itemPath + ".details", "must be non-empty"));
                }
            }
        }

        List<DetectionSource> detectedBy = relationship.detectedBy();
        if (detectedBy == null || detectedBy.isEmpty()) {
            violations.add(new ExportViolation(path + ".detectedBy", "must contain at least one source"));
        } else if (detectedBy.contains(null)) {
            violations.add(new ExportViolation(path + ".detectedBy", "must not contain null"));
        } else if (!evidenceSources.isEmpty() && !EnumSet.copyOf(detectedBy).equals(evidenceSources)) {
            violations.add(new ExportViolation(path + ".detectedBy",
                    "must equal the sources of its evidence " + evidenceSources + ", got " + detectedBy));
        }
    }

    static boolean isTimestamp(String value) {
        if (value == null) {
            return false;
        }
        Matcher matcher = TIMESTAMP_PATTERN.matcher(value);
        if (!matcher.matches()) {
            return false;
        }
        String offset = matcher.group(2);
        if (!"Z".equals(offset) && offset.indexOf(':') < 0) {
            offset = offset.substring(0, 3) + ":" + offset.substring(3);
        }
        try {
            OffsetDateTime.parse(matcher.group(1) + offset);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String quote(String value) {
        return value == null ? "null" : "\"" + value + "\"";
    }
}
