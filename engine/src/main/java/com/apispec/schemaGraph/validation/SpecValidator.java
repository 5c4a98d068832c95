package com.apispec.schemaGraph.validation;

import com.apispec.schemaGraph.catalog.HttpMethod;
import com.apispec.schemaGraph.schema.DocumentRefs;
import com.apispec.schemaGraph.schema.NamedSchemas;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reports specification defects that degrade resolution: missing top-level sections,
 * dangling references, missing or duplicate operationIds, undeclared path parameters
 * and schema names that will be remapped. This is not JSON-Schema validation.
 *
 * The validator never throws; defects only become issues.
 */
public class SpecValidator {
    private static final Logger logger = LoggerFactory.getLogger(SpecValidator.class);

    private static final Pattern PATH_PARAMETER_PATTERN = Pattern.compile("\\{([^}]+)\\}");
    private static final Set<String> REMAPPED_SCHEMA_NAMES = Set.of("Object");

    private final ValidatorOptions options;

    public SpecValidator() {
        this(ValidatorOptions.defaults());
    }

    public SpecValidator(ValidatorOptions options) {
        this.options = options;
    }

    public ValidationResult validate(JsonNode document) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (document == null || !document.isObject()) {
            issues.add(error("$", "document must be a JSON object"));
            return new ValidationResult(issues, options.strict());
        }

        if (!document.has("openapi") && !document.has("swagger")) {
            issues.add(error("$.openapi", "neither openapi nor swagger version is declared"));
        }
        JsonNode info = document.get("info");
        if (info == null || !info.isObject()) {
            issues.add(warning("$.info", "info object is missing"));
        } else if (!info.path("title").isTextual()) {
            issues.add(warning("$.info.title", "title is missing"));
        }

        checkReferences(document, document, "$", issues);
        checkOperations(document, issues);
        checkSchemaNames(document, issues);

        ValidationResult result = new ValidationResult(issues, options.strict());
        logger.info("Validation finished: {} errors, {} warnings", result.errors().size(), result.warnings().size());
        return result;
    }

    private void checkReferences(JsonNode document, JsonNode node, String path, List<ValidationIssue> issues) {
        if (node.isObject()) {
            for (Iterator<Map.Entry<String, JsonNode>> iterator = node.fields(); iterator.hasNext(); ) {
                Map.Entry<String, JsonNode> field = iterator.next();
                String fieldPath = path + "." + field.getKey();
                if ("$ref".equals(field.getKey()) && field.getValue().isTextual()) {
                    checkReference(document, field.getValue().asText(), fieldPath, issues);
                } else {
                    checkReferences(document, field.getValue(), fieldPath, issues);
                }
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                checkReferences(document, node.get(i), path + "[" + i + "]", issues);
            }
        }
    }

    private void checkReference(JsonNode document, String ref, String path, List<ValidationIssue> issues) {
        if (!DocumentRefs.isLocalReference(ref)) {
            issues.add(warning(path, "external reference " + ref + " is not followed"));
            return;
        }
        if (document.at(ref.substring(1)).isMissingNode()) {
            issues.add(error(path, "unresolvable reference " + ref));
        }
    }

    private void checkOperations(JsonNode document, List<ValidationIssue> issues) {
        JsonNode paths = document.get("paths");
        if (paths == null || !paths.isObject()) {
            issues.add(warning("$.paths", "paths object is missing"));
            return;
        }

        Map<String, String> operationIds = new HashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> pathIterator = paths.fields(); pathIterator.hasNext(); ) {
            Map.Entry<String, JsonNode> pathEntry = pathIterator.next();
            String rawPath = pathEntry.getKey();
            JsonNode pathItem = pathEntry.getValue();
            if (rawPath.isBlank()) {
                issues.add(warning("$.paths", "path item with a blank path is ignored"));
                continue;
            }
            if (!pathItem.isObject()) {
                issues.add(error("$.paths." + rawPath, "path item must be an object"));
                continue;
            }

            Set<String> pathLevelParameters = pathParameterNames(document, pathItem.get("parameters"));
            for (Iterator<Map.Entry<String, JsonNode>> methodIterator = pathItem.fields(); methodIterator.hasNext(); ) {
                Map.Entry<String, JsonNode> methodEntry = methodIterator.next();
                if (HttpMethod.fromKey(methodEntry.getKey()) == null) {
                    continue;
                }
                String operationPath = "$.paths." + rawPath + "." + methodEntry.getKey();
                JsonNode operation = methodEntry.getValue();

                JsonNode operationId = operation.get("operationId");
                if (operationId == null || !operationId.isTextual() || operationId.asText().isBlank()) {
                    issues.add(warning(operationPath + ".operationId", "operationId is missing, a method+resource name will be used"));
                } else {
                    String previous = operationIds.putIfAbsent(operationId.asText(), operationPath);
                    if (previous != null) {
                        issues.add(error(operationPath + ".operationId",
                                "duplicate operationId " + operationId.asText() + ", first declared at " + previous));
                    }
                }

                Set<String> declared = new HashSet<>(pathLevelParameters);
                declared.addAll(pathParameterNames(document, operation.get("parameters")));
                Matcher matcher = PATH_PARAMETER_PATTERN.matcher(rawPath);
                while (matcher.find()) {
                    if (!declared.contains(matcher.group(1))) {
                        issues.add(warning(operationPath + ".parameters",
                                "path parameter " + matcher.group(1) + " is not declared"));
                    }
                }
            }
        }
    }

    private Set<String> pathParameterNames(JsonNode document, JsonNode parameters) {
        Set<String> names = new HashSet<>();
        if (parameters == null || !parameters.isArray()) {
            return names;
        }
        for (JsonNode parameterNode : parameters) {
            JsonNode parameter = DocumentRefs.resolve(document, parameterNode);
            if (parameter != null && "path".equals(parameter.path("in").asText()) && parameter.path("name").isTextual()) {
                names.add(parameter.get("name").asText());
            }
        }
        return names;
    }

    private void checkSchemaNames(JsonNode document, List<ValidationIssue> issues) {
        NamedSchemas schemas = NamedSchemas.fromDocument(document);
        for (String name : schemas.names()) {
            if (REMAPPED_SCHEMA_NAMES.contains(name)) {
                issues.add(warning("$." + schemas.locationOf(name), "schema name " + name + " is reserved and will be remapped"));
            }
        }

        JsonNode components = document.path("components").path("schemas");
        String tablePath = components.isObject() ? "$.components.schemas" : "$.definitions";
        JsonNode table = components.isObject() ? components : document.path("definitions");
        for (Iterator<String> names = table.fieldNames(); names.hasNext(); ) {
            if (names.next().isBlank()) {
                issues.add(warning(tablePath, "schema with a blank name is ignored"));
            }
        }
    }

    private static ValidationIssue error(String path, String message) {
        return new ValidationIssue(ValidationSeverity.ERROR, path, message);
    }

    private static ValidationIssue warning(String path, String message) {
        return new ValidationIssue(ValidationSeverity.WARNING, path, message);
    }
}
