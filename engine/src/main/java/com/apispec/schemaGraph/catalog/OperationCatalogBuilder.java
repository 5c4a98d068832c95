package com.apispec.schemaGraph.catalog;

import com.apispec.schemaGraph.naming.EntityNames;
import com.apispec.schemaGraph.naming.IdentifierNormalizer;
import com.apispec.schemaGraph.naming.NamingConvention;
import com.apispec.schemaGraph.schema.DocumentRefs;
import com.apispec.schemaGraph.schema.NamedSchemas;
import com.apispec.schemaGraph.schema.ParameterContext;
import com.apispec.schemaGraph.schema.SchemaRef;
import com.apispec.schemaGraph.schema.TypeResolver;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the {@link OperationCatalog} of a specification document.
 *
 * Every (path, method) pair with a recognised verb becomes one {@link OperationDescriptor},
 * filed under the operation's first tag ({@value EntityNames#DEFAULT_TAG} when it has none).
 * Malformed entries are skipped with a warning; the builder never throws.
 */
public class OperationCatalogBuilder {
    private static final Logger logger = LoggerFactory.getLogger(OperationCatalogBuilder.class);

    public OperationCatalog buildCatalog(JsonNode document) {
        if (document == null || !document.isObject()) {
            logger.warn("Specification document is not an object, catalog is empty");
            return OperationCatalog.empty();
        }

        JsonNode paths = document.get("paths");
        if (paths == null || !paths.isObject()) {
            logger.warn("No paths found in specification document");
            return OperationCatalog.empty();
        }

        NamedSchemas schemas = NamedSchemas.fromDocument(document);
        Map<String, List<OperationDescriptor>> operationsByTag = new LinkedHashMap<>();

        for (Iterator<Map.Entry<String, JsonNode>> pathIterator = paths.fields(); pathIterator.hasNext(); ) {
            Map.Entry<String, JsonNode> pathEntry = pathIterator.next();
            String rawPath = pathEntry.getKey();
            if (rawPath.isBlank()) {
                logger.warn("Skipping path item with a blank path");
                continue;
            }
            JsonNode pathItem = DocumentRefs.resolve(document, pathEntry.getValue());
            if (pathItem == null || !pathItem.isObject()) {
                logger.warn("Skipping path {}: path item is not an object", rawPath);
                continue;
            }

            for (Iterator<Map.Entry<String, JsonNode>> methodIterator = pathItem.fields(); methodIterator.hasNext(); ) {
                Map.Entry<String, JsonNode> methodEntry = methodIterator.next();
                HttpMethod method = HttpMethod.fromKey(methodEntry.getKey());
                if (method == null) {
                    continue;
                }
                JsonNode operation = methodEntry.getValue();
                if (!operation.isObject()) {
                    logger.warn("Skipping {} {}: operation is not an object", method, rawPath);
                    continue;
                }

                OperationDescriptor descriptor = buildOperation(document, schemas, rawPath, method, pathItem, operation);
                operationsByTag.computeIfAbsent(descriptor.tag(), t -> new ArrayList<>()).add(descriptor);
            }
        }

        OperationCatalog catalog = new OperationCatalog(operationsByTag);
        logger.info("Built catalog: {} operations across {} tags", catalog.size(), catalog.tags().size());
        return catalog;
    }

    private OperationDescriptor buildOperation(JsonNode document, NamedSchemas schemas, String rawPath,
                                               HttpMethod method, JsonNode pathItem, JsonNode operation) {
        String tag = primaryTag(operation);
        String entityName = EntityNames.entityNameForTag(tag);
        String operationId = text(operation.get("operationId"));
        String normalizedName = IdentifierNormalizer.operationName(operationId, method.lowerCase(), EntityNames.toPascalCase(tag));
        NamingConvention convention = IdentifierNormalizer.detectConvention(operationId);

        List<JsonNode> declaredParameters = mergeParameters(document, pathItem.get("parameters"), operation.get("parameters"));
        List<ParameterDescriptor> parameters = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();
        JsonNode legacyBodySchema = null;
        boolean legacyForm = false;

        for (JsonNode parameter : declaredParameters) {
            String name = text(parameter.get("name"));
            String in = text(parameter.get("in"));
            if ("body".equals(in)) {
                legacyBodySchema = parameter.get("schema");
                continue;
            }
            if ("formData".equals(in)) {
                legacyForm = legacyForm || "file".equals(text(parameter.get("type")));
                continue;
            }
            ParameterLocation location = ParameterLocation.fromValue(in);
            if (location == null) {
                logger.warn("Skipping parameter {} of {} {}: unknown location '{}'", name, method, rawPath, in);
                continue;
            }

            boolean required = location == ParameterLocation.PATH || parameter.path("required").asBoolean(false);
            JsonNode schema = parameter.has("schema") ? parameter.get("schema") : parameter;
            String inferredType = TypeResolver.resolveParameterType(schema, new ParameterContext(entityName, name, schemas));
            String sanitizedName = EntityNames.makeUnique(EntityNames.sanitizeParameterName(name), usedNames);

            parameters.add(new ParameterDescriptor(name, sanitizedName, location, inferredType, !required,
                    text(parameter.get("description"))));
        }

        JsonNode requestBody = null;
        if (operation.has("requestBody")) {
            requestBody = DocumentRefs.resolve(document, operation.get("requestBody"));
            if (requestBody == null) {
                logger.warn("Request body of {} {} could not be resolved", method, rawPath);
            }
        }

        JsonNode bodySchemaNode = requestBody != null ? TypeResolver.bodySchema(requestBody) : legacyBodySchema;
        SchemaRef bodySchema = SchemaRef.of(bodySchemaNode);
        String bodyType = operation.has("requestBody")
                ? TypeResolver.resolveBodyType(document, operation.get("requestBody"), schemas)
                : legacyBodySchema != null ? TypeResolver.resolveType(legacyBodySchema, schemas) : null;
        boolean bodyRequired = requestBody != null ? requestBody.path("required").asBoolean(false) : legacyBodySchema != null;

        JsonNode successResponse = DocumentRefs.resolve(document, TypeResolver.selectSuccessResponse(operation.get("responses")));
        JsonNode responseSchemaNode = TypeResolver.responseSchema(successResponse);
        String responseType = TypeResolver.resolveResponseType(document, operation.get("responses"), schemas);

        boolean declaresBody = operation.has("requestBody") || legacyBodySchema != null;
        boolean multipart = ContentClassifier.isMultipart(operation, requestBody, declaresBody, legacyForm);
        String fileFieldName = multipart ? ContentClassifier.fileFieldName(document, requestBody) : null;
        boolean binaryResponse = ContentClassifier.isBinaryResponse(operation, successResponse);

        logger.debug("{} {} -> {} ({} parameters, body {}, response {})",
                method, rawPath, normalizedName, parameters.size(), bodyType, responseType);

        return new OperationDescriptor(
            method,
            rawPath,
            operationId,
            normalizedName,
            convention,
            tag,
            text(operation.get("summary")),
            text(operation.get("description")),
            operation.path("deprecated").asBoolean(false),
            ParameterDescriptor.requiredFirst(parameters),
            bodySchema,
            bodyType,
            bodyRequired,
            SchemaRef.of(responseSchemaNode),
            responseType,
            multipart,
            fileFieldName,
            binaryResponse
        );
    }

    /**
     * Path-level parameters followed by operation-level ones; an operation-level entry
     * replaces the path-level entry with the same (name, in).
     */
    private List<JsonNode> mergeParameters(JsonNode document, JsonNode pathParameters, JsonNode operationParameters) {
        Map<String, JsonNode> merged = new LinkedHashMap<>();
        addParameters(document, pathParameters, merged);
        addParameters(document, operationParameters, merged);
        return new ArrayList<>(merged.values());
    }

    private void addParameters(JsonNode document, JsonNode parameters, Map<String, JsonNode> merged) {
        if (parameters == null || !parameters.isArray()) {
            return;
        }
        for (JsonNode parameterNode : parameters) {
            JsonNode parameter = DocumentRefs.resolve(document, parameterNode);
            if (parameter == null || !parameter.isObject()) {
                logger.warn("Skipping unresolvable parameter {}", parameterNode);
                continue;
            }
            String name = text(parameter.get("name"));
            String in = text(parameter.get("in"));
            if (name == null || in == null) {
                logger.warn("Skipping parameter without name or location: {}", parameter);
                continue;
            }
            merged.put(in + ":" + name, parameter);
        }
    }

    private String primaryTag(JsonNode operation) {
        JsonNode tags = operation.get("tags");
        if (tags != null && tags.isArray()) {
            for (JsonNode tag : tags) {
                if (tag.isTextual() && !tag.asText().isBlank()) {
                    return tag.asText().trim();
                }
            }
        }
        return EntityNames.DEFAULT_TAG;
    }

    private static String text(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
