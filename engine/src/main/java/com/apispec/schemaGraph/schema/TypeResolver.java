package com.apispec.schemaGraph.schema;

import com.apispec.schemaGraph.naming.EntityNames;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Assigns type names to parameter, body and response schemas.
 *
 * Resolution order, first match wins:
 * 1. named reference -> the schema name ({@code Object} becomes {@code ObjectDto})
 * 2. array of a named reference -> {@code Name[]}
 * 3. array of an inline node -> structural match of the items, then a {@code title} hint,
 *    then {@code any[]}
 * 4. inline object -> structural match of the whole node, then {@code title} hint, then {@code object};
 *    an inline primitive without a structural match is unresolved
 * 5. no schema at all -> {@code void}; unresolved -> {@code any}
 *
 * Nothing here throws. Every method is a pure function of its arguments.
 */
public final class TypeResolver {
    private static final Logger logger = LoggerFactory.getLogger(TypeResolver.class);

    private static final Pattern SUCCESS_STATUS_PATTERN = Pattern.compile("^2(\\d\\d|XX|xx)$");
    private static final String JSON_MEDIA_TYPE = "application/json";

    private TypeResolver() {
    }

    public static String resolveType(JsonNode schema, NamedSchemas schemas) {
        if (schema == null || schema.isMissingNode() || schema.isNull()) {
            return TypeNames.VOID;
        }
        return resolveType(SchemaRef.of(schema), schemas);
    }

    public static String resolveType(SchemaRef schema, NamedSchemas schemas) {
        if (schema == null) {
            return TypeNames.ANY;
        }
        String name = resolveInlineName(schema, schemas);
        return name != null ? name : TypeNames.ANY;
    }

    /**
     * Same as {@link #resolveType(SchemaRef, NamedSchemas)} but returns {@code null}
     * when the schema resolves to no name and no object shape.
     */
    public static String resolveInlineName(SchemaRef schema, NamedSchemas schemas) {
        NamedSchemas table = schemas != null ? schemas : NamedSchemas.empty();
        if (schema == null) {
            return null;
        }

        if (schema instanceof SchemaRef.NamedReference reference) {
            return namedType(reference, table);
        }

        if (schema instanceof SchemaRef.InlineArray array) {
            return resolveArray(array, table);
        }

        if (schema instanceof SchemaRef.InlineObject object) {
            String matched = table.findByFingerprint(SchemaCanonicalizer.fingerprint(object.node()));
            if (matched != null) {
                logger.debug("Inline object matched named schema {}", matched);
                return EntityNames.remapReservedTypeName(matched);
            }
            String hint = titleHint(object.title());
            return hint != null ? hint : TypeNames.OBJECT;
        }

        String matched = table.findByFingerprint(SchemaCanonicalizer.fingerprint(schema.node()));
        return matched != null ? EntityNames.remapReservedTypeName(matched) : null;
    }

    private static String resolveArray(SchemaRef.InlineArray array, NamedSchemas table) {
        SchemaRef items = array.items();
        if (items instanceof SchemaRef.NamedReference reference) {
            String itemName = namedType(reference, table);
            return itemName != null ? TypeNames.arrayOf(itemName) : TypeNames.ANY_ARRAY;
        }

        if (items != null) {
            String itemMatch = table.findByFingerprint(SchemaCanonicalizer.fingerprint(items.node()));
            if (itemMatch != null) {
                return TypeNames.arrayOf(EntityNames.remapReservedTypeName(itemMatch));
            }
        }

        String arrayMatch = table.findByFingerprint(SchemaCanonicalizer.fingerprint(array.node()));
        if (arrayMatch != null) {
            return EntityNames.remapReservedTypeName(arrayMatch);
        }

        String hint = titleHint(array.title());
        if (hint != null) {
            return hint;
        }
        if (items != null) {
            String itemHint = titleHint(items.title());
            if (itemHint != null) {
                return TypeNames.arrayOf(itemHint);
            }
        }
        return TypeNames.ANY_ARRAY;
    }

    private static String namedType(SchemaRef.NamedReference reference, NamedSchemas table) {
        if (reference.name() == null || !table.contains(reference.name())) {
            logger.warn("Reference {} does not name a known schema", reference.ref());
            return null;
        }
        return EntityNames.remapReservedTypeName(reference.name());
    }

    private static String titleHint(String title) {
        if (title == null) {
            return null;
        }
        String name = EntityNames.toPascalCase(title);
        if (name.isEmpty() || Character.isDigit(name.charAt(0))) {
            return null;
        }
        return EntityNames.remapReservedTypeName(name);
    }

    /**
     * Resolves a request body, following a {@code $ref} to {@code components.requestBodies}.
     *
     * @param document    the specification the reference points into
     * @param requestBody the operation's {@code requestBody}, may be {@code null}
     * @return {@code null} when there is no body, the reference is broken, or the body declares no schema
     */
    public static String resolveBodyType(JsonNode document, JsonNode requestBody, NamedSchemas schemas) {
        JsonNode schema = bodySchema(DocumentRefs.resolve(document, requestBody));
        if (schema == null) {
            return null;
        }
        return resolveType(schema, schemas);
    }

    /**
     * Resolves the type of an operation's success response, following a {@code $ref}
     * to {@code components.responses}.
     *
     * @param document  the specification the reference points into
     * @param responses the operation's {@code responses} map
     * @return {@code void} without a success response or schema, {@code any} when the
     *         success response is a broken reference
     */
    public static String resolveResponseType(JsonNode document, JsonNode responses, NamedSchemas schemas) {
        JsonNode response = selectSuccessResponse(responses);
        if (response == null) {
            return TypeNames.VOID;
        }
        JsonNode resolved = DocumentRefs.resolve(document, response);
        if (resolved == null) {
            return TypeNames.ANY;
        }
        JsonNode schema = responseSchema(resolved);
        return schema == null ? TypeNames.VOID : resolveType(schema, schemas);
    }

    /**
     * Picks the success response: {@code 200}, then {@code 201}, then any other 2xx code,
     * then {@code default}.
     */
    public static JsonNode selectSuccessResponse(JsonNode responses) {
        if (responses == null || !responses.isObject()) {
            return null;
        }
        if (responses.has("200")) {
            return responses.get("200");
        }
        if (responses.has("201")) {
            return responses.get("201");
        }
        Iterator<String> codes = responses.fieldNames();
        while (codes.hasNext()) {
            String code = codes.next();
            if (SUCCESS_STATUS_PATTERN.matcher(code).matches()) {
                return responses.get(code);
            }
        }
        return responses.get("default");
    }

    /** Schema of a response: its content schema, or the Swagger 2 {@code schema} field. */
    public static JsonNode responseSchema(JsonNode response) {
        if (response == null || !response.isObject()) {
            return null;
        }
        JsonNode schema = contentSchema(response.get("content"));
        if (schema != null) {
            return schema;
        }
        JsonNode legacy = response.get("schema");
        return legacy != null && legacy.isObject() ? legacy : null;
    }

    public static JsonNode bodySchema(JsonNode requestBody) {
        if (requestBody == null || !requestBody.isObject()) {
            return null;
        }
        return contentSchema(requestBody.get("content"));
    }

    /**
     * Chooses the schema of a content map: {@code application/json} first, then any
     * other JSON media type, then the first media type that declares a schema.
     */
    public static JsonNode contentSchema(JsonNode content) {
        if (content == null || !content.isObject()) {
            return null;
        }
        JsonNode json = schemaOf(content.get(JSON_MEDIA_TYPE));
        if (json != null) {
            return json;
        }

        JsonNode firstDeclared = null;
        Iterator<Map.Entry<String, JsonNode>> mediaTypes = content.fields();
        while (mediaTypes.hasNext()) {
            Map.Entry<String, JsonNode> mediaType = mediaTypes.next();
            JsonNode schema = schemaOf(mediaType.getValue());
            if (schema == null) {
                continue;
            }
            if (mediaType.getKey().toLowerCase(Locale.ROOT).contains("json")) {
                return schema;
            }
            if (firstDeclared == null) {
                firstDeclared = schema;
            }
        }
        return firstDeclared;
    }

    private static JsonNode schemaOf(JsonNode mediaType) {
        if (mediaType == null || !mediaType.isObject()) {
            return null;
        }
        JsonNode schema = mediaType.get("schema");
        return schema != null && schema.isObject() ? schema : null;
    }

    /**
     * Resolves a parameter type. Enumerations resolve to the enumeration declared on the
     * entity's own schema when the context finds one; everything else maps to
     * {@code number}, {@code boolean} or {@code string}, with {@code []} for arrays.
     */
    public static String resolveParameterType(JsonNode schema, ParameterContext context) {
        if (schema == null || !schema.isObject()) {
            return TypeNames.STRING;
        }
        NamedSchemas table = context != null && context.schemas() != null ? context.schemas() : NamedSchemas.empty();

        if (DocumentRefs.isReference(schema)) {
            String name = DocumentRefs.refName(schema.get("$ref").asText());
            if (table.contains(name)) {
                return EntityNames.remapReservedTypeName(name);
            }
            logger.warn("Parameter schema reference {} does not name a known schema", schema.get("$ref").asText());
            return TypeNames.STRING;
        }

        String type = SchemaRef.typeOf(schema);
        if ("array".equals(type)) {
            return TypeNames.arrayOf(resolveParameterType(schema.get("items"), context));
        }

        if (schema.has("enum") && context != null) {
            String enumType = declaredEnumType(context, table);
            if (enumType != null) {
                return enumType;
            }
        }
        return primitiveType(type);
    }

    public static String primitiveType(String type) {
        if ("integer".equals(type) || "number".equals(type)) {
            return TypeNames.NUMBER;
        }
        if ("boolean".equals(type)) {
            return TypeNames.BOOLEAN;
        }
        return TypeNames.STRING;
    }

    private static String declaredEnumType(ParameterContext context, NamedSchemas table) {
        String schemaName = findSchemaName(context.entityName(), table);
        if (schemaName == null || context.parameterName() == null) {
            return null;
        }
        JsonNode entitySchema = table.dereference(table.get(schemaName));
        if (entitySchema == null) {
            return null;
        }
        String propertyName = findPropertyName(entitySchema.get("properties"), context.parameterName());
        if (propertyName == null) {
            return null;
        }

        JsonNode property = entitySchema.get("properties").get(propertyName);
        if ("array".equals(SchemaRef.typeOf(property)) && property.has("items")) {
            property = property.get("items");
        }
        if (DocumentRefs.isReference(property)) {
            String name = DocumentRefs.refName(property.get("$ref").asText());
            return table.contains(name) ? EntityNames.remapReservedTypeName(name) : null;
        }
        if (property.has("enum")) {
            return schemaName + EntityNames.capitalize(propertyName);
        }
        return null;
    }

    private static String findSchemaName(String entityName, NamedSchemas table) {
        if (entityName == null) {
            return null;
        }
        if (table.contains(entityName)) {
            return entityName;
        }
        for (String name : table.names()) {
            if (name.equalsIgnoreCase(entityName)) {
                return name;
            }
        }
        return null;
    }

    private static String findPropertyName(JsonNode properties, String parameterName) {
        if (properties == null || !properties.isObject()) {
            return null;
        }
        if (properties.has(parameterName)) {
            return parameterName;
        }
        String sanitized = EntityNames.sanitizeParameterName(parameterName);
        Iterator<String> names = properties.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (name.equalsIgnoreCase(parameterName) || name.equalsIgnoreCase(sanitized)) {
                return name;
            }
        }
        return null;
    }
}
