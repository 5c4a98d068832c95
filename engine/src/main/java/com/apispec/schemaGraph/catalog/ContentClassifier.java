package com.apispec.schemaGraph.catalog;

import com.apispec.schemaGraph.schema.DocumentRefs;
import com.apispec.schemaGraph.schema.SchemaRef;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Upload and download classification of operations.
 *
 * Declared content always wins. The keyword checks only run when the operation
 * declares nothing: "upload" when there is no request body, "download"/"file"
 * when the success response has no content.
 */
public final class ContentClassifier {
    public static final String MULTIPART_FORM_DATA = "multipart/form-data";
    public static final String DEFAULT_FILE_FIELD = "file";

    private static final List<String> BINARY_MEDIA_PREFIXES = List.of(
        "application/octet-stream", "application/pdf", "application/zip", "application/x-",
        "image/", "audio/", "video/"
    );
    private static final List<String> UPLOAD_KEYWORDS = List.of("upload");
    private static final List<String> DOWNLOAD_KEYWORDS = List.of("download", "file");

    private ContentClassifier() {
    }

    public static boolean isBinaryMediaType(String mediaType) {
        if (mediaType == null) {
            return false;
        }
        String lower = mediaType.toLowerCase(Locale.ROOT).trim();
        // application/x-www-form-urlencoded is a form, not a file
        if (lower.startsWith("application/x-www-form-urlencoded")) {
            return false;
        }
        for (String prefix : BINARY_MEDIA_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param operation   the operation node
     * @param requestBody  the dereferenced request body, or {@code null}
     * @param declaresBody whether the operation declares any body, resolvable or not
     * @param legacyForm   {@code true} when the operation has Swagger 2 {@code formData} file parameters
     */
    public static boolean isMultipart(JsonNode operation, JsonNode requestBody, boolean declaresBody, boolean legacyForm) {
        if (legacyForm) {
            return true;
        }
        if (requestBody != null) {
            JsonNode content = requestBody.get("content");
            if (content == null || !content.isObject()) {
                return false;
            }
            return content.has(MULTIPART_FORM_DATA) || binaryBodyMediaType(requestBody) != null;
        }
        if (declaresBody) {
            return false;
        }
        return mentionsAny(operation, UPLOAD_KEYWORDS);
    }

    /** @return the first binary media type of the body, or {@code null} */
    public static String binaryBodyMediaType(JsonNode requestBody) {
        if (requestBody == null) {
            return null;
        }
        JsonNode content = requestBody.get("content");
        if (content == null || !content.isObject()) {
            return null;
        }
        Iterator<String> mediaTypes = content.fieldNames();
        while (mediaTypes.hasNext()) {
            String mediaType = mediaTypes.next();
            if (isBinaryMediaType(mediaType)) {
                return mediaType;
            }
        }
        return null;
    }

    /**
     * Name of the form field carrying the file: the first {@code format: binary} property of
     * the multipart schema, else {@link #DEFAULT_FILE_FIELD}.
     *
     * @param document    the specification, for schema references
     * @param requestBody the dereferenced request body
     */
    public static String fileFieldName(JsonNode document, JsonNode requestBody) {
        if (requestBody == null) {
            return DEFAULT_FILE_FIELD;
        }
        JsonNode multipart = requestBody.path("content").path(MULTIPART_FORM_DATA).get("schema");
        JsonNode schema = DocumentRefs.resolve(document, multipart);
        if (schema != null && schema.path("properties").isObject()) {
            Iterator<Map.Entry<String, JsonNode>> properties = schema.get("properties").fields();
            while (properties.hasNext()) {
                Map.Entry<String, JsonNode> property = properties.next();
                JsonNode propertySchema = property.getValue();
                if (isBinarySchema(propertySchema) || isBinarySchema(propertySchema.get("items"))) {
                    return property.getKey();
                }
            }
        }
        return DEFAULT_FILE_FIELD;
    }

    /**
     * @param operation       the operation node
     * @param successResponse the dereferenced success response, or {@code null}
     */
    public static boolean isBinaryResponse(JsonNode operation, JsonNode successResponse) {
        if (successResponse != null) {
            JsonNode content = successResponse.get("content");
            if (content != null && content.isObject() && content.size() > 0) {
                Iterator<Map.Entry<String, JsonNode>> mediaTypes = content.fields();
                while (mediaTypes.hasNext()) {
                    Map.Entry<String, JsonNode> mediaType = mediaTypes.next();
                    if (isBinaryMediaType(mediaType.getKey()) || isBinarySchema(mediaType.getValue().get("schema"))) {
                        return true;
                    }
                }
                return false;
            }
            JsonNode legacySchema = successResponse.get("schema");
            if (legacySchema != null) {
                return isBinarySchema(legacySchema) || "file".equals(SchemaRef.typeOf(legacySchema));
            }
        }
        return mentionsAny(operation, DOWNLOAD_KEYWORDS)
                || (successResponse != null && containsAny(text(successResponse.get("description")), DOWNLOAD_KEYWORDS));
    }

    static boolean isBinarySchema(JsonNode schema) {
        if (schema == null || !schema.isObject()) {
            return false;
        }
        JsonNode format = schema.get("format");
        return format != null && "binary".equals(format.asText());
    }

    private static boolean mentionsAny(JsonNode operation, List<String> keywords) {
        if (operation == null) {
            return false;
        }
        return containsAny(text(operation.get("summary")), keywords)
                || containsAny(text(operation.get("description")), keywords)
                || containsAny(text(operation.get("operationId")), keywords);
    }

    private static boolean containsAny(String value, List<String> keywords) {
        if (value == null) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String text(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
