package com.apispec.schemaGraph.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentClassifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void testBinaryMediaTypes() {
        assertThat(ContentClassifier.isBinaryMediaType("application/octet-stream")).isTrue();
        assertThat(ContentClassifier.isBinaryMediaType("application/pdf")).isTrue();
        assertThat(ContentClassifier.isBinaryMediaType("application/zip")).isTrue();
        assertThat(ContentClassifier.isBinaryMediaType("application/x-tar")).isTrue();
        assertThat(ContentClassifier.isBinaryMediaType("IMAGE/PNG")).isTrue();
        assertThat(ContentClassifier.isBinaryMediaType("audio/mpeg")).isTrue();
        assertThat(ContentClassifier.isBinaryMediaType("video/mp4")).isTrue();
        assertThat(ContentClassifier.isBinaryMediaType("application/json")).isFalse();
        assertThat(ContentClassifier.isBinaryMediaType("application/x-www-form-urlencoded")).isFalse();
        assertThat(ContentClassifier.isBinaryMediaType(null)).isFalse();
    }

    @Test
    void testMultipartFromDeclaredContent() throws Exception {
        JsonNode operation = json("{\"summary\": \"Upload a document\"}");

        assertThat(ContentClassifier.isMultipart(operation,
                json("{\"content\": {\"multipart/form-data\": {}}}"), true, false)).isTrue();
        assertThat(ContentClassifier.isMultipart(operation,
                json("{\"content\": {\"application/octet-stream\": {}}}"), true, false)).isTrue();
        assertThat(ContentClassifier.isMultipart(operation,
                json("{\"content\": {\"application/json\": {}}}"), true, false)).isFalse();
        assertThat(ContentClassifier.isMultipart(operation, null, true, false)).isFalse();
        assertThat(ContentClassifier.isMultipart(operation, null, false, false)).isTrue();
        assertThat(ContentClassifier.isMultipart(json("{\"summary\": \"Rename\"}"), null, false, false)).isFalse();
        assertThat(ContentClassifier.isMultipart(json("{}"), null, false, true)).isTrue();
    }

    @Test
    void testBinaryBodyMediaType() throws Exception {
        assertThat(ContentClassifier.binaryBodyMediaType(json("""
            {"content": {"application/json": {}, "application/pdf": {}}}
            """))).isEqualTo("application/pdf");
        assertThat(ContentClassifier.binaryBodyMediaType(json("{\"content\": {\"application/json\": {}}}"))).isNull();
        assertThat(ContentClassifier.binaryBodyMediaType(null)).isNull();
    }

    @Test
    void testFileFieldNameFollowsSchemaReference() throws Exception {
        JsonNode document = json("""
            {"components": {"schemas": {"Upload": {"type": "object", "properties": {
              "note": {"type": "string"},
              "attachments": {"type": "array", "items": {"type": "string", "format": "binary"}}
            }}}}}
            """);
        JsonNode body = json("""
            {"content": {"multipart/form-data": {"schema": {"$ref": "#/components/schemas/Upload"}}}}
            """);

        assertThat(ContentClassifier.fileFieldName(document, body)).isEqualTo("attachments");
        assertThat(ContentClassifier.fileFieldName(document, json("{\"content\": {}}"))).isEqualTo(ContentClassifier.DEFAULT_FILE_FIELD);
    }

    @Test
    void testBinaryResponse() throws Exception {
        JsonNode plain = json("{\"summary\": \"Get item\"}");

        assertThat(ContentClassifier.isBinaryResponse(plain,
                json("{\"content\": {\"application/pdf\": {}}}"))).isTrue();
        assertThat(ContentClassifier.isBinaryResponse(plain,
                json("{\"content\": {\"application/json\": {\"schema\": {\"type\": \"string\", \"format\": \"binary\"}}}}"))).isTrue();
        assertThat(ContentClassifier.isBinaryResponse(plain,
                json("{\"content\": {\"application/json\": {\"schema\": {\"type\": \"object\"}}}}"))).isFalse();
        assertThat(ContentClassifier.isBinaryResponse(plain, json("{\"schema\": {\"type\": \"file\"}}"))).isTrue();
        assertThat(ContentClassifier.isBinaryResponse(plain, json("{\"description\": \"ok\"}"))).isFalse();
    }

    @Test
    void testBinaryResponseKeywordsOnlyWithoutContent() throws Exception {
        JsonNode download = json("{\"summary\": \"Download invoice\"}");

        assertThat(ContentClassifier.isBinaryResponse(download, json("{\"description\": \"ok\"}"))).isTrue();
        assertThat(ContentClassifier.isBinaryResponse(download, null)).isTrue();
        assertThat(ContentClassifier.isBinaryResponse(download,
                json("{\"content\": {\"application/json\": {\"schema\": {\"type\": \"object\"}}}}"))).isFalse();
        assertThat(ContentClassifier.isBinaryResponse(json("{}"), json("{\"description\": \"The file\"}"))).isTrue();
    }
}
