package com.apispec.schemaGraph.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class SpecValidatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SpecValidator validator = new SpecValidator();

    private JsonNode parse(String json) throws IOException {
        return objectMapper.readTree(json);
    }

    @Test
    @DisplayName("Should accept a well-formed document without issues")
    void testCleanDocument() throws IOException {
        ValidationResult result = validator.validate(parse("""
            {
              "openapi": "3.0.0",
              "info": {"title": "Shop", "version": "1.0"},
              "paths": {
                "/users/{userId}": {
                  "parameters": [{"name": "userId", "in": "path", "required": true, "schema": {"type": "string"}}],
                  "get": {
                    "operationId": "Users_Get",
                    "responses": {"200": {"description": "ok", "content": {"application/json": {"schema": {"$ref": "#/components/schemas/User"}}}}}
                  }
                }
              },
              "components": {"schemas": {"User": {"type": "object"}}}
            }
            """));

        assertThat(result.issues()).isEmpty();
        assertThat(result.isValid()).isTrue();
    }

    @Test
    void testNotAnObject() {
        ValidationResult result = validator.validate(TextNode.valueOf("openapi"));

        assertThat(result.errors()).extracting(ValidationIssue::path).containsExactly("$");
        assertThat(result.isValid()).isFalse();
    }

    @Test
    void testMissingSections() throws IOException {
        ValidationResult result = validator.validate(parse("{\"info\": {\"version\": \"1\"}}"));

        assertThat(result.issues())
                .extracting(ValidationIssue::severity, ValidationIssue::path)
                .containsExactly(
                        tuple(ValidationSeverity.ERROR, "$.openapi"),
                        tuple(ValidationSeverity.WARNING, "$.info.title"),
                        tuple(ValidationSeverity.WARNING, "$.paths"));
    }

    @Test
    @DisplayName("Should report dangling local references as errors and external ones as warnings")
    void testReferences() throws IOException {
        ValidationResult result = validator.validate(parse("""
            {
              "swagger": "2.0",
              "info": {"title": "Refs"},
              "paths": {},
              "definitions": {
                "Order": {
                  "properties": {
                    "user": {"$ref": "#/definitions/User"},
                    "remote": {"$ref": "common.yaml#/Money"}
                  }
                }
              }
            }
            """));

        assertThat(result.errors())
                .extracting(ValidationIssue::path)
                .containsExactly("$.definitions.Order.properties.user.$ref");
        assertThat(result.warnings())
                .extracting(ValidationIssue::path)
                .containsExactly("$.definitions.Order.properties.remote.$ref");
    }

    @Test
    @DisplayName("Should report missing and duplicate operationIds and undeclared path parameters")
    void testOperations() throws IOException {
        ValidationResult result = validator.validate(parse("""
            {
              "openapi": "3.1.0",
              "info": {"title": "Ops"},
              "paths": {
                "/pets": {
                  "get": {"operationId": "listPets", "responses": {}},
                  "post": {"responses": {}}
                },
                "/pets/{petId}": {
                  "get": {"operationId": "listPets", "responses": {}}
                }
              }
            }
            """));

        assertThat(result.issues())
                .extracting(ValidationIssue::severity, ValidationIssue::path)
                .containsExactly(
                        tuple(ValidationSeverity.WARNING, "$.paths./pets.post.operationId"),
                        tuple(ValidationSeverity.ERROR, "$.paths./pets/{petId}.get.operationId"),
                        tuple(ValidationSeverity.WARNING, "$.paths./pets/{petId}.get.parameters"));
        assertThat(result.errors().get(0).message()).contains("first declared at $.paths./pets.get");
    }

    @Test
    void testReservedSchemaName() throws IOException {
        ValidationResult result = validator.validate(parse("""
            {"openapi": "3.0.0", "info": {"title": "T"}, "paths": {}, "components": {"schemas": {"Object": {"type": "object"}}}}
            """));

        assertThat(result.warnings())
                .extracting(ValidationIssue::path)
                .containsExactly("$.components.schemas.Object");
        assertThat(result.isValid()).isTrue();
    }

    @Test
    @DisplayName("Should fail on warnings only in strict mode")
    void testStrictMode() throws IOException {
        JsonNode document = parse("""
            {"openapi": "3.0.0", "info": {"title": "T"}, "paths": {"/health": {"get": {"responses": {}}}}}
            """);

        assertThat(validator.validate(document).isValid()).isTrue();
        assertThat(new SpecValidator(new ValidatorOptions(true)).validate(document).isValid()).isFalse();
    }

    @Test
    void testBlankNamesAreReported() throws IOException {
        ValidationResult result = validator.validate(parse("""
            {
              "openapi": "3.0.0",
              "info": {"title": "T"},
              "paths": {"": {"get": {"operationId": "root", "responses": {}}}},
              "components": {"schemas": {"": {"type": "object"}}}
            }
            """));

        assertThat(result.warnings())
                .extracting(ValidationIssue::path)
                .containsExactlyInAnyOrder("$.paths", "$.components.schemas");
        assertThat(result.errors()).isEmpty();
    }
}
