package com.apispec.schemaGraph.relationship;

import com.apispec.schemaGraph.catalog.OperationCatalog;
import com.apispec.schemaGraph.catalog.OperationCatalogBuilder;
import com.apispec.schemaGraph.catalog.SpecInfo;
import com.apispec.schemaGraph.export.ExportOptions;
import com.apispec.schemaGraph.export.RelationshipsExport;
import com.apispec.schemaGraph.schema.NamedSchemas;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class RelationshipInferenceEngineTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OperationCatalogBuilder catalogBuilder = new OperationCatalogBuilder();
    private RelationshipInferenceEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RelationshipInferenceEngine(ExportOptions.defaults().withClock(FIXED_CLOCK));
    }

    private JsonNode loadTestData(String filename) throws IOException {
        try (InputStream is = getClass().getResourceAsStream("testdata/" + filename)) {
            if (is == null) {
                throw new IOException("Test data file not found: " + filename);
            }
            return objectMapper.readTree(is);
        }
    }

    private RelationshipsExport infer(JsonNode document) {
        OperationCatalog catalog = catalogBuilder.buildCatalog(document);
        return engine.inferRelationships(catalog, NamedSchemas.fromDocument(document), SpecInfo.from(document));
    }

    @Test
    @DisplayName("Should merge a foreign key and a nested path into one high-confidence relationship")
    void testUsersAndOrders() throws IOException {
        RelationshipsExport export = infer(loadTestData("users-orders.json"));

        assertThat(export.relationships()).hasSize(1);
        RelationshipRecord relationship = export.relationships().get(0);
        assertThat(relationship.sourceEntity()).isEqualTo("User");
        assertThat(relationship.targetEntity()).isEqualTo("Order");
        assertThat(relationship.type()).isEqualTo(RelationshipType.HAS_MANY);
        assertThat(relationship.confidence()).isEqualTo(Confidence.HIGH);
        assertThat(relationship.detectedBy()).containsExactly(DetectionSource.NAMING_PATTERN, DetectionSource.PATH_PATTERN);

        assertThat(export.entities().keySet()).containsExactly("Order", "User");
        assertThat(export.entities().get("User").relationships()).containsExactly(relationship);
        assertThat(export.entities().get("Order").relationships()).isEmpty();
        assertThat(export.entities().get("Order").endpoints())
                .extracting(EndpointDescriptor::method, EndpointDescriptor::path)
                .containsExactly(
                        tuple("GET", "/users/{userId}/orders"),
                        tuple("POST", "/orders"));
        assertThat(export.entities().get("User").endpoints().get(0).description()).isEqualTo("List users");
    }

    @Test
    void testMetadata() throws IOException {
        RelationshipsExport export = infer(loadTestData("users-orders.json"));

        assertThat(export.metadata().specTitle()).isEqualTo("Shop");
        assertThat(export.metadata().specVersion()).isEqualTo("1.4.0");
        assertThat(export.metadata().generatedAt()).isEqualTo("2026-01-02T03:04:05Z");
        assertThat(export.metadata().exportVersion()).isEqualTo(ExportOptions.DEFAULT_EXPORT_VERSION);
        assertThat(export.metadata().totalEntities()).isEqualTo(2);
        assertThat(export.metadata().totalRelationships()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the schema reference type when a naming pattern agrees")
    void testSchemaRefAndNamingAgree() throws IOException {
        JsonNode document = objectMapper.readTree("""
            {
              "openapi": "3.0.0",
              "info": {"title": "Orders", "version": "1.0"},
              "paths": {
                "/orders": {
                  "get": {"operationId": "Orders_List", "tags": ["orders"], "responses": {"200": {"description": "ok"}}}
                }
              },
              "components": {
                "schemas": {
                  "Order": {
                    "type": "object",
                    "properties": {
                      "customer": {"$ref": "#/components/schemas/Customer"},
                      "customerId": {"type": "string"}
                    }
                  },
                  "Customer": {"type": "object", "properties": {"name": {"type": "string"}}}
                }
              }
            }
            """);

        RelationshipsExport export = infer(document);

        assertThat(export.relationships()).hasSize(1);
        RelationshipRecord relationship = export.relationships().get(0);
        assertThat(relationship.sourceEntity()).isEqualTo("Order");
        assertThat(relationship.targetEntity()).isEqualTo("Customer");
        assertThat(relationship.type()).isEqualTo(RelationshipType.HAS_ONE);
        assertThat(relationship.confidence()).isEqualTo(Confidence.HIGH);
        assertThat(relationship.evidence()).hasSize(2);
        assertThat(export.entities().keySet()).containsExactly("Customer", "Order");
        assertThat(export.entities().get("Customer").endpoints()).isEmpty();
    }

    @Test
    void testEmptyDocument() {
        RelationshipsExport export = engine.inferRelationships(OperationCatalog.empty(), NamedSchemas.empty());

        assertThat(export.entities()).isEmpty();
        assertThat(export.relationships()).isEmpty();
        assertThat(export.metadata().specTitle()).isNull();
        assertThat(export.metadata().totalEntities()).isZero();
    }

    @Test
    void testCustomExportVersion() {
        RelationshipInferenceEngine versioned = new RelationshipInferenceEngine(
                new ExportOptions("2.3.4", FIXED_CLOCK));

        RelationshipsExport export = versioned.inferRelationships(OperationCatalog.empty(), NamedSchemas.empty());

        assertThat(export.metadata().exportVersion()).isEqualTo("2.3.4");
    }
}
