package com.apispec.schemaGraph.resolver.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the command line end to end against files in a temporary directory.
 */
class ResolveCommandTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private Path outputDir;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        outputDir = tempDir.resolve("out");
    }

    private Path copyTestFile(String filename) throws IOException {
        try (InputStream is = getClass().getResourceAsStream("testdata/" + filename)) {
            if (is == null) {
                throw new IOException("Test file not found: " + filename);
            }
            Path target = tempDir.resolve(filename);
            Files.copy(is, target);
            return target;
        }
    }

    private int execute(String... args) {
        return new CommandLine(new ResolveCommand()).execute(args);
    }

    @Test
    @DisplayName("Should write the relationship graph of a YAML specification")
    void testWritesRelationships() throws IOException {
        Path spec = copyTestFile("shop.yaml");

        int exitCode = execute(spec.toString(), "-o", outputDir.toString());

        assertThat(exitCode).isEqualTo(ResolveCommand.EXIT_OK);
        Path written = outputDir.resolve(ResolveCommand.RELATIONSHIPS_FILE);
        assertThat(written).exists();

        String json = Files.readString(written);
        assertThat(json).endsWith("\n");
        JsonNode export = objectMapper.readTree(json);
        assertThat(export.path("metadata").path("specTitle").asText()).isEqualTo("Shop");
        assertThat(export.path("metadata").path("exportVersion").asText()).isEqualTo("1.0.0");
        assertThat(export.path("relationships")).hasSize(1);
        JsonNode relationship = export.path("relationships").get(0);
        assertThat(relationship.path("sourceEntity").asText()).isEqualTo("User");
        assertThat(relationship.path("targetEntity").asText()).isEqualTo("Order");
        assertThat(relationship.path("type").asText()).isEqualTo("hasMany");
        assertThat(relationship.path("confidence").asText()).isEqualTo("high");
    }

    @Test
    void testExportVersionOption() throws IOException {
        Path spec = copyTestFile("shop.yaml");

        int exitCode = execute(spec.toString(), "--output-dir", outputDir.toString(), "--export-version", "2.3.4", "--catalog");

        assertThat(exitCode).isEqualTo(ResolveCommand.EXIT_OK);
        JsonNode export = objectMapper.readTree(outputDir.resolve(ResolveCommand.RELATIONSHIPS_FILE).toFile());
        assertThat(export.path("metadata").path("exportVersion").asText()).isEqualTo("2.3.4");
    }

    @Test
    @DisplayName("Should stop before writing when strict validation finds warnings")
    void testStrictModeRejectsWarnings() throws IOException {
        Path spec = tempDir.resolve("health.json");
        Files.writeString(spec, """
            {"openapi": "3.0.0", "info": {"title": "Health"}, "paths": {"/health": {"get": {"responses": {}}}}}
            """);

        assertThat(execute(spec.toString(), "-o", outputDir.toString(), "--strict"))
                .isEqualTo(ResolveCommand.EXIT_INVALID_SPEC);
        assertThat(outputDir.resolve(ResolveCommand.RELATIONSHIPS_FILE)).doesNotExist();

        assertThat(execute(spec.toString(), "-o", outputDir.toString())).isEqualTo(ResolveCommand.EXIT_OK);
        assertThat(outputDir.resolve(ResolveCommand.RELATIONSHIPS_FILE)).exists();
    }

    @Test
    void testMissingSpecificationFile() {
        int exitCode = execute(tempDir.resolve("nope.json").toString(), "-o", outputDir.toString());

        assertThat(exitCode).isEqualTo(ResolveCommand.EXIT_FAILURE);
        assertThat(outputDir.resolve(ResolveCommand.RELATIONSHIPS_FILE)).doesNotExist();
    }

    @Test
    void testUnparsableSpecification() throws IOException {
        Path spec = tempDir.resolve("broken.json");
        Files.writeString(spec, "{ not json");

        assertThat(execute(spec.toString(), "-o", outputDir.toString())).isEqualTo(ResolveCommand.EXIT_FAILURE);
    }
}
