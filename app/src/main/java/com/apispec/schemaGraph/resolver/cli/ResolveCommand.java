package com.apispec.schemaGraph.resolver.cli;

import com.apispec.schemaGraph.ResolutionResult;
import com.apispec.schemaGraph.SpecResolver;
import com.apispec.schemaGraph.catalog.OperationDescriptor;
import com.apispec.schemaGraph.catalog.ParameterDescriptor;
import com.apispec.schemaGraph.exceptions.SchemaGraphException;
import com.apispec.schemaGraph.exceptions.SpecLoadException;
import com.apispec.schemaGraph.export.ExportOptions;
import com.apispec.schemaGraph.export.RelationshipsJsonWriter;
import com.apispec.schemaGraph.relationship.MutualRelationships;
import com.apispec.schemaGraph.resolver.loader.SpecDocument;
import com.apispec.schemaGraph.resolver.loader.SpecDocumentLoader;
import com.apispec.schemaGraph.validation.SpecValidator;
import com.apispec.schemaGraph.validation.ValidationIssue;
import com.apispec.schemaGraph.validation.ValidationResult;
import com.apispec.schemaGraph.validation.ValidatorOptions;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@CommandLine.Command(
    name = "schema-graph",
    description = "Resolve an OpenAPI specification into an operation catalog and a relationship graph",
    mixinStandardHelpOptions = true,
    version = "1.0.0-SNAPSHOT"
)
public class ResolveCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ResolveCommand.class);

    public static final String RELATIONSHIPS_FILE = "RELATIONSHIPS.json";
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_INVALID_SPEC = 2;

    @CommandLine.Parameters(
        index = "0",
        description = "OpenAPI specification file (JSON or YAML)"
    )
    private Path specFile;

    @CommandLine.Option(
        names = {"-o", "--output-dir"},
        description = "Directory receiving " + RELATIONSHIPS_FILE + " (default: current directory)",
        defaultValue = "."
    )
    private String outputDirectory;

    @CommandLine.Option(
        names = {"--strict"},
        description = "Treat specification warnings as errors and stop before resolution"
    )
    private boolean strict;

    @CommandLine.Option(
        names = {"--catalog"},
        description = "Log every resolved operation with its signature and types"
    )
    private boolean printCatalog;

    @CommandLine.Option(
        names = {"--export-version"},
        description = "Version written to metadata.exportVersion (default: " + ExportOptions.DEFAULT_EXPORT_VERSION + ")",
        defaultValue = ExportOptions.DEFAULT_EXPORT_VERSION
    )
    private String exportVersion;

    @Override
    public Integer call() {
        logger.info("Specification file: {}", specFile);
        logger.info("Output directory: {}", outputDirectory);

        try {
            SpecDocument document = new SpecDocumentLoader().load(specFile);

            ValidationResult validation = new SpecValidator(new ValidatorOptions(strict)).validate(document.root());
            for (ValidationIssue issue : validation.errors()) {
                logger.error("{}", issue);
            }
            for (ValidationIssue issue : validation.warnings()) {
                logger.warn("{}", issue);
            }
            if (strict && !validation.isValid()) {
                logger.error("Specification failed strict validation with {} errors and {} warnings",
                        validation.errors().size(), validation.warnings().size());
                return EXIT_INVALID_SPEC;
            }

            ExportOptions options = ExportOptions.defaults().withExportVersion(exportVersion);
            ResolutionResult result = new SpecResolver(options).resolve(document.root());

            if (printCatalog) {
                logCatalog(result);
            }
            for (MutualRelationships.MutualPair pair : result.relationships().mutualPairs()) {
                logger.info("Bidirectional relationship: {} <-> {}", pair.first(), pair.second());
            }

            Path outputPath = Paths.get(outputDirectory);
            Files.createDirectories(outputPath);
            Path relationshipsFile = outputPath.resolve(RELATIONSHIPS_FILE);
            Files.writeString(relationshipsFile, new RelationshipsJsonWriter().toJson(result.relationships()), StandardCharsets.UTF_8);

            logger.info("Wrote {} relationships across {} entities to {}",
                    result.relationships().metadata().totalRelationships(),
                    result.relationships().metadata().totalEntities(),
                    relationshipsFile);
            return EXIT_OK;

        } catch (SpecLoadException e) {
            logger.error("{}: {}", e.getSource(), e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (SchemaGraphException e) {
            logger.error("Resolution failed", e);
            return EXIT_FAILURE;
        } catch (IOException e) {
            logger.error("Failed to write output to {}", outputDirectory, e);
            return EXIT_FAILURE;
        }
    }

    private void logCatalog(ResolutionResult result) {
        for (String tag : result.catalog().tags()) {
            logger.info("Tag {}", tag);
            for (OperationDescriptor operation : result.catalog().operations(tag)) {
                logger.info("  {} {} -> {}({}) : {}{}{}",
                        operation.httpMethod(),
                        operation.rawPath(),
                        operation.normalizedName(),
                        signature(operation.parameters()),
                        operation.responseType(),
                        operation.multipart() ? " [multipart]" : "",
                        operation.binaryResponse() ? " [binary]" : "");
            }
        }
    }

    private static String signature(List<ParameterDescriptor> parameters) {
        return parameters.stream()
                .map(p -> p.sanitizedName() + (p.optional() ? "?" : "") + ": " + p.inferredType())
                .collect(Collectors.joining(", "));
    }
}
