package com.apispec.schemaGraph;

import com.apispec.schemaGraph.catalog.OperationCatalog;
import com.apispec.schemaGraph.catalog.OperationCatalogBuilder;
import com.apispec.schemaGraph.catalog.SpecInfo;
import com.apispec.schemaGraph.export.ExportOptions;
import com.apispec.schemaGraph.export.RelationshipsExport;
import com.apispec.schemaGraph.relationship.RelationshipInferenceEngine;
import com.apispec.schemaGraph.schema.NamedSchemas;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a full resolution pass over a parsed specification document.
 *
 * The pass has two phases:
 * 1. Build the operation catalog, resolving parameter, body and response types against
 *    the named-schema table
 * 2. Infer the relationship graph from the catalog and the named schemas
 *
 * A resolver holds no per-document state, so one instance may serve any number of
 * documents, concurrently or not.
 */
public class SpecResolver {
    private static final Logger logger = LoggerFactory.getLogger(SpecResolver.class);

    private final OperationCatalogBuilder catalogBuilder;
    private final RelationshipInferenceEngine inferenceEngine;

    public SpecResolver() {
        this(ExportOptions.defaults());
    }

    public SpecResolver(ExportOptions options) {
        this(new OperationCatalogBuilder(), new RelationshipInferenceEngine(options));
    }

    public SpecResolver(OperationCatalogBuilder catalogBuilder, RelationshipInferenceEngine inferenceEngine) {
        this.catalogBuilder = catalogBuilder;
        this.inferenceEngine = inferenceEngine;
    }

    /**
     * @param document the parsed specification
     * @return the catalog, schema table and relationship graph of the document
     * @throws com.apispec.schemaGraph.exceptions.InvalidExportException if the inferred graph
     *         violates the export contract, which indicates a defect in the engine
     */
    public ResolutionResult resolve(JsonNode document) {
        SpecInfo specInfo = SpecInfo.from(document);
        logger.info("Resolving specification {} {}",
                specInfo.title() != null ? specInfo.title() : "<untitled>",
                specInfo.version() != null ? specInfo.version() : "");

        NamedSchemas schemas = NamedSchemas.fromDocument(document);
        OperationCatalog catalog = catalogBuilder.buildCatalog(document);
        RelationshipsExport relationships = inferenceEngine.inferRelationships(catalog, schemas, specInfo);
        return new ResolutionResult(specInfo, catalog, schemas, relationships);
    }
}
