package com.apispec.schemaGraph.relationship;

import com.apispec.schemaGraph.catalog.OperationCatalog;
import com.apispec.schemaGraph.catalog.OperationDescriptor;
import com.apispec.schemaGraph.catalog.SpecInfo;
import com.apispec.schemaGraph.export.ExportMetadata;
import com.apispec.schemaGraph.export.ExportOptions;
import com.apispec.schemaGraph.export.RelationshipSorting;
import com.apispec.schemaGraph.export.RelationshipsExport;
import com.apispec.schemaGraph.export.RelationshipsExportFactory;
import com.apispec.schemaGraph.naming.EntityNames;
import com.apispec.schemaGraph.schema.NamedSchemas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the relationship detectors over a catalog and its named schemas and assembles
 * the sorted, validated {@link RelationshipsExport}.
 *
 * Entities are the catalog's tags (singular PascalCase) plus any relationship endpoint
 * that no tag covers. Each relationship is listed at the top level and under its
 * source entity.
 */
public class RelationshipInferenceEngine {
    private static final Logger logger = LoggerFactory.getLogger(RelationshipInferenceEngine.class);

    private final List<RelationshipDetector> detectors;
    private final RelationshipMerger merger;
    private final ExportOptions options;

    public RelationshipInferenceEngine() {
        this(ExportOptions.defaults());
    }

    public RelationshipInferenceEngine(ExportOptions options) {
        this(defaultDetectors(), new RelationshipMerger(), options);
    }

    public RelationshipInferenceEngine(List<RelationshipDetector> detectors, RelationshipMerger merger, ExportOptions options) {
        this.detectors = List.copyOf(detectors);
        this.merger = merger;
        this.options = options;
    }

    public static List<RelationshipDetector> defaultDetectors() {
        return List.of(new SchemaRefDetector(), new NamingPatternDetector(), new PathPatternDetector());
    }

    public RelationshipsExport inferRelationships(OperationCatalog catalog, NamedSchemas schemas) {
        return inferRelationships(catalog, schemas, SpecInfo.unknown());
    }

    public RelationshipsExport inferRelationships(OperationCatalog catalog, NamedSchemas schemas, SpecInfo specInfo) {
        Map<String, List<EndpointDescriptor>> endpointsByEntity = new LinkedHashMap<>();
        for (Map.Entry<String, List<OperationDescriptor>> entry : catalog.asMap().entrySet()) {
            List<EndpointDescriptor> endpoints = endpointsByEntity.computeIfAbsent(
                    EntityNames.entityNameForTag(entry.getKey()), name -> new ArrayList<>());
            for (OperationDescriptor operation : entry.getValue()) {
                endpoints.add(EndpointDescriptor.of(operation));
            }
        }

        DetectionContext context = new DetectionContext(catalog, schemas, endpointsByEntity.keySet());
        List<RelationshipCandidate> candidates = new ArrayList<>();
        for (RelationshipDetector detector : detectors) {
            List<RelationshipCandidate> found = detector.detect(context);
            logger.debug("Detector {} found {} candidates", detector.source().getValue(), found.size());
            candidates.addAll(found);
        }

        List<RelationshipRecord> relationships = RelationshipSorting.sortRelationships(merger.merge(candidates));

        for (RelationshipRecord relationship : relationships) {
            endpointsByEntity.computeIfAbsent(relationship.sourceEntity(), name -> new ArrayList<>());
            endpointsByEntity.computeIfAbsent(relationship.targetEntity(), name -> new ArrayList<>());
        }

        Map<String, EntityDescriptor> entities = new LinkedHashMap<>();
        for (Map.Entry<String, List<EndpointDescriptor>> entry : endpointsByEntity.entrySet()) {
            String name = entry.getKey();
            List<RelationshipRecord> outgoing = relationships.stream()
                    .filter(relationship -> relationship.sourceEntity().equals(name))
                    .toList();
            entities.put(name, new EntityDescriptor(name, entry.getValue(), outgoing));
        }
        entities = RelationshipSorting.sortEntities(entities);

        ExportMetadata metadata = ExportMetadata.create(specInfo, entities.size(), relationships.size(), options);
        logger.info("Inferred {} relationships across {} entities", relationships.size(), entities.size());
        return RelationshipsExportFactory.createRelationshipsExport(metadata, entities, relationships);
    }
}
