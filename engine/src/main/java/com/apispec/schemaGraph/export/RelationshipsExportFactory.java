package com.apispec.schemaGraph.export;

import com.apispec.schemaGraph.exceptions.InvalidExportException;
import com.apispec.schemaGraph.relationship.EntityDescriptor;
import com.apispec.schemaGraph.relationship.RelationshipRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * The only way the engine assembles a {@link RelationshipsExport}. Inputs are validated
 * first and rejected as a whole.
 */
public final class RelationshipsExportFactory {
    private static final Logger logger = LoggerFactory.getLogger(RelationshipsExportFactory.class);
    private static final RelationshipsExportValidator VALIDATOR = new RelationshipsExportValidator();

    private RelationshipsExportFactory() {
    }

    /**
     * @throws InvalidExportException listing every violation when the inputs do not form a valid export
     */
    public static RelationshipsExport createRelationshipsExport(ExportMetadata metadata,
                                                                Map<String, EntityDescriptor> entities,
                                                                List<RelationshipRecord> relationships) {
        List<ExportViolation> violations = VALIDATOR.validate(metadata, entities, relationships);
        if (!violations.isEmpty()) {
            logger.debug("Rejected export with {} violations", violations.size());
            throw new InvalidExportException(violations);
        }
        return new RelationshipsExport(metadata, entities, relationships);
    }
}
