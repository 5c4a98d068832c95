package com.apispec.schemaGraph.export;

import com.apispec.schemaGraph.catalog.SpecInfo;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.format.DateTimeFormatter;

/**
 * Header of a relationships export. {@code specTitle} and {@code specVersion} are
 * omitted from JSON when unknown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"specTitle", "specVersion", "generatedAt", "totalEntities", "totalRelationships", "exportVersion"})
public record ExportMetadata(
    String specTitle,
    String specVersion,
    String generatedAt,
    int totalEntities,
    int totalRelationships,
    String exportVersion
) {

    public static ExportMetadata create(SpecInfo info, int totalEntities, int totalRelationships, ExportOptions options) {
        SpecInfo specInfo = info != null ? info : SpecInfo.unknown();
        return new ExportMetadata(
            specInfo.title(),
            specInfo.version(),
            DateTimeFormatter.ISO_INSTANT.format(options.clock().instant()),
            totalEntities,
            totalRelationships,
            options.exportVersion()
        );
    }
}
