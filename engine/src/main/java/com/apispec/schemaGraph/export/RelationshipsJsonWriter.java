package com.apispec.schemaGraph.export;

import com.apispec.schemaGraph.exceptions.SchemaGraphException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * Serializes a {@link RelationshipsExport} as pretty-printed JSON: two-space indent,
 * {@code "\n"} line breaks on every platform, one array element per line.
 * The same export always produces the same text.
 */
public class RelationshipsJsonWriter {
    private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

    private final ObjectWriter writer;

    public RelationshipsJsonWriter() {
        this(new ObjectMapper());
    }

    public RelationshipsJsonWriter(ObjectMapper objectMapper) {
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(INDENTER);
        printer.indentArraysWith(INDENTER);
        this.writer = objectMapper.writer(printer);
    }

    public String toJson(RelationshipsExport export) {
        try {
            return writer.writeValueAsString(export) + "\n";
        } catch (JsonProcessingException e) {
            throw new SchemaGraphException("Failed to serialize relationships export", e);
        }
    }
}
