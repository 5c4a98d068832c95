package com.apispec.schemaGraph.export;

import java.time.Clock;

/**
 * Settings of export construction.
 *
 * @param exportVersion format version written to {@code metadata.exportVersion}
 * @param clock         source of {@code metadata.generatedAt}
 */
public record ExportOptions(String exportVersion, Clock clock) {
    public static final String DEFAULT_EXPORT_VERSION = "1.0.0";

    public static ExportOptions defaults() {
        return new ExportOptions(DEFAULT_EXPORT_VERSION, Clock.systemUTC());
    }

    public ExportOptions withExportVersion(String version) {
        return new ExportOptions(version, clock);
    }

    public ExportOptions withClock(Clock newClock) {
        return new ExportOptions(exportVersion, newClock);
    }
}
