package com.apispec.schemaGraph.resolver.loader;

import com.apispec.schemaGraph.catalog.SpecInfo;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;

/**
 * A specification read from disk.
 *
 * @param source the file it was read from
 * @param root   the parsed document tree, JSON and YAML alike
 * @param info   title and version from the document's info object
 */
public record SpecDocument(Path source, JsonNode root, SpecInfo info) {
}
