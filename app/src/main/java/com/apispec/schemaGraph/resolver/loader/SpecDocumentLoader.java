package com.apispec.schemaGraph.resolver.loader;

import com.apispec.schemaGraph.catalog.SpecInfo;
import com.apispec.schemaGraph.exceptions.SpecLoadException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads JSON or YAML specification files into a Jackson tree.
 *
 * {@code .json} files are parsed as JSON and {@code .yaml}/{@code .yml} files as YAML.
 * Any other extension is tried as JSON first, then as YAML.
 */
public class SpecDocumentLoader {
    private static final Logger logger = LoggerFactory.getLogger(SpecDocumentLoader.class);

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public SpecDocumentLoader() {
        this.jsonMapper = new ObjectMapper();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * @throws SpecLoadException if the file cannot be read, cannot be parsed, or is not an object
     */
    public SpecDocument load(Path path) {
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new SpecLoadException("Failed to read specification file", path.toString(), e);
        }

        JsonNode root = parse(content, path);
        if (root == null || !root.isObject()) {
            throw new SpecLoadException("Specification document must be an object", path.toString());
        }

        SpecInfo info = SpecInfo.from(root);
        logger.info("Loaded specification {} from {}", info.title() != null ? info.title() : "<untitled>", path);
        return new SpecDocument(path, root, info);
    }

    private JsonNode parse(String content, Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".json")) {
            return read(jsonMapper, content, path, "JSON");
        }
        if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
            return read(yamlMapper, content, path, "YAML");
        }

        try {
            return jsonMapper.readTree(content);
        } catch (JsonProcessingException e) {
            logger.debug("{} is not JSON, trying YAML: {}", path, e.getOriginalMessage());
            return read(yamlMapper, content, path, "JSON or YAML");
        }
    }

    private JsonNode read(ObjectMapper mapper, String content, Path path, String format) {
        try {
            return mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new SpecLoadException("Failed to parse specification as " + format, path.toString(), e);
        }
    }
}
