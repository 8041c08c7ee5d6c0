package com.grammar.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grammar.exception.GrammarLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads manifests from YAML or JSON files into the generic value tree the processor consumes:
 * strings, numbers, booleans, lists and insertion-ordered maps.
 */
public class GrammarLoader {

    private static final Logger log = LoggerFactory.getLogger(GrammarLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final String JSON_EXTENSION = ".json";
    private static final char SECTION_SEPARATOR = '.';

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private GrammarLoader() {
    }

    /**
     * Load a manifest from a path.
     * Supports classpath: prefix for classpath resources. Files ending in .json are read as JSON.
     *
     * @param path Path to the manifest
     * @return Decoded tree (null for an empty YAML document)
     */
    public static Object load(String path) {
        log.info("Loading manifest from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return isJson(path) ? parseJson(inputStream) : parseYaml(inputStream);
        } catch (IOException e) {
            throw new GrammarLoadException("Failed to load manifest from: " + path, e);
        }
    }

    /**
     * Load a nested section of a manifest, addressed by dotted keys (e.g. "parts.hello.build-packages").
     *
     * @param path        Path to the manifest
     * @param sectionPath Dotted key path
     * @return The section's value
     * @throws GrammarLoadException if a key is missing or a parent is not a mapping
     */
    public static Object loadSection(String path, String sectionPath) {
        Object current = load(path);
        int start = 0;
        while (start <= sectionPath.length()) {
            int end = sectionPath.indexOf(SECTION_SEPARATOR, start);
            if (end < 0) {
                end = sectionPath.length();
            }
            String key = sectionPath.substring(start, end);
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(key)) {
                throw new GrammarLoadException("Section '" + sectionPath + "' not found in: " + path
                        + " (missing key '" + key + "')");
            }
            current = map.get(key);
            start = end + 1;
        }
        log.debug("Loaded section '{}' from {}", sectionPath, path);
        return current;
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }

    private static boolean isJson(String path) {
        return path.toLowerCase().endsWith(JSON_EXTENSION);
    }

    private static Object parseYaml(InputStream inputStream) {
        try {
            // SnakeYAML builds LinkedHashMaps, so key order is kept
            return new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new GrammarLoadException("Invalid YAML manifest: " + e.getMessage(), e);
        }
    }

    private static Object parseJson(InputStream inputStream) throws IOException {
        try {
            return objectMapper.readValue(inputStream, Object.class);
        } catch (JsonProcessingException e) {
            throw new GrammarLoadException("Invalid JSON manifest: " + e.getOriginalMessage(), e);
        }
    }
}
