package com.spending.fraud.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.spending.fraud.cache.CacheConfig;
import com.spending.fraud.exception.ValidationException;
import com.spending.fraud.matching.MatchingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads {@link EngineConfig} from YAML.
 *
 * <pre>
 * detection:
 *   max_workers: 6
 *   thresholds:
 *     vendor_name_similarity: 0.85
 * matching:
 *   threshold: 0.85
 *   max_candidates_per_item: 5
 *   batch_size: 1000
 *   max_workers: 4
 *   max_block_size: 5000
 * cache:
 *   enabled: true
 *   max_size: 100000
 *   ttl_seconds: 3600
 * </pre>
 *
 * Absent sections and keys keep their defaults.
 */
public final class EngineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "fraud-detection.yaml";

    private final ObjectMapper mapper;

    public EngineConfigLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Loads the bundled {@value #DEFAULT_RESOURCE} from the classpath.
     */
    public EngineConfig loadDefaults() {
        try (InputStream in = EngineConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.warn("config.missing resource={}, using built-in defaults", DEFAULT_RESOURCE);
                return EngineConfig.defaults();
            }
            return load(in);
        } catch (IOException e) {
            throw new ValidationException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public EngineConfig load(Path path) {
        if (path == null || !Files.exists(path)) {
            throw new ValidationException("Configuration file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            EngineConfig config = load(in);
            log.info("config.loaded path={}", path);
            return config;
        } catch (IOException e) {
            throw new ValidationException("Failed to read configuration " + path, e);
        }
    }

    public EngineConfig load(InputStream in) {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (IOException e) {
            throw new ValidationException("Malformed configuration: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return EngineConfig.defaults();
        }
        try {
            return new EngineConfig(
                    thresholds(root.path("detection").path("thresholds")),
                    intValue(root.path("detection"), "max_workers", EngineConfig.DEFAULT_MAX_WORKERS),
                    matching(root.path("matching")),
                    cache(root.path("cache")));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private DetectionThresholds thresholds(JsonNode node) {
        if (!node.isObject()) {
            return DetectionThresholds.empty();
        }
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            values.put(field.getKey(), value.isNumber() ? value.decimalValue() : value.asText());
        }
        return new DetectionThresholds(values);
    }

    private MatchingOptions matching(JsonNode node) {
        MatchingOptions defaults = MatchingOptions.defaults();
        return MatchingOptions.builder()
                .threshold(doubleValue(node, "threshold", defaults.getThreshold()))
                .maxCandidatesPerItem(intValue(node, "max_candidates_per_item", defaults.getMaxCandidatesPerItem()))
                .batchSize(intValue(node, "batch_size", defaults.getBatchSize()))
                .maxWorkers(intValue(node, "max_workers", defaults.getMaxWorkers()))
                .maxBlockSize(intValue(node, "max_block_size", defaults.getMaxBlockSize()))
                .build();
    }

    private CacheConfig cache(JsonNode node) {
        if (!node.isObject()) {
            return CacheConfig.defaults();
        }
        CacheConfig defaults = CacheConfig.defaults();
        if (!node.path("enabled").asBoolean(true)) {
            return CacheConfig.disabled();
        }
        return new CacheConfig(intValue(node, "max_size", defaults.maxSize()),
                intValue(node, "ttl_seconds", defaults.ttlSeconds()), true);
    }

    private static int intValue(JsonNode node, String field, int defaultValue) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return defaultValue;
        }
        if (!value.canConvertToInt() && !value.isTextual()) {
            throw new ValidationException(field + " must be an integer, got " + value);
        }
        try {
            return value.isTextual() ? Integer.parseInt(value.asText().trim()) : value.intValue();
        } catch (NumberFormatException e) {
            throw new ValidationException(field + " must be an integer, got '" + value.asText() + "'", e);
        }
    }

    private static double doubleValue(JsonNode node, String field, double defaultValue) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return defaultValue;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(field + " must be a number, got '" + value.asText() + "'", e);
        }
    }
}
