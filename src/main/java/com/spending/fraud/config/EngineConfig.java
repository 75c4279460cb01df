package com.spending.fraud.config;

import com.spending.fraud.cache.CacheConfig;
import com.spending.fraud.matching.MatchingOptions;

import java.util.Objects;

/**
 * Engine-wide configuration: detection thresholds, the rule worker count and matching options.
 */
public record EngineConfig(
        DetectionThresholds thresholds,
        int maxWorkers,
        MatchingOptions matching,
        CacheConfig cache
) {
    public static final int DEFAULT_MAX_WORKERS = 6;

    public EngineConfig {
        Objects.requireNonNull(thresholds, "thresholds is required");
        Objects.requireNonNull(matching, "matching is required");
        Objects.requireNonNull(cache, "cache is required");
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive");
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(DetectionThresholds.empty(), DEFAULT_MAX_WORKERS,
                MatchingOptions.defaults(), CacheConfig.defaults());
    }
}
