package com.spending.fraud.cache;

/**
 * Configuration for canonicalization caches.
 *
 * @param maxSize    maximum number of entries
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 100,000 entries, 1 hour TTL, enabled.
     * Raw vendor names repeat heavily across payment and contract sources.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(100_000, 3_600, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
