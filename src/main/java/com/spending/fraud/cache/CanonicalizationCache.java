package com.spending.fraud.cache;

import java.util.function.Function;

/**
 * Memoises the output of a pure canonicalization function.
 *
 * @param <V> the canonical value type
 */
public interface CanonicalizationCache<V> {

    /**
     * Returns the cached value for the key, computing it with the loader on a miss.
     * A loader returning null is not cached and null is returned.
     */
    V get(String key, Function<String, V> loader);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();

    /**
     * Creates a cache for the given configuration: Caffeine-backed when enabled, pass-through otherwise.
     */
    static <V> CanonicalizationCache<V> create(CacheConfig config) {
        return config.enabled() ? new CaffeineCanonicalizationCache<>(config) : new NoOpCanonicalizationCache<>();
    }
}
