package com.spending.fraud.cache;

import java.util.function.Function;

/**
 * Pass-through cache used when caching is disabled.
 */
public class NoOpCanonicalizationCache<V> implements CanonicalizationCache<V> {

    @Override
    public V get(String key, Function<String, V> loader) {
        return loader.apply(key);
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
