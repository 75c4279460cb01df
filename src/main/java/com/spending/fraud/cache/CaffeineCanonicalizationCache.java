package com.spending.fraud.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Function;

/**
 * Caffeine-backed canonicalization cache.
 */
public class CaffeineCanonicalizationCache<V> implements CanonicalizationCache<V> {
    private static final Logger log = LoggerFactory.getLogger(CaffeineCanonicalizationCache.class);

    private final Cache<String, V> cache;

    public CaffeineCanonicalizationCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterAccess(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.debug("CaffeineCanonicalizationCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public V get(String key, Function<String, V> loader) {
        return cache.get(key, loader);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
