package com.spending.fraud.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalizationCacheTest {

    @Nested
    @DisplayName("CaffeineCanonicalizationCache")
    class Caffeine {

        @Test
        @DisplayName("Should compute once and serve later lookups from the cache")
        void testMemoises() {
            CanonicalizationCache<String> cache = CanonicalizationCache.create(CacheConfig.defaults());
            AtomicInteger loads = new AtomicInteger();

            assertEquals("ACME", cache.get("acme", key -> {
                loads.incrementAndGet();
                return key.toUpperCase();
            }));
            assertEquals("ACME", cache.get("acme", key -> {
                loads.incrementAndGet();
                return key.toUpperCase();
            }));

            assertEquals(1, loads.get());
            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0.5, stats.hitRate(), 1e-9);
        }

        @Test
        @DisplayName("Should not cache null results")
        void testNullNotCached() {
            CanonicalizationCache<String> cache = new CaffeineCanonicalizationCache<>(CacheConfig.defaults());
            AtomicInteger loads = new AtomicInteger();

            assertNull(cache.get("x", key -> {
                loads.incrementAndGet();
                return null;
            }));
            assertNull(cache.get("x", key -> {
                loads.incrementAndGet();
                return null;
            }));

            assertEquals(2, loads.get());
        }

        @Test
        @DisplayName("Should recompute after invalidation")
        void testInvalidate() {
            CanonicalizationCache<String> cache = new CaffeineCanonicalizationCache<>(CacheConfig.defaults());
            AtomicInteger loads = new AtomicInteger();
            cache.get("k", key -> "v" + loads.incrementAndGet());
            cache.invalidateAll();

            assertEquals("v2", cache.get("k", key -> "v" + loads.incrementAndGet()));
        }
    }

    @Nested
    @DisplayName("NoOpCanonicalizationCache")
    class NoOp {

        @Test
        @DisplayName("Should call the loader every time")
        void testPassThrough() {
            CanonicalizationCache<String> cache = CanonicalizationCache.create(CacheConfig.disabled());
            AtomicInteger loads = new AtomicInteger();

            cache.get("k", key -> "v" + loads.incrementAndGet());
            cache.get("k", key -> "v" + loads.incrementAndGet());

            assertInstanceOf(NoOpCanonicalizationCache.class, cache);
            assertEquals(2, loads.get());
            assertEquals(0, cache.getStats().hitCount());
        }
    }

    @Test
    @DisplayName("Should reject invalid configuration")
    void testInvalidConfig() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 10, true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
    }
}
