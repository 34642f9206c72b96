package com.content.reconciliation.cache;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for KeyCache implementations.
 */
class KeyCacheTest {

    @Test
    void create_enabledConfigUsesCaffeine() {
        assertInstanceOf(CaffeineKeyCache.class, KeyCache.create(CacheConfig.defaults()));
        assertInstanceOf(NoOpKeyCache.class, KeyCache.create(CacheConfig.disabled()));
    }

    @Test
    void caffeine_computesOncePerTitle() {
        KeyCache cache = KeyCache.create(CacheConfig.ofSize(100));
        AtomicInteger computations = new AtomicInteger();
        Function<String, String> compute = title -> {
            computations.incrementAndGet();
            return title.toLowerCase();
        };

        assertEquals("widget", cache.get("Widget", compute));
        assertEquals("widget", cache.get("Widget", compute));

        assertEquals(1, computations.get());
        CacheStats stats = cache.getStats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate(), 1e-9);
    }

    @Test
    void caffeine_invalidateAllForcesRecompute() {
        KeyCache cache = KeyCache.create(CacheConfig.ofSize(100));
        AtomicInteger computations = new AtomicInteger();
        Function<String, String> compute = title -> {
            computations.incrementAndGet();
            return title;
        };

        cache.get("a", compute);
        cache.invalidateAll();
        cache.get("a", compute);

        assertEquals(2, computations.get());
    }

    @Test
    void noOp_alwaysComputes() {
        KeyCache cache = new NoOpKeyCache();
        AtomicInteger computations = new AtomicInteger();

        cache.get("a", t -> String.valueOf(computations.incrementAndGet()));
        cache.get("a", t -> String.valueOf(computations.incrementAndGet()));

        assertEquals(2, computations.get());
        assertEquals(CacheStats.empty(), cache.getStats());
        assertEquals(0.0, cache.getStats().hitRate());
    }

    @Test
    void config_rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.ofSize(0));
    }
}
