package com.content.reconciliation.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Caffeine-backed bounded key cache.
 */
public class CaffeineKeyCache implements KeyCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineKeyCache.class);

    private final Cache<String, String> cache;

    public CaffeineKeyCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.info("CaffeineKeyCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public String get(String title, Function<String, String> compute) {
        return cache.get(title, compute);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all key cache entries");
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
