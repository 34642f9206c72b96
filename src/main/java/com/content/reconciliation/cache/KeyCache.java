package com.content.reconciliation.cache;

import java.util.function.Function;

/**
 * Memo cache from raw titles to their normalized comparison keys.
 */
public interface KeyCache {

    /**
     * Returns the cached key for {@code title}, computing and storing it on a miss.
     *
     * @param title   raw title, never null
     * @param compute function producing the key
     * @return the normalized key
     */
    String get(String title, Function<String, String> compute);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    CacheStats getStats();

    /**
     * Creates a cache for the given configuration.
     */
    static KeyCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineKeyCache(config) : new NoOpKeyCache();
    }
}
