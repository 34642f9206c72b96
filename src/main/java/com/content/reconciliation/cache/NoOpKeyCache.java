package com.content.reconciliation.cache;

import java.util.function.Function;

/**
 * Pass-through cache used when caching is disabled.
 */
public class NoOpKeyCache implements KeyCache {

    @Override
    public String get(String title, Function<String, String> compute) {
        return compute.apply(title);
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
