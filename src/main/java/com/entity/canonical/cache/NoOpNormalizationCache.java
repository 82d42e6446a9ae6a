package com.entity.canonical.cache;

import java.util.function.Function;

/**
 * Cache that never stores anything; every lookup recomputes.
 */
public class NoOpNormalizationCache implements NormalizationCache {

    @Override
    public String get(String text, Function<String, String> normalizer) {
        return normalizer.apply(text);
    }

    @Override
    public void invalidateAll() {
        // nothing cached
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
