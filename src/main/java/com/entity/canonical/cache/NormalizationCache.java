package com.entity.canonical.cache;

import java.util.function.Function;

/**
 * Memoizes mention normalization. Normalization is a pure function, so entries never go stale.
 */
public interface NormalizationCache {

    /**
     * Returns the cached value for {@code text}, computing and storing it if absent.
     */
    String get(String text, Function<String, String> normalizer);

    void invalidateAll();

    CacheStats getStats();
}
