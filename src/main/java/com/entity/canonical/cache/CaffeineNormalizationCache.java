package com.entity.canonical.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Caffeine-backed, size-bounded normalization cache.
 */
public class CaffeineNormalizationCache implements NormalizationCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineNormalizationCache.class);

    private final Cache<String, String> cache;

    public CaffeineNormalizationCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.info("normalization.cache.initialized maxSize={}", config.maxSize());
    }

    @Override
    public String get(String text, Function<String, String> normalizer) {
        return cache.get(text, normalizer);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("normalization.cache.cleared");
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
