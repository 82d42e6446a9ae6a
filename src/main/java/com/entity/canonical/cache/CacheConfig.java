package com.entity.canonical.cache;

/**
 * Configuration for normalization memoization.
 *
 * @param maxSize maximum number of memoized texts
 * @param enabled whether memoization is enabled
 */
public record CacheConfig(int maxSize, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default configuration: 10,000 entries, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, false);
    }

    /**
     * Builds the cache described by this configuration.
     */
    public NormalizationCache createCache() {
        return enabled ? new CaffeineNormalizationCache(this) : new NoOpNormalizationCache();
    }
}
