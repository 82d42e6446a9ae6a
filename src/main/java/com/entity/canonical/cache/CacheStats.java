package com.entity.canonical.cache;

/**
 * Snapshot of normalization cache counters.
 *
 * @param hitCount      lookups served from the cache
 * @param missCount     lookups that had to normalize
 * @param evictionCount entries evicted by the size bound
 * @param size          current number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
