package com.entity.canonical.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationCacheTest {

    private final AtomicInteger calls = new AtomicInteger();
    private final Function<String, String> lowercase = text -> {
        calls.incrementAndGet();
        return text.toLowerCase();
    };

    @Test
    @DisplayName("Should compute each text once")
    void testMemoizes() {
        NormalizationCache cache = CacheConfig.defaults().createCache();

        assertEquals("paris", cache.get("Paris", lowercase));
        assertEquals("paris", cache.get("Paris", lowercase));

        assertEquals(1, calls.get());
        CacheStats stats = cache.getStats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate());
    }

    @Test
    @DisplayName("Should recompute after invalidation")
    void testInvalidate() {
        NormalizationCache cache = new CaffeineNormalizationCache(new CacheConfig(100, true));
        cache.get("Paris", lowercase);

        cache.invalidateAll();
        cache.get("Paris", lowercase);

        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("Disabled cache should always recompute")
    void testDisabled() {
        NormalizationCache cache = CacheConfig.disabled().createCache();

        cache.get("Paris", lowercase);
        cache.get("Paris", lowercase);

        assertInstanceOf(NoOpNormalizationCache.class, cache);
        assertEquals(2, calls.get());
        assertEquals(CacheStats.empty(), cache.getStats());
    }

    @Test
    @DisplayName("Should reject a non-positive size")
    void testInvalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, true));
    }
}
