package com.lessj.cli.cache;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Caffeine 缓存功能测试
 */
public class CaffeineCacheTest {

    @Test
    public void testBasicOperations() {
        BoundedCache<Path, String> cache = new CaffeineCache<>(100);
        Path a = Paths.get("a.less");

        assertNull(cache.get(a));
        assertEquals("@a: 1;", cache.computeIfAbsent(a, p -> "@a: 1;"));
        assertEquals("@a: 1;", cache.get(a));

        String loaded = cache.computeIfAbsent(Paths.get("b.less"), p -> "@b: 2;");
        assertEquals("@b: 2;", loaded);
        assertEquals(2L, cache.getStats().getEstimatedSize());
    }

    @Test
    public void testInvalidate() {
        BoundedCache<String, String> cache = new CaffeineCache<>(100);
        cache.computeIfAbsent("a", k -> "old");
        cache.invalidate("a");
        assertNull(cache.get("a"));

        // 失效后重新加载
        assertEquals("new", cache.computeIfAbsent("a", k -> "new"));
    }

    @Test
    public void testEviction() {
        BoundedCache<Integer, String> cache = new CaffeineCache<>(3);
        for (int i = 0; i < 10; i++) {
            cache.computeIfAbsent(i, k -> "file" + k);
        }
        CacheStats stats = cache.getStats();
        assertTrue(stats.getEstimatedSize() <= 3, "Cache size should respect the limit");
        assertTrue(stats.getEvictionCount() > 0);
    }

    @Test
    public void testStats() {
        BoundedCache<String, String> cache = new CaffeineCache<>(100);

        cache.computeIfAbsent("a", k -> "A");  // miss
        cache.get("a");  // hit
        cache.get("b");  // miss

        CacheStats stats = cache.getStats();
        assertEquals(1L, stats.getHitCount());
        assertEquals(2L, stats.getMissCount());
        assertEquals(1.0 / 3, stats.getHitRate(), 0.01);
        assertEquals(100L, stats.getMaximumSize());
    }

    @Test
    public void testComputeIfAbsentOnlyLoadsOnce() {
        BoundedCache<Integer, Integer> cache = new CaffeineCache<>(100);

        assertEquals(Integer.valueOf(10), cache.computeIfAbsent(1, k -> k * 10));
        assertEquals(Integer.valueOf(10), cache.computeIfAbsent(1, k -> k * 20));
        assertEquals(1L, cache.getStats().getHitCount());
    }

    @Test
    public void testNullLoaderResultIsNotCached() {
        BoundedCache<String, String> cache = new CaffeineCache<>(100);
        assertNull(cache.computeIfAbsent("key", k -> null));
        assertEquals(0L, cache.getStats().getEstimatedSize());
    }

    @Test
    public void testInvalidMaximumSize() {
        assertThrows(IllegalArgumentException.class, () -> new CaffeineCache<String, String>(0));
    }
}
