package com.dcruver.provenance.nlp;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingCacheTest {

    @Test
    void testLeastRecentlyUsedEntryIsEvicted() {
        EmbeddingCache cache = new EmbeddingCache(2);
        cache.put("a", "m", List.of(1.0));
        cache.put("b", "m", List.of(2.0));

        // Reading "a" makes "b" the eldest
        assertNotNull(cache.get("a", "m"));
        cache.put("c", "m", List.of(3.0));

        assertEquals(2, cache.size());
        assertNull(cache.get("b", "m"));
        assertEquals(List.of(1.0), cache.get("a", "m"));
        assertEquals(List.of(3.0), cache.get("c", "m"));
        assertEquals(1, cache.getStats().getEvictions());
    }

    @Test
    void testKeyIncludesModel() {
        EmbeddingCache cache = new EmbeddingCache(10);
        cache.put("same text", "model-a", List.of(1.0));

        assertNull(cache.get("same text", "model-b"));
        assertNotEquals(EmbeddingCache.key("same text", "model-a"), EmbeddingCache.key("same text", "model-b"));
        assertEquals(64, EmbeddingCache.key("same text", "model-a").length());
    }

    @Test
    void testStatsCountHitsAndMisses() {
        EmbeddingCache cache = new EmbeddingCache(10);
        cache.get("x", "m");
        cache.put("x", "m", List.of(0.5));
        cache.get("x", "m");

        EmbeddingCache.CacheStats stats = cache.getStats();
        assertTrue(stats.isEnabled());
        assertEquals(1, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(1, stats.getSize());
        assertEquals(10, stats.getMaxSize());

        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    void testDisabledCacheStoresNothing() {
        EmbeddingCache cache = new EmbeddingCache(10, false);
        cache.put("x", "m", List.of(0.5));

        assertNull(cache.get("x", "m"));
        assertEquals(0, cache.size());
        assertFalse(cache.getStats().isEnabled());
    }

    @Test
    void testRejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new EmbeddingCache(0));
    }
}
