package com.dcruver.provenance.nlp;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded LRU cache of embeddings keyed by a SHA-256 of (model, text).
 *
 * Both reads and writes refresh recency; inserting past capacity evicts the least
 * recently used entry. Purely process-local: clearing or disabling it only costs
 * extra provider calls.
 */
@Component
@Slf4j
public class EmbeddingCache {

    private final int maxSize;
    private final boolean enabled;
    private final LinkedHashMap<String, List<Double>> entries;

    private long hits;
    private long misses;
    private long evictions;

    @Autowired
    public EmbeddingCache(
        @Value("${provenance.embedding.cache-size:10000}") int maxSize,
        @Value("${provenance.embedding.cache-enabled:true}") boolean enabled
    ) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.enabled = enabled;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<Double>> eldest) {
                if (size() > EmbeddingCache.this.maxSize) {
                    evictions++;
                    return true;
                }
                return false;
            }
        };

        log.info("Embedding cache {} (max size {})", enabled ? "enabled" : "disabled", maxSize);
    }

    public EmbeddingCache(int maxSize) {
        this(maxSize, true);
    }

    /**
     * @return the cached vector, or null on a miss
     */
    public synchronized List<Double> get(String text, String model) {
        if (!enabled) {
            return null;
        }

        List<Double> vector = entries.get(key(text, model));
        if (vector == null) {
            misses++;
            return null;
        }
        hits++;
        return vector;
    }

    public synchronized void put(String text, String model, List<Double> vector) {
        if (!enabled || vector == null || vector.isEmpty()) {
            return;
        }
        entries.put(key(text, model), List.copyOf(vector));
    }

    public synchronized void clear() {
        entries.clear();
        log.info("Cleared embedding cache");
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats getStats() {
        CacheStats stats = new CacheStats();
        stats.setEnabled(enabled);
        stats.setSize(entries.size());
        stats.setMaxSize(maxSize);
        stats.setHits(hits);
        stats.setMisses(misses);
        stats.setEvictions(evictions);
        return stats;
    }

    static String key(String text, String model) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((model + ":" + text).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Cache statistics.
     */
    @Data
    public static class CacheStats {
        private boolean enabled;
        private int size;
        private int maxSize;
        private long hits;
        private long misses;
        private long evictions;
    }
}
