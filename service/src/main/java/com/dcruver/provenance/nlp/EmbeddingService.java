package com.dcruver.provenance.nlp;

import com.dcruver.provenance.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Embeds text through the configured provider, consulting the cache first.
 */
@Service
@Slf4j
public class EmbeddingService {

    private final EmbeddingProvider provider;
    private final EmbeddingCache cache;

    public EmbeddingService(EmbeddingProvider provider, EmbeddingCache cache) {
        this.provider = provider;
        this.cache = cache;
    }

    /**
     * @throws ValidationException for blank text
     * @throws com.dcruver.provenance.error.ProviderConnectionException if the provider is unreachable
     */
    public EmbeddingResult embed(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Cannot generate embedding for empty text");
        }

        String model = provider.getModelName();
        List<Double> cached = cache.get(text, model);
        if (cached != null) {
            return new EmbeddingResult(cached, model, cached.size(), true);
        }

        List<Double> vector = provider.embed(text);
        cache.put(text, model, vector);
        return new EmbeddingResult(vector, model, vector.size(), false);
    }

    /**
     * Embed several texts; only cache misses go to the provider, in one batch.
     * Results keep the order of the input.
     */
    public List<EmbeddingResult> embedBatch(List<String> texts) {
        String model = provider.getModelName();
        List<EmbeddingResult> results = new ArrayList<>(texts.size());
        List<Integer> missIndexes = new ArrayList<>();
        List<String> missTexts = new ArrayList<>();

        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (text == null || text.isBlank()) {
                throw new ValidationException("Cannot generate embedding for empty text at index " + i);
            }
            List<Double> cached = cache.get(text, model);
            if (cached != null) {
                results.add(new EmbeddingResult(cached, model, cached.size(), true));
            } else {
                results.add(null);
                missIndexes.add(i);
                missTexts.add(text);
            }
        }

        if (!missTexts.isEmpty()) {
            List<List<Double>> vectors = provider.embedBatch(missTexts);
            if (vectors.size() != missTexts.size()) {
                throw new IllegalStateException(String.format(
                    "Provider returned %d embeddings for %d texts", vectors.size(), missTexts.size()));
            }
            for (int j = 0; j < vectors.size(); j++) {
                List<Double> vector = vectors.get(j);
                cache.put(missTexts.get(j), model, vector);
                results.set(missIndexes.get(j), new EmbeddingResult(vector, model, vector.size(), false));
            }
            log.debug("Embedded {} texts ({} from cache)", texts.size(), texts.size() - missTexts.size());
        }

        return results;
    }

    public int getDimension() {
        return provider.getDimension();
    }

    public EmbeddingCache.CacheStats getCacheStats() {
        return cache.getStats();
    }
}
