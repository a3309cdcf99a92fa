package com.dcruver.provenance.nlp;

import com.dcruver.provenance.error.ProviderConnectionException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory embedding provider. Texts without a registered vector embed to a fixed default.
 */
public class FakeEmbeddingProvider implements EmbeddingProvider {

    private final Map<String, List<Double>> vectors = new HashMap<>();
    private List<Double> defaultVector = List.of(1.0, 0.0, 0.0);
    private boolean available = true;
    private int calls;

    public FakeEmbeddingProvider register(String text, List<Double> vector) {
        vectors.put(text, vector);
        return this;
    }

    public void setDefaultVector(List<Double> defaultVector) {
        this.defaultVector = defaultVector;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public int getCalls() {
        return calls;
    }

    @Override
    public List<Double> embed(String text) {
        calls++;
        if (!available) {
            throw new ProviderConnectionException("embedding provider", "connection refused", null);
        }
        return vectors.getOrDefault(text, defaultVector);
    }

    @Override
    public List<List<Double>> embedBatch(List<String> texts) {
        List<List<Double>> result = new ArrayList<>();
        for (String text : texts) {
            result.add(embed(text));
        }
        return result;
    }

    @Override
    public String getModelName() {
        return "fake-embed";
    }

    @Override
    public int getDimension() {
        return defaultVector.size();
    }
}
