package com.dcruver.provenance.nlp;

import com.dcruver.provenance.error.ProviderConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Embedding provider backed by Ollama through Spring AI.
 */
@Service
@Slf4j
public class OllamaEmbeddingProvider implements EmbeddingProvider {

    // Known output sizes, used without a round trip to the model
    private static final Map<String, Integer> MODEL_DIMENSIONS = Map.of(
        "nomic-embed-text", 768,
        "mxbai-embed-large", 1024,
        "all-minilm", 384,
        "snowflake-arctic-embed", 1024
    );

    private static final int DEFAULT_DIMENSION = 768;

    private final EmbeddingModel embeddingModel;
    private final String modelName;

    public OllamaEmbeddingProvider(
        EmbeddingModel embeddingModel,
        @Value("${spring.ai.ollama.embedding.options.model:nomic-embed-text}") String modelName
    ) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
        log.info("OllamaEmbeddingProvider initialized with model {}", modelName);
    }

    @Override
    public List<Double> embed(String text) {
        try {
            return toDoubles(embeddingModel.embed(text));
        } catch (RuntimeException e) {
            throw new ProviderConnectionException("embedding provider", e.getMessage(), e);
        }
    }

    @Override
    public List<List<Double>> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        EmbeddingResponse response;
        try {
            response = embeddingModel.embedForResponse(texts);
        } catch (RuntimeException e) {
            throw new ProviderConnectionException("embedding provider", e.getMessage(), e);
        }

        return response.getResults().stream()
            .map(result -> toDoubles(result.getOutput()))
            .toList();
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    @Override
    public int getDimension() {
        String baseName = modelName.contains(":") ? modelName.substring(0, modelName.indexOf(':')) : modelName;
        return MODEL_DIMENSIONS.getOrDefault(baseName, DEFAULT_DIMENSION);
    }

    private static List<Double> toDoubles(float[] floatArray) {
        List<Double> result = new ArrayList<>(floatArray.length);
        for (float f : floatArray) {
            result.add((double) f);
        }
        return result;
    }
}
