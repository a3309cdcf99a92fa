package com.dcruver.provenance.nlp;

import java.util.List;

/**
 * Turns text into embedding vectors.
 * Implementations throw {@link com.dcruver.provenance.error.ProviderConnectionException}
 * when the backing model cannot be reached.
 */
public interface EmbeddingProvider {

    List<Double> embed(String text);

    List<List<Double>> embedBatch(List<String> texts);

    String getModelName();

    int getDimension();
}
