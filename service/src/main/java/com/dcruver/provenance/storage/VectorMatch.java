package com.dcruver.provenance.storage;

import lombok.Value;

import java.util.Map;

/**
 * One neighbour returned by a {@link VectorIndex} query.
 */
@Value
public class VectorMatch {
    String fragmentId;
    double distance;
    Map<String, String> metadata;

    /**
     * Similarity derived from cosine distance: {@code 1 - distance}, clamped to [0, 1].
     */
    public double getSimilarity() {
        return similarityFromDistance(distance);
    }

    public static double similarityFromDistance(double distance) {
        double similarity = 1.0 - distance;
        if (similarity < 0.0) {
            return 0.0;
        }
        return Math.min(similarity, 1.0);
    }
}
