package com.dcruver.provenance.storage;

import java.util.List;
import java.util.Map;

/**
 * Nearest-neighbour index over fragment embeddings.
 *
 * Distances are cosine distances in [0, 2]. The index is kept in step with the
 * relational store on a best-effort basis only; callers must tolerate ids that no
 * longer exist there. Implementations signal an unreachable backend with
 * {@link com.dcruver.provenance.error.ProviderConnectionException}.
 */
public interface VectorIndex {

    void upsert(String fragmentId, List<Double> vector, Map<String, String> metadata);

    /**
     * @param filter equality filter on metadata; null or empty matches everything
     * @return up to {@code k} matches ordered by ascending distance
     */
    List<VectorMatch> query(List<Double> vector, int k, Map<String, String> filter);

    /**
     * @return whether an entry existed
     */
    boolean delete(String fragmentId);

    int count();
}
