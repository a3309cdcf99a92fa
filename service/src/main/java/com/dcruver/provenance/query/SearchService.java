package com.dcruver.provenance.query;

import com.dcruver.provenance.domain.Fragment;
import com.dcruver.provenance.error.ValidationException;
import com.dcruver.provenance.nlp.EmbeddingService;
import com.dcruver.provenance.storage.FragmentStore;
import com.dcruver.provenance.storage.VectorIndex;
import com.dcruver.provenance.storage.VectorMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Semantic search over captured fragments.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SearchService {

    static final int MAX_LIMIT = 100;

    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;
    private final FragmentStore fragmentStore;

    /**
     * Embed the query and return the closest fragments, most similar first.
     * Index entries whose fragment no longer exists are skipped.
     *
     * @param project restrict to one project, or null
     * @param minSimilarity drop hits below this similarity; 0 keeps everything
     * @throws com.dcruver.provenance.error.ProviderConnectionException if the embedding provider is down
     */
    public List<SearchHit> search(String query, int limit, String project, double minSimilarity) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Search query must not be empty");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("Limit must be between 1 and " + MAX_LIMIT + ": " + limit);
        }

        List<Double> vector = embeddingService.embed(query).getVector();
        Map<String, String> filter = project != null && !project.isBlank() ? Map.of("project", project) : null;

        List<SearchHit> hits = new ArrayList<>();
        for (VectorMatch match : vectorIndex.query(vector, limit, filter)) {
            double similarity = match.getSimilarity();
            if (similarity < minSimilarity) {
                continue;
            }

            Optional<Fragment> fragment = fragmentStore.getFragment(match.getFragmentId());
            if (fragment.isEmpty()) {
                log.debug("Search hit {} has no stored fragment, skipping", match.getFragmentId());
                continue;
            }
            hits.add(new SearchHit(fragment.get(), similarity));
        }

        log.debug("Search '{}' returned {} hits", query, hits.size());
        return hits;
    }

    public List<SearchHit> search(String query, int limit) {
        return search(query, limit, null, 0.0);
    }
}
