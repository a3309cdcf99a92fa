package com.dcruver.provenance.processing;

import com.dcruver.provenance.domain.FragmentLink;
import com.dcruver.provenance.domain.LinkKind;
import com.dcruver.provenance.error.NotFoundException;
import com.dcruver.provenance.storage.FragmentStore;
import com.dcruver.provenance.storage.VectorIndex;
import com.dcruver.provenance.storage.VectorMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns nearest-neighbour results into RELATES_TO links.
 *
 * For a freshly stored fragment, asks the vector index for its closest neighbours and
 * links the fragment to every neighbour whose similarity reaches the threshold, with
 * the similarity as strength. Link creation is an upsert, so running this any number
 * of times for the same fragment leaves one edge per neighbour.
 *
 * Runs as background enrichment: every failure is logged and swallowed here.
 */
@Component
@Slf4j
public class LinkingEngine {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.75;
    public static final int DEFAULT_NEIGHBORS = 10;

    private final FragmentStore fragmentStore;
    private final VectorIndex vectorIndex;
    private final double similarityThreshold;
    private final int neighbors;

    @Autowired
    public LinkingEngine(
        FragmentStore fragmentStore,
        VectorIndex vectorIndex,
        @Value("${provenance.linking.similarity-threshold:0.75}") double similarityThreshold,
        @Value("${provenance.linking.neighbors:10}") int neighbors
    ) {
        this.fragmentStore = fragmentStore;
        this.vectorIndex = vectorIndex;
        this.similarityThreshold = similarityThreshold;
        this.neighbors = neighbors;
    }

    public LinkingEngine(FragmentStore fragmentStore, VectorIndex vectorIndex) {
        this(fragmentStore, vectorIndex, DEFAULT_SIMILARITY_THRESHOLD, DEFAULT_NEIGHBORS);
    }

    /**
     * Link a fragment to its similar neighbours.
     *
     * @param fragmentId the fragment just stored
     * @param vector its embedding
     * @return the links created or refreshed; empty on failure
     */
    public List<FragmentLink> linkSimilarFragments(String fragmentId, List<Double> vector) {
        List<VectorMatch> matches;
        try {
            // one extra slot, the fragment itself is usually its own nearest neighbour
            matches = vectorIndex.query(vector, neighbors + 1, null);
        } catch (Exception e) {
            log.error("Failed to query similar fragments for {}", fragmentId, e);
            return List.of();
        }

        List<FragmentLink> links = new ArrayList<>();
        for (VectorMatch match : matches) {
            if (fragmentId.equals(match.getFragmentId())) {
                continue;
            }

            double similarity = match.getSimilarity();
            if (similarity < similarityThreshold) {
                log.debug("Skipping neighbour {} of {}: similarity {} below {}",
                    match.getFragmentId(), fragmentId, String.format("%.3f", similarity), similarityThreshold);
                continue;
            }

            try {
                links.add(fragmentStore.createLink(FragmentLink.builder()
                    .sourceId(fragmentId)
                    .targetId(match.getFragmentId())
                    .kind(LinkKind.RELATES_TO)
                    .strength(similarity)
                    .build()));
            } catch (NotFoundException e) {
                // index still holds a fragment the store has already deleted, or the source went away
                log.debug("Skipping link {} -> {}: {}", fragmentId, match.getFragmentId(), e.getMessage());
            } catch (Exception e) {
                log.error("Failed to link fragment {} to {}", fragmentId, match.getFragmentId(), e);
            }
        }

        log.info("Linked fragment {} to {} similar fragments", fragmentId, links.size());
        return links;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }
}
