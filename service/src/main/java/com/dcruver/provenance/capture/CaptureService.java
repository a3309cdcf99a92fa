package com.dcruver.provenance.capture;

import com.dcruver.provenance.domain.Fragment;
import com.dcruver.provenance.domain.FragmentUpdate;
import com.dcruver.provenance.domain.Identifiers;
import com.dcruver.provenance.error.NotFoundException;
import com.dcruver.provenance.error.ProviderConnectionException;
import com.dcruver.provenance.nlp.EmbeddingResult;
import com.dcruver.provenance.nlp.EmbeddingService;
import com.dcruver.provenance.storage.FragmentStore;
import com.dcruver.provenance.storage.VectorIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Capture pipeline: store the fragment, embed it, index the vector, then hand
 * linking and extraction to the background pool.
 *
 * The fragment is durable before the embedding call. If the embedding provider is
 * down the {@link ProviderConnectionException} reaches the caller but the fragment
 * stays stored; {@link #reindex} can complete it later.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CaptureService {

    private final FragmentStore fragmentStore;
    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;
    private final EnrichmentScheduler enrichmentScheduler;

    public Fragment capture(Fragment draft) {
        Fragment fragment = fragmentStore.createFragment(draft);

        EmbeddingResult embedding;
        try {
            embedding = embeddingService.embed(fragment.getRawContent());
        } catch (ProviderConnectionException e) {
            log.warn("Fragment {} stored without embedding: {}", fragment.getId(), e.getMessage());
            throw e;
        }

        vectorIndex.upsert(fragment.getId(), embedding.getVector(), indexMetadata(fragment));
        enrichmentScheduler.scheduleEnrichment(fragment.getId(), fragment.getRawContent(), embedding.getVector());

        log.info("Captured fragment {} ({} chars, embedding {}{})", fragment.getId(),
            fragment.getRawContent().length(), embedding.getModel(), embedding.isCached() ? ", cached" : "");
        return fragment;
    }

    /**
     * Re-embed and re-index an existing fragment, then queue linking again.
     * Links are upserts, so this is safe to repeat.
     */
    public Fragment reindex(String fragmentId) {
        String id = Identifiers.require(fragmentId, "fragment id");
        Fragment fragment = fragmentStore.getFragment(id)
            .orElseThrow(() -> new NotFoundException("Fragment", id));

        EmbeddingResult embedding = embeddingService.embed(fragment.getRawContent());
        vectorIndex.upsert(id, embedding.getVector(), indexMetadata(fragment));
        enrichmentScheduler.scheduleLinking(id, embedding.getVector());

        log.info("Re-indexed fragment {}", id);
        return fragment;
    }

    /**
     * Apply metadata changes. A project change is pushed to the vector index so
     * project-filtered search stays accurate; an index failure there is only logged.
     */
    public Fragment update(String fragmentId, FragmentUpdate update) {
        Fragment before = fragmentStore.getFragment(fragmentId)
            .orElseThrow(() -> new NotFoundException("Fragment", fragmentId));
        Fragment updated = fragmentStore.updateFragment(fragmentId, update);

        if (!Objects.equals(before.getProject(), updated.getProject())) {
            try {
                EmbeddingResult embedding = embeddingService.embed(updated.getRawContent());
                vectorIndex.upsert(updated.getId(), embedding.getVector(), indexMetadata(updated));
            } catch (ProviderConnectionException e) {
                log.error("Fragment {} updated but its index metadata is stale", updated.getId(), e);
            }
        }
        return updated;
    }

    /**
     * Delete a fragment and its dependents, then drop its vector. A vector index
     * failure is only logged: the relational delete is what counts, and search skips
     * ids the store no longer has.
     *
     * @return whether the fragment existed
     */
    public boolean delete(String fragmentId) {
        String id = Identifiers.require(fragmentId, "fragment id");
        boolean deleted = fragmentStore.deleteFragment(id);
        if (!deleted) {
            return false;
        }

        try {
            vectorIndex.delete(id);
        } catch (ProviderConnectionException e) {
            log.error("Fragment {} deleted but its vector could not be removed", id, e);
        }
        return true;
    }

    private static Map<String, String> indexMetadata(Fragment fragment) {
        Map<String, String> metadata = new HashMap<>();
        if (fragment.getProject() != null) {
            metadata.put("project", fragment.getProject());
        }
        metadata.put("source_kind", fragment.getSourceKind().getValue());
        return metadata;
    }
}
