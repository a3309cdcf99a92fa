package com.dcruver.provenance.processing;

import com.dcruver.provenance.domain.Assumption;
import com.dcruver.provenance.domain.Decision;
import com.dcruver.provenance.storage.FragmentStore;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs decision and assumption extraction for a stored fragment and persists what
 * passes the filter.
 *
 * This is background enrichment of a fragment that already exists, so nothing thrown
 * here reaches the caller: provider outages, parse failures and store errors are
 * logged and the summary reports what was stored. A record the store rejects is
 * skipped without losing the others from the same reply. Concurrent runs for the same
 * fragment can store duplicate records; there is no uniqueness over extracted content.
 */
@Service
@Slf4j
public class ExtractionService {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.5;

    private final FragmentStore fragmentStore;
    private final ExtractionFilter extractionFilter;
    private final double minConfidence;

    @Autowired
    public ExtractionService(
        FragmentStore fragmentStore,
        ExtractionFilter extractionFilter,
        @Value("${provenance.extraction.min-confidence:0.5}") double minConfidence
    ) {
        this.fragmentStore = fragmentStore;
        this.extractionFilter = extractionFilter;
        this.minConfidence = minConfidence;
    }

    public ExtractionService(FragmentStore fragmentStore, ExtractionFilter extractionFilter) {
        this(fragmentStore, extractionFilter, DEFAULT_MIN_CONFIDENCE);
    }

    public ExtractionSummary extractAndStore(String fragmentId, String content) {
        int decisionsStored = 0;
        int assumptionsStored = 0;

        try {
            ExtractionResult<Decision> decisions = extractionFilter.extractDecisions(content, fragmentId, minConfidence);
            for (Decision decision : decisions.getRecords()) {
                try {
                    fragmentStore.createDecision(decision);
                    decisionsStored++;
                } catch (Exception e) {
                    log.error("Failed to store decision for fragment {}: {}", fragmentId, e.getMessage());
                }
            }
        } catch (Exception e) {
            log.error("Decision extraction failed for fragment {}", fragmentId, e);
        }

        try {
            ExtractionResult<Assumption> assumptions = extractionFilter.extractAssumptions(content, fragmentId);
            for (Assumption assumption : assumptions.getRecords()) {
                try {
                    fragmentStore.createAssumption(assumption);
                    assumptionsStored++;
                } catch (Exception e) {
                    log.error("Failed to store assumption for fragment {}: {}", fragmentId, e.getMessage());
                }
            }
        } catch (Exception e) {
            log.error("Assumption extraction failed for fragment {}", fragmentId, e);
        }

        log.info("Stored {} decisions and {} assumptions for fragment {}",
            decisionsStored, assumptionsStored, fragmentId);
        return new ExtractionSummary(decisionsStored, assumptionsStored);
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    @Getter
    @AllArgsConstructor
    public static class ExtractionSummary {
        private final int decisionsStored;
        private final int assumptionsStored;
    }
}
