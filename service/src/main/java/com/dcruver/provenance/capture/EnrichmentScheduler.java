package com.dcruver.provenance.capture;

import com.dcruver.provenance.config.EnrichmentExecutorConfiguration;
import com.dcruver.provenance.config.EnrichmentExecutorConfiguration.EnrichmentProperties;
import com.dcruver.provenance.processing.ExtractionService;
import com.dcruver.provenance.processing.LinkingEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Submits background enrichment for stored fragments to the enrichment worker pool.
 *
 * Submission never blocks or fails the caller: a full queue drops the task with a
 * warning, and the tasks themselves swallow their own failures. Nothing is retried
 * automatically; re-running linking for a fragment is always safe.
 */
@Component
@Slf4j
public class EnrichmentScheduler {

    private final TaskExecutor executor;
    private final LinkingEngine linkingEngine;
    private final ExtractionService extractionService;
    private final EnrichmentProperties properties;

    public EnrichmentScheduler(
        @Qualifier(EnrichmentExecutorConfiguration.EXECUTOR_BEAN) TaskExecutor executor,
        LinkingEngine linkingEngine,
        ExtractionService extractionService,
        EnrichmentProperties properties
    ) {
        this.executor = executor;
        this.linkingEngine = linkingEngine;
        this.extractionService = extractionService;
        this.properties = properties;
    }

    /**
     * Queue linking and extraction for a fragment that has been stored and embedded.
     */
    public void scheduleEnrichment(String fragmentId, String content, List<Double> vector) {
        scheduleLinking(fragmentId, vector);
        scheduleExtraction(fragmentId, content);
    }

    public boolean scheduleLinking(String fragmentId, List<Double> vector) {
        if (!properties.isLinkingEnabled()) {
            return false;
        }
        return submit("linking", fragmentId, () -> linkingEngine.linkSimilarFragments(fragmentId, vector));
    }

    public boolean scheduleExtraction(String fragmentId, String content) {
        if (!properties.isExtractionEnabled()) {
            return false;
        }
        return submit("extraction", fragmentId, () -> extractionService.extractAndStore(fragmentId, content));
    }

    private boolean submit(String task, String fragmentId, Runnable work) {
        try {
            executor.execute(() -> {
                try {
                    work.run();
                } catch (Exception e) {
                    log.error("Background {} failed for fragment {}", task, fragmentId, e);
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Enrichment queue full, dropping {} for fragment {}", task, fragmentId);
            return false;
        }
    }
}
