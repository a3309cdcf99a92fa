package com.dcruver.provenance.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for background enrichment (linking and extraction).
 *
 * Bounded queue with no caller-runs fallback: when it is full, submissions are
 * rejected and the submitter drops the task. On shutdown the pool drains queued
 * tasks for up to the configured time.
 */
@Configuration
@Slf4j
public class EnrichmentExecutorConfiguration {

    public static final String EXECUTOR_BEAN = "enrichmentExecutor";

    @Bean(name = EXECUTOR_BEAN)
    public ThreadPoolTaskExecutor enrichmentExecutor(EnrichmentProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCorePoolSize());
        executor.setMaxPoolSize(properties.getMaxPoolSize());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("enrichment-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getAwaitTerminationSeconds());

        log.info("Enrichment executor: {}-{} threads, queue capacity {}",
            properties.getCorePoolSize(), properties.getMaxPoolSize(), properties.getQueueCapacity());
        return executor;
    }

    /**
     * Configuration properties for background enrichment.
     */
    @Configuration
    @ConfigurationProperties(prefix = "provenance.enrichment")
    @Data
    public static class EnrichmentProperties {
        private boolean linkingEnabled = true;
        private boolean extractionEnabled = true;
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 100;
        private int awaitTerminationSeconds = 30;
    }
}
