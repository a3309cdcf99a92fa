package com.dcruver.provenance.capture;

import com.dcruver.provenance.app.DataSourceConfig;
import com.dcruver.provenance.config.EnrichmentExecutorConfiguration.EnrichmentProperties;
import com.dcruver.provenance.domain.Fragment;
import com.dcruver.provenance.domain.FragmentFilter;
import com.dcruver.provenance.domain.FragmentLink;
import com.dcruver.provenance.domain.FragmentUpdate;
import com.dcruver.provenance.domain.Identifiers;
import com.dcruver.provenance.domain.LinkKind;
import com.dcruver.provenance.domain.SourceKind;
import com.dcruver.provenance.error.NotFoundException;
import com.dcruver.provenance.error.ProviderConnectionException;
import com.dcruver.provenance.error.ValidationException;
import com.dcruver.provenance.nlp.EmbeddingCache;
import com.dcruver.provenance.nlp.EmbeddingService;
import com.dcruver.provenance.nlp.FakeEmbeddingProvider;
import com.dcruver.provenance.nlp.FakeTextGenerationProvider;
import com.dcruver.provenance.processing.ExtractionFilter;
import com.dcruver.provenance.processing.ExtractionService;
import com.dcruver.provenance.processing.LinkingEngine;
import com.dcruver.provenance.storage.FragmentStore;
import com.dcruver.provenance.storage.SqliteVectorIndex;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end capture with enrichment running inline on the calling thread.
 */
class CaptureServiceTest {

    private static final String POSTGRES_DECISION = "We decided to use PostgreSQL for the main database";
    private static final String POSTGRES_FOLLOWUP = "PostgreSQL was chosen because of its JSON support";
    private static final String UNRELATED = "Team lunch moved to Thursday";

    @TempDir
    Path tempDir;

    private FragmentStore store;
    private SqliteVectorIndex index;
    private FakeEmbeddingProvider embeddingProvider;
    private FakeTextGenerationProvider textProvider;
    private CaptureService captureService;

    @BeforeEach
    void setUp() throws Exception {
        DataSource dataSource = DataSourceConfig.sqliteDataSource(tempDir.resolve("provenance.db"));
        store = new FragmentStore(dataSource, new DataSourceTransactionManager(dataSource));
        store.init();
        index = new SqliteVectorIndex(dataSource, new ObjectMapper());
        index.init();

        embeddingProvider = new FakeEmbeddingProvider()
            .register(POSTGRES_DECISION, List.of(1.0, 0.1, 0.0))
            .register(POSTGRES_FOLLOWUP, List.of(0.9, 0.2, 0.0))
            .register(UNRELATED, List.of(0.0, 0.0, 1.0));
        textProvider = new FakeTextGenerationProvider();

        EmbeddingService embeddingService = new EmbeddingService(embeddingProvider, new EmbeddingCache(100));
        EnrichmentScheduler scheduler = new EnrichmentScheduler(
            new SyncTaskExecutor(),
            new LinkingEngine(store, index),
            new ExtractionService(store, new ExtractionFilter(textProvider)),
            new EnrichmentProperties()
        );
        captureService = new CaptureService(store, embeddingService, index, scheduler);
    }

    @Test
    void testCaptureStoresIndexesAndLinks() {
        Fragment first = captureService.capture(Fragment.builder()
            .rawContent(POSTGRES_DECISION).project("backend").build());
        Fragment second = captureService.capture(Fragment.builder()
            .rawContent(POSTGRES_FOLLOWUP).project("backend").sourceKind(SourceKind.CHAT).build());
        Fragment unrelated = captureService.capture(Fragment.builder().rawContent(UNRELATED).build());

        assertEquals(3, index.count());
        assertEquals(3, store.listFragments(FragmentFilter.all()).size());

        List<FragmentLink> links = store.listLinks(LinkKind.RELATES_TO, 10);
        assertEquals(1, links.size());
        assertEquals(second.getId(), links.get(0).getSourceId());
        assertEquals(first.getId(), links.get(0).getTargetId());
        assertTrue(links.get(0).getStrength() >= 0.75);

        assertTrue(store.getRelatedFragments(unrelated.getId(), null).isEmpty());
    }

    @Test
    void testCaptureRunsExtraction() {
        textProvider.setDecisionReply(
            "{\"decisions\": [{\"what\": \"Use PostgreSQL\", \"why\": \"main database\", \"confidence\": 0.9}]}");

        Fragment fragment = captureService.capture(Fragment.builder().rawContent(POSTGRES_DECISION).build());

        Fragment read = store.getFragment(fragment.getId()).orElseThrow();
        assertEquals(1, read.getDecisions().size());
        assertEquals("Use PostgreSQL", read.getDecisions().get(0).getWhat());
    }

    @Test
    void testEmbeddingOutageKeepsFragment() {
        embeddingProvider.setAvailable(false);

        assertThrows(ProviderConnectionException.class,
            () -> captureService.capture(Fragment.builder().rawContent(POSTGRES_DECISION).build()));

        List<Fragment> stored = store.listFragments(FragmentFilter.all());
        assertEquals(1, stored.size());
        assertEquals(0, index.count());

        embeddingProvider.setAvailable(true);
        captureService.reindex(stored.get(0).getId());
        assertEquals(1, index.count());
    }

    @Test
    void testEmptyContentIsRejectedBeforeAnythingIsStored() {
        assertThrows(ValidationException.class,
            () -> captureService.capture(Fragment.builder().rawContent("").build()));
        assertTrue(store.listFragments(FragmentFilter.all()).isEmpty());
        assertEquals(0, embeddingProvider.getCalls());
    }

    @Test
    void testDeleteRemovesFragmentAndVector() {
        Fragment first = captureService.capture(Fragment.builder().rawContent(POSTGRES_DECISION).build());
        Fragment second = captureService.capture(Fragment.builder().rawContent(POSTGRES_FOLLOWUP).build());

        assertTrue(captureService.delete(first.getId()));

        assertEquals(1, index.count());
        assertTrue(store.getFragment(first.getId()).isEmpty());
        assertTrue(store.getRelatedFragments(second.getId(), null).isEmpty());
        assertFalse(captureService.delete(first.getId()));
    }

    @Test
    void testProjectChangeUpdatesIndexMetadata() {
        Fragment fragment = captureService.capture(Fragment.builder()
            .rawContent(POSTGRES_DECISION).project("old").build());

        captureService.update(fragment.getId(), FragmentUpdate.builder().project("new").build());

        assertEquals(1, index.query(List.of(1.0, 0.1, 0.0), 5, Map.of("project", "new")).size());
        assertTrue(index.query(List.of(1.0, 0.1, 0.0), 5, Map.of("project", "old")).isEmpty());
    }

    @Test
    void testReindexMissingFragment() {
        assertThrows(NotFoundException.class, () -> captureService.reindex(Identifiers.newId()));
    }
}
