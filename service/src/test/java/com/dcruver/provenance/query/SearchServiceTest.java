package com.dcruver.provenance.query;

import com.dcruver.provenance.app.DataSourceConfig;
import com.dcruver.provenance.domain.Fragment;
import com.dcruver.provenance.domain.Identifiers;
import com.dcruver.provenance.error.ValidationException;
import com.dcruver.provenance.nlp.EmbeddingCache;
import com.dcruver.provenance.nlp.EmbeddingService;
import com.dcruver.provenance.nlp.FakeEmbeddingProvider;
import com.dcruver.provenance.storage.FragmentStore;
import com.dcruver.provenance.storage.SqliteVectorIndex;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SearchServiceTest {

    @TempDir
    Path tempDir;

    private FragmentStore store;
    private SqliteVectorIndex index;
    private FakeEmbeddingProvider provider;
    private SearchService searchService;

    @BeforeEach
    void setUp() throws Exception {
        DataSource dataSource = DataSourceConfig.sqliteDataSource(tempDir.resolve("provenance.db"));
        store = new FragmentStore(dataSource, new DataSourceTransactionManager(dataSource));
        store.init();
        index = new SqliteVectorIndex(dataSource, new ObjectMapper());
        index.init();
        provider = new FakeEmbeddingProvider();
        searchService = new SearchService(new EmbeddingService(provider, new EmbeddingCache(100)), index, store);
    }

    @Test
    void testResultsOrderedBySimilarity() {
        Fragment close = indexed("Database choice", "alpha", List.of(1.0, 0.0));
        Fragment further = indexed("Database hosting", "alpha", List.of(0.7, 0.7));
        indexed("Holiday schedule", "beta", List.of(0.0, 1.0));
        provider.register("which database?", List.of(1.0, 0.0));

        List<SearchHit> hits = searchService.search("which database?", 2);

        assertEquals(2, hits.size());
        assertEquals(close.getId(), hits.get(0).getFragment().getId());
        assertEquals(further.getId(), hits.get(1).getFragment().getId());
        assertEquals(1.0, hits.get(0).getSimilarity(), 1e-9);
        assertTrue(hits.get(0).getSimilarity() > hits.get(1).getSimilarity());
    }

    @Test
    void testProjectFilterAndMinimumSimilarity() {
        indexed("Database choice", "alpha", List.of(1.0, 0.0));
        Fragment beta = indexed("Holiday schedule", "beta", List.of(0.0, 1.0));
        provider.register("query", List.of(1.0, 0.0));

        List<SearchHit> betaHits = searchService.search("query", 10, "beta", 0.0);
        assertEquals(1, betaHits.size());
        assertEquals(beta.getId(), betaHits.get(0).getFragment().getId());

        assertTrue(searchService.search("query", 10, "beta", 0.5).isEmpty());
    }

    @Test
    void testIndexEntriesWithoutFragmentAreSkipped() {
        index.upsert(Identifiers.newId(), List.of(1.0, 0.0), Map.of());
        Fragment kept = indexed("Kept", null, List.of(0.9, 0.1));
        provider.register("query", List.of(1.0, 0.0));

        List<SearchHit> hits = searchService.search("query", 10);

        assertEquals(1, hits.size());
        assertEquals(kept.getId(), hits.get(0).getFragment().getId());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(ValidationException.class, () -> searchService.search(" ", 10));
        assertThrows(ValidationException.class, () -> searchService.search("query", 0));
        assertThrows(ValidationException.class, () -> searchService.search("query", SearchService.MAX_LIMIT + 1));
    }

    private Fragment indexed(String content, String project, List<Double> vector) {
        Fragment fragment = store.createFragment(Fragment.builder().rawContent(content).project(project).build());
        index.upsert(fragment.getId(), vector, project != null ? Map.of("project", project) : Map.of());
        return fragment;
    }
}
