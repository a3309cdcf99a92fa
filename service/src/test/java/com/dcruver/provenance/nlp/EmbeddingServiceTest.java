package com.dcruver.provenance.nlp;

import com.dcruver.provenance.error.ProviderConnectionException;
import com.dcruver.provenance.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingServiceTest {

    private FakeEmbeddingProvider provider;
    private EmbeddingService service;

    @BeforeEach
    void setUp() {
        provider = new FakeEmbeddingProvider()
            .register("hello", List.of(0.1, 0.2, 0.3))
            .register("world", List.of(0.3, 0.2, 0.1));
        service = new EmbeddingService(provider, new EmbeddingCache(100));
    }

    @Test
    void testSecondCallIsServedFromCache() {
        EmbeddingResult first = service.embed("hello");
        EmbeddingResult second = service.embed("hello");

        assertFalse(first.isCached());
        assertTrue(second.isCached());
        assertEquals(first.getVector(), second.getVector());
        assertEquals("fake-embed", second.getModel());
        assertEquals(3, second.getDimension());
        assertEquals(1, provider.getCalls());
    }

    @Test
    void testBatchOnlyEmbedsMisses() {
        service.embed("hello");

        List<EmbeddingResult> results = service.embedBatch(List.of("world", "hello"));

        assertEquals(2, results.size());
        assertEquals(List.of(0.3, 0.2, 0.1), results.get(0).getVector());
        assertFalse(results.get(0).isCached());
        assertTrue(results.get(1).isCached());
        assertEquals(2, provider.getCalls());
    }

    @Test
    void testEmptyTextIsRejected() {
        assertThrows(ValidationException.class, () -> service.embed(""));
        assertThrows(ValidationException.class, () -> service.embedBatch(List.of("ok", " ")));
        assertEquals(0, provider.getCalls());
    }

    @Test
    void testProviderOutagePropagates() {
        provider.setAvailable(false);
        assertThrows(ProviderConnectionException.class, () -> service.embed("hello"));
    }
}
