package com.dcruver.provenance.storage;

import com.dcruver.provenance.error.ProviderConnectionException;
import com.dcruver.provenance.error.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Vector index kept in SQLite next to the relational data.
 *
 * Embeddings are stored as JSON arrays and searched by brute-force cosine distance,
 * which suits a personal corpus. The table has no foreign key
 * into {@code fragments}: the index is a separate, eventually consistent view.
 */
@Component
@Slf4j
public class SqliteVectorIndex implements VectorIndex {

    private static final TypeReference<List<Double>> VECTOR_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public SqliteVectorIndex(DataSource dataSource, ObjectMapper objectMapper) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS fragment_embeddings (
                fragment_id TEXT PRIMARY KEY,
                dimension INTEGER NOT NULL,
                embedding_json TEXT NOT NULL,
                metadata_json TEXT NOT NULL DEFAULT '{}',
                updated_at INTEGER NOT NULL
            )
            """);

        log.info("Initialized vector index");
    }

    @Override
    public void upsert(String fragmentId, List<Double> vector, Map<String, String> metadata) {
        if (vector == null || vector.isEmpty()) {
            throw new ValidationException("Cannot index an empty vector for fragment " + fragmentId);
        }

        try {
            jdbcTemplate.update(
                "INSERT OR REPLACE INTO fragment_embeddings (fragment_id, dimension, embedding_json, metadata_json, updated_at) " +
                "VALUES (?, ?, ?, ?, ?)",
                fragmentId,
                vector.size(),
                objectMapper.writeValueAsString(vector),
                objectMapper.writeValueAsString(metadata != null ? metadata : Map.of()),
                Instant.now().toEpochMilli()
            );
            log.debug("Indexed embedding for fragment {}", fragmentId);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Failed to serialize embedding for fragment " + fragmentId, e);
        } catch (DataAccessException e) {
            throw new ProviderConnectionException("vector index", e.getMessage(), e);
        }
    }

    @Override
    public List<VectorMatch> query(List<Double> vector, int k, Map<String, String> filter) {
        if (k <= 0) {
            throw new ValidationException("k must be positive: " + k);
        }

        List<IndexedVector> candidates;
        try {
            candidates = jdbcTemplate.query(
                "SELECT * FROM fragment_embeddings WHERE dimension = ?",
                new IndexedVectorRowMapper(),
                vector.size()
            );
        } catch (DataAccessException e) {
            throw new ProviderConnectionException("vector index", e.getMessage(), e);
        }

        List<VectorMatch> matches = new ArrayList<>();
        for (IndexedVector candidate : candidates) {
            if (!matchesFilter(candidate.getMetadata(), filter)) {
                continue;
            }
            double distance = cosineDistance(vector, candidate.getVector());
            matches.add(new VectorMatch(candidate.getFragmentId(), distance, candidate.getMetadata()));
        }

        matches.sort(Comparator.comparingDouble(VectorMatch::getDistance));
        return matches.size() > k ? List.copyOf(matches.subList(0, k)) : matches;
    }

    @Override
    public boolean delete(String fragmentId) {
        try {
            int rows = jdbcTemplate.update("DELETE FROM fragment_embeddings WHERE fragment_id = ?", fragmentId);
            log.debug("Deleted embedding for fragment {} (existed: {})", fragmentId, rows > 0);
            return rows > 0;
        } catch (DataAccessException e) {
            throw new ProviderConnectionException("vector index", e.getMessage(), e);
        }
    }

    @Override
    public int count() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM fragment_embeddings", Integer.class);
        return count != null ? count : 0;
    }

    /**
     * Cosine distance, {@code 1 - cosine similarity}, in [0, 2]. Zero vectors are maximally distant.
     */
    static double cosineDistance(List<Double> a, List<Double> b) {
        if (a.size() != b.size()) {
            throw new IllegalArgumentException("Embeddings must have same dimension");
        }

        double dotProduct = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;

        for (int i = 0; i < a.size(); i++) {
            dotProduct += a.get(i) * b.get(i);
            norm1 += a.get(i) * a.get(i);
            norm2 += b.get(i) * b.get(i);
        }

        if (norm1 == 0.0 || norm2 == 0.0) {
            return 2.0;
        }
        double similarity = dotProduct / (Math.sqrt(norm1) * Math.sqrt(norm2));
        return Math.max(0.0, Math.min(2.0, 1.0 - similarity));
    }

    private static boolean matchesFilter(Map<String, String> metadata, Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        return filter.entrySet().stream()
            .allMatch(entry -> entry.getValue().equals(metadata.get(entry.getKey())));
    }

    @Value
    private static class IndexedVector {
        String fragmentId;
        List<Double> vector;
        Map<String, String> metadata;
    }

    private class IndexedVectorRowMapper implements RowMapper<IndexedVector> {
        @Override
        public IndexedVector mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new IndexedVector(
                    rs.getString("fragment_id"),
                    objectMapper.readValue(rs.getString("embedding_json"), VECTOR_TYPE),
                    objectMapper.readValue(rs.getString("metadata_json"), METADATA_TYPE)
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to deserialize embedding", e);
            }
        }
    }
}
