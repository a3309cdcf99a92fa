package com.dcruver.provenance.storage;

import com.dcruver.provenance.domain.Assumption;
import com.dcruver.provenance.domain.AssumptionValidity;
import com.dcruver.provenance.domain.Decision;
import com.dcruver.provenance.domain.Fragment;
import com.dcruver.provenance.domain.FragmentFilter;
import com.dcruver.provenance.domain.FragmentLink;
import com.dcruver.provenance.domain.FragmentUpdate;
import com.dcruver.provenance.domain.Identifiers;
import com.dcruver.provenance.domain.LinkKind;
import com.dcruver.provenance.domain.RecordFilter;
import com.dcruver.provenance.domain.RelatedFragment;
import com.dcruver.provenance.domain.SourceKind;
import com.dcruver.provenance.error.NotFoundException;
import com.dcruver.provenance.error.ValidationException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Relational store for fragments and everything that hangs off them:
 * decisions, assumptions and links.
 *
 * Every public operation runs in a single transaction. Deleting a fragment removes
 * its decisions, assumptions and links in the same transaction; the foreign keys
 * declare the same cascade so rows written by other tools stay consistent too.
 */
@Component
@Slf4j
public class FragmentStore {

    static final int SCHEMA_VERSION = 1;
    static final int DEFAULT_RELATED_LIMIT = 100;

    private static final String[] SCHEMA = {
        """
        CREATE TABLE IF NOT EXISTS schema_version (
            version INTEGER PRIMARY KEY,
            applied_at INTEGER NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS fragments (
            id TEXT PRIMARY KEY,
            raw_content TEXT NOT NULL,
            summary TEXT,
            source_kind TEXT NOT NULL
                CHECK (source_kind IN ('quick_capture', 'meeting_video', 'chat', 'notes')),
            source_ref TEXT,
            captured_at INTEGER NOT NULL,
            project TEXT,
            created_at INTEGER NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS fragment_participants (
            fragment_id TEXT NOT NULL REFERENCES fragments(id) ON DELETE CASCADE,
            name TEXT NOT NULL,
            PRIMARY KEY (fragment_id, name)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS fragment_topics (
            fragment_id TEXT NOT NULL REFERENCES fragments(id) ON DELETE CASCADE,
            topic TEXT NOT NULL,
            PRIMARY KEY (fragment_id, topic)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS decisions (
            id TEXT PRIMARY KEY,
            fragment_id TEXT NOT NULL REFERENCES fragments(id) ON DELETE CASCADE,
            what TEXT NOT NULL,
            why TEXT NOT NULL DEFAULT '',
            confidence REAL NOT NULL CHECK (confidence >= 0.0 AND confidence <= 1.0),
            created_at INTEGER NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS assumptions (
            id TEXT PRIMARY KEY,
            fragment_id TEXT NOT NULL REFERENCES fragments(id) ON DELETE CASCADE,
            statement TEXT NOT NULL,
            explicit INTEGER NOT NULL DEFAULT 1,
            validity TEXT NOT NULL DEFAULT 'unknown'
                CHECK (validity IN ('unknown', 'valid', 'invalid')),
            invalidated_by TEXT REFERENCES fragments(id) ON DELETE SET NULL,
            created_at INTEGER NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS fragment_links (
            id TEXT PRIMARY KEY,
            source_id TEXT NOT NULL REFERENCES fragments(id) ON DELETE CASCADE,
            target_id TEXT NOT NULL REFERENCES fragments(id) ON DELETE CASCADE,
            kind TEXT NOT NULL
                CHECK (kind IN ('relates_to', 'references', 'follows', 'contradicts', 'invalidates')),
            strength REAL NOT NULL CHECK (strength >= 0.0 AND strength <= 1.0),
            created_at INTEGER NOT NULL,
            UNIQUE (source_id, target_id, kind)
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_fragments_captured_at ON fragments(captured_at DESC)",
        "CREATE INDEX IF NOT EXISTS idx_fragments_project ON fragments(project)",
        "CREATE INDEX IF NOT EXISTS idx_fragments_source_kind ON fragments(source_kind)",
        "CREATE INDEX IF NOT EXISTS idx_decisions_fragment_id ON decisions(fragment_id)",
        "CREATE INDEX IF NOT EXISTS idx_decisions_created_at ON decisions(created_at DESC)",
        "CREATE INDEX IF NOT EXISTS idx_assumptions_fragment_id ON assumptions(fragment_id)",
        "CREATE INDEX IF NOT EXISTS idx_assumptions_validity ON assumptions(validity)",
        "CREATE INDEX IF NOT EXISTS idx_assumptions_invalidated_by ON assumptions(invalidated_by)",
        "CREATE INDEX IF NOT EXISTS idx_fragment_links_source_id ON fragment_links(source_id)",
        "CREATE INDEX IF NOT EXISTS idx_fragment_links_target_id ON fragment_links(target_id)",
        "CREATE INDEX IF NOT EXISTS idx_fragment_links_kind ON fragment_links(kind)"
    };

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final RowMapper<Fragment> fragmentRowMapper = new FragmentRowMapper();
    private final RowMapper<Decision> decisionRowMapper = new DecisionRowMapper();
    private final RowMapper<Assumption> assumptionRowMapper = new AssumptionRowMapper();
    private final RowMapper<FragmentLink> linkRowMapper = new LinkRowMapper();

    @Autowired
    public FragmentStore(DataSource dataSource, PlatformTransactionManager transactionManager) {
        this(dataSource, transactionManager, Clock.systemUTC());
    }

    public FragmentStore(DataSource dataSource, PlatformTransactionManager transactionManager, Clock clock) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        transactionTemplate.executeWithoutResult(status -> {
            for (String statement : SCHEMA) {
                jdbcTemplate.execute(statement);
            }
            jdbcTemplate.update(
                "INSERT OR REPLACE INTO schema_version (version, applied_at) VALUES (?, ?)",
                SCHEMA_VERSION, now().toEpochMilli()
            );
        });

        log.info("Initialized fragment store (schema version {})", SCHEMA_VERSION);
    }

    // ============== Fragments ==============

    /**
     * Persist a new fragment. The id and creation time are assigned here; a missing
     * capture time defaults to now and a missing source kind to quick capture.
     */
    public Fragment createFragment(Fragment draft) {
        if (draft.getRawContent() == null || draft.getRawContent().isBlank()) {
            throw new ValidationException("Fragment content must not be empty");
        }

        Instant createdAt = now();
        Fragment fragment = Fragment.builder()
            .id(Identifiers.newId())
            .rawContent(draft.getRawContent())
            .summary(blankToNull(draft.getSummary()))
            .sourceKind(draft.getSourceKind() != null ? draft.getSourceKind() : SourceKind.QUICK_CAPTURE)
            .sourceRef(blankToNull(draft.getSourceRef()))
            .capturedAt(draft.getCapturedAt() != null ? draft.getCapturedAt().truncatedTo(ChronoUnit.MILLIS) : createdAt)
            .participants(normalizeValues(draft.getParticipants()))
            .topics(normalizeValues(draft.getTopics()))
            .project(blankToNull(draft.getProject()))
            .createdAt(createdAt)
            .build();

        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update(
                "INSERT INTO fragments (id, raw_content, summary, source_kind, source_ref, captured_at, project, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                fragment.getId(),
                fragment.getRawContent(),
                fragment.getSummary(),
                fragment.getSourceKind().getValue(),
                fragment.getSourceRef(),
                fragment.getCapturedAt().toEpochMilli(),
                fragment.getProject(),
                fragment.getCreatedAt().toEpochMilli()
            );
            insertValues("fragment_participants", "name", fragment.getId(), fragment.getParticipants());
            insertValues("fragment_topics", "topic", fragment.getId(), fragment.getTopics());
        });

        log.debug("Created fragment {} ({})", fragment.getId(), fragment.getSourceKind().getValue());
        return fragment;
    }

    /**
     * Read a fragment with its decisions and assumptions.
     */
    public Optional<Fragment> getFragment(String fragmentId) {
        String id = Identifiers.require(fragmentId, "fragment id");

        return transactionTemplate.execute(status -> {
            Optional<Fragment> found = findFragmentRow(id);
            return found.map(fragment -> withChildren(fragment)
                .withDecisions(jdbcTemplate.query(
                    "SELECT * FROM decisions WHERE fragment_id = ? ORDER BY created_at DESC, rowid DESC",
                    decisionRowMapper, id))
                .withAssumptions(jdbcTemplate.query(
                    "SELECT * FROM assumptions WHERE fragment_id = ? ORDER BY created_at DESC, rowid DESC",
                    assumptionRowMapper, id)));
        });
    }

    public boolean fragmentExists(String fragmentId) {
        String id = Identifiers.require(fragmentId, "fragment id");
        return exists("fragments", id);
    }

    /**
     * List fragments, most recently captured first.
     */
    public List<Fragment> listFragments(FragmentFilter filter) {
        requirePositiveLimit(filter.getLimit());
        if (filter.getOffset() < 0) {
            throw new ValidationException("Offset must not be negative: " + filter.getOffset());
        }

        StringBuilder sql = new StringBuilder("SELECT * FROM fragments WHERE 1=1");
        List<Object> params = new ArrayList<>();

        if (filter.getProject() != null) {
            sql.append(" AND project = ?");
            params.add(filter.getProject());
        }
        if (filter.getSourceKind() != null) {
            sql.append(" AND source_kind = ?");
            params.add(filter.getSourceKind().getValue());
        }
        if (filter.getSince() != null) {
            sql.append(" AND captured_at >= ?");
            params.add(filter.getSince().toEpochMilli());
        }
        if (filter.getUntil() != null) {
            sql.append(" AND captured_at <= ?");
            params.add(filter.getUntil().toEpochMilli());
        }

        sql.append(" ORDER BY captured_at DESC, rowid DESC LIMIT ? OFFSET ?");
        params.add(filter.getLimit());
        params.add(filter.getOffset());

        return transactionTemplate.execute(status ->
            jdbcTemplate.query(sql.toString(), fragmentRowMapper, params.toArray()).stream()
                .map(this::withChildren)
                .toList());
    }

    /**
     * Apply metadata changes. Raw content and source fields never change after capture.
     *
     * @throws NotFoundException if the fragment does not exist
     */
    public Fragment updateFragment(String fragmentId, FragmentUpdate update) {
        String id = Identifiers.require(fragmentId, "fragment id");

        return transactionTemplate.execute(status -> {
            if (!exists("fragments", id)) {
                throw new NotFoundException("Fragment", id);
            }

            if (update.getSummary() != null) {
                jdbcTemplate.update("UPDATE fragments SET summary = ? WHERE id = ?",
                    blankToNull(update.getSummary()), id);
            }
            if (update.getProject() != null) {
                jdbcTemplate.update("UPDATE fragments SET project = ? WHERE id = ?",
                    blankToNull(update.getProject()), id);
            }
            if (update.getTopics() != null) {
                jdbcTemplate.update("DELETE FROM fragment_topics WHERE fragment_id = ?", id);
                insertValues("fragment_topics", "topic", id, normalizeValues(update.getTopics()));
            }
            if (update.getParticipants() != null) {
                jdbcTemplate.update("DELETE FROM fragment_participants WHERE fragment_id = ?", id);
                insertValues("fragment_participants", "name", id, normalizeValues(update.getParticipants()));
            }

            log.debug("Updated fragment {}", id);
            return findFragmentRow(id).map(this::withChildren).orElseThrow(() -> new NotFoundException("Fragment", id));
        });
    }

    /**
     * Delete a fragment together with its decisions, assumptions and every link touching it.
     * Assumptions it invalidated keep their INVALID state but lose the reference.
     *
     * @return whether the fragment existed
     */
    public boolean deleteFragment(String fragmentId) {
        String id = Identifiers.require(fragmentId, "fragment id");

        Boolean deleted = transactionTemplate.execute(status -> {
            int decisions = jdbcTemplate.update("DELETE FROM decisions WHERE fragment_id = ?", id);
            int assumptions = jdbcTemplate.update("DELETE FROM assumptions WHERE fragment_id = ?", id);
            jdbcTemplate.update("UPDATE assumptions SET invalidated_by = NULL WHERE invalidated_by = ?", id);
            int links = jdbcTemplate.update("DELETE FROM fragment_links WHERE source_id = ? OR target_id = ?", id, id);
            jdbcTemplate.update("DELETE FROM fragment_participants WHERE fragment_id = ?", id);
            jdbcTemplate.update("DELETE FROM fragment_topics WHERE fragment_id = ?", id);
            int rows = jdbcTemplate.update("DELETE FROM fragments WHERE id = ?", id);

            if (rows > 0) {
                log.debug("Deleted fragment {} with {} decisions, {} assumptions, {} links",
                    id, decisions, assumptions, links);
            }
            return rows > 0;
        });
        return Boolean.TRUE.equals(deleted);
    }

    // ============== Decisions ==============

    public Decision createDecision(Decision draft) {
        String fragmentId = Identifiers.require(draft.getFragmentId(), "fragment id");
        requireUnitInterval(draft.getConfidence(), "Confidence");

        Decision decision = Decision.builder()
            .id(Identifiers.newId())
            .fragmentId(fragmentId)
            .what(draft.getWhat() != null ? draft.getWhat() : "")
            .why(draft.getWhy() != null ? draft.getWhy() : "")
            .confidence(draft.getConfidence())
            .createdAt(now())
            .build();

        transactionTemplate.executeWithoutResult(status -> {
            if (!exists("fragments", fragmentId)) {
                throw new NotFoundException("Fragment", fragmentId);
            }
            jdbcTemplate.update(
                "INSERT INTO decisions (id, fragment_id, what, why, confidence, created_at) VALUES (?, ?, ?, ?, ?, ?)",
                decision.getId(), fragmentId, decision.getWhat(), decision.getWhy(),
                decision.getConfidence(), decision.getCreatedAt().toEpochMilli()
            );
        });

        return decision;
    }

    /**
     * List decisions, most recent first.
     */
    public List<Decision> listDecisions(RecordFilter filter) {
        requirePositiveLimit(filter.getLimit());

        StringBuilder sql = new StringBuilder(
            "SELECT d.* FROM decisions d JOIN fragments f ON d.fragment_id = f.id WHERE 1=1");
        List<Object> params = appendRecordFilter(sql, filter, "d");
        sql.append(" ORDER BY d.created_at DESC, d.rowid DESC LIMIT ?");
        params.add(filter.getLimit());

        return jdbcTemplate.query(sql.toString(), decisionRowMapper, params.toArray());
    }

    // ============== Assumptions ==============

    /**
     * Persist a new assumption. Validity always starts UNKNOWN.
     */
    public Assumption createAssumption(Assumption draft) {
        String fragmentId = Identifiers.require(draft.getFragmentId(), "fragment id");
        if (draft.getStatement() == null || draft.getStatement().isBlank()) {
            throw new ValidationException("Assumption statement must not be empty");
        }

        Assumption assumption = Assumption.builder()
            .id(Identifiers.newId())
            .fragmentId(fragmentId)
            .statement(draft.getStatement())
            .explicit(draft.isExplicit())
            .validity(AssumptionValidity.UNKNOWN)
            .createdAt(now())
            .build();

        transactionTemplate.executeWithoutResult(status -> {
            if (!exists("fragments", fragmentId)) {
                throw new NotFoundException("Fragment", fragmentId);
            }
            jdbcTemplate.update(
                "INSERT INTO assumptions (id, fragment_id, statement, explicit, validity, invalidated_by, created_at) " +
                "VALUES (?, ?, ?, ?, ?, NULL, ?)",
                assumption.getId(), fragmentId, assumption.getStatement(),
                assumption.isExplicit() ? 1 : 0, assumption.getValidity().getValue(),
                assumption.getCreatedAt().toEpochMilli()
            );
        });

        return assumption;
    }

    public Optional<Assumption> getAssumption(String assumptionId) {
        String id = Identifiers.require(assumptionId, "assumption id");
        return jdbcTemplate.query("SELECT * FROM assumptions WHERE id = ?", assumptionRowMapper, id)
            .stream().findFirst();
    }

    /**
     * List assumptions, most recent first.
     *
     * @param validity only return assumptions in this state, or all when null
     */
    public List<Assumption> listAssumptions(RecordFilter filter, AssumptionValidity validity) {
        requirePositiveLimit(filter.getLimit());

        StringBuilder sql = new StringBuilder(
            "SELECT a.* FROM assumptions a JOIN fragments f ON a.fragment_id = f.id WHERE 1=1");
        List<Object> params = appendRecordFilter(sql, filter, "a");
        if (validity != null) {
            sql.append(" AND a.validity = ?");
            params.add(validity.getValue());
        }
        sql.append(" ORDER BY a.created_at DESC, a.rowid DESC LIMIT ?");
        params.add(filter.getLimit());

        return jdbcTemplate.query(sql.toString(), assumptionRowMapper, params.toArray());
    }

    /**
     * Mark an assumption INVALID and record the fragment that invalidated it.
     * The invalidating fragment is checked in the same transaction as the update,
     * so it cannot be deleted in between. Lifecycle rules are enforced by the caller.
     *
     * @throws NotFoundException if the assumption or the invalidating fragment does not exist
     */
    public Assumption invalidateAssumption(String assumptionId, String invalidatingFragmentId) {
        String id = Identifiers.require(assumptionId, "assumption id");
        String invalidatedBy = Identifiers.require(invalidatingFragmentId, "invalidating fragment id");

        return transactionTemplate.execute(status -> {
            if (!exists("assumptions", id)) {
                throw new NotFoundException("Assumption", id);
            }
            if (!exists("fragments", invalidatedBy)) {
                throw new NotFoundException("Fragment", invalidatedBy);
            }

            jdbcTemplate.update(
                "UPDATE assumptions SET validity = ?, invalidated_by = ? WHERE id = ?",
                AssumptionValidity.INVALID.getValue(), invalidatedBy, id
            );

            log.debug("Assumption {} invalidated by fragment {}", id, invalidatedBy);
            return requireAssumption(id);
        });
    }

    /**
     * Set an assumption's validity without an invalidating fragment. Only VALID is
     * accepted here; INVALID goes through {@link #invalidateAssumption} and nothing
     * returns to UNKNOWN or leaves INVALID.
     *
     * @throws NotFoundException if the assumption does not exist
     * @throws ValidationException if the assumption is already INVALID
     */
    public Assumption updateAssumptionValidity(String assumptionId, AssumptionValidity validity) {
        String id = Identifiers.require(assumptionId, "assumption id");
        if (validity != AssumptionValidity.VALID) {
            throw new ValidationException("Validity can only be set directly to VALID, got " + validity);
        }

        return transactionTemplate.execute(status -> {
            int rows = jdbcTemplate.update(
                "UPDATE assumptions SET validity = ?, invalidated_by = NULL WHERE id = ? AND validity <> ?",
                validity.getValue(), id, AssumptionValidity.INVALID.getValue()
            );
            if (rows == 0) {
                Assumption current = requireAssumption(id);
                throw new ValidationException(String.format("Assumption %s is %s and cannot become %s",
                    id, current.getValidity(), validity));
            }
            return requireAssumption(id);
        });
    }

    /**
     * Take the write lock on an assumption row inside the caller's transaction, so a
     * following read-then-update cannot deadlock against another writer. SQLite only
     * upgrades a deferred read transaction to a writer when no one else holds the lock.
     *
     * @return whether the assumption exists
     */
    public boolean lockAssumption(String assumptionId) {
        String id = Identifiers.require(assumptionId, "assumption id");
        return jdbcTemplate.update("UPDATE assumptions SET validity = validity WHERE id = ?", id) > 0;
    }

    // ============== Links ==============

    /**
     * Create or refresh a link. Re-asserting an existing (source, target, kind) triple
     * overwrites its strength and keeps its id.
     *
     * @throws NotFoundException if either endpoint does not exist
     */
    public FragmentLink createLink(FragmentLink draft) {
        String sourceId = Identifiers.require(draft.getSourceId(), "source fragment id");
        String targetId = Identifiers.require(draft.getTargetId(), "target fragment id");
        if (draft.getKind() == null) {
            throw new ValidationException("Link kind must not be null");
        }
        if (sourceId.equals(targetId)) {
            throw new ValidationException("A fragment cannot be linked to itself: " + sourceId);
        }
        requireUnitInterval(draft.getStrength(), "Strength");

        return transactionTemplate.execute(status -> {
            if (!exists("fragments", sourceId)) {
                throw new NotFoundException("Fragment", sourceId);
            }
            if (!exists("fragments", targetId)) {
                throw new NotFoundException("Fragment", targetId);
            }

            jdbcTemplate.update(
                "INSERT INTO fragment_links (id, source_id, target_id, kind, strength, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT (source_id, target_id, kind) DO UPDATE SET strength = excluded.strength",
                Identifiers.newId(), sourceId, targetId, draft.getKind().getValue(),
                draft.getStrength(), now().toEpochMilli()
            );

            return findLinkRow(sourceId, targetId, draft.getKind())
                .orElseThrow(() -> new IllegalStateException("Link vanished after upsert"));
        });
    }

    public Optional<FragmentLink> findLink(String sourceId, String targetId, LinkKind kind) {
        return findLinkRow(
            Identifiers.require(sourceId, "source fragment id"),
            Identifiers.require(targetId, "target fragment id"),
            kind
        );
    }

    /**
     * List links, most recent first.
     *
     * @param kind only links of this kind, or all when null
     */
    public List<FragmentLink> listLinks(LinkKind kind, int limit) {
        requirePositiveLimit(limit);
        if (kind != null) {
            return jdbcTemplate.query(
                "SELECT * FROM fragment_links WHERE kind = ? ORDER BY created_at DESC, rowid DESC LIMIT ?",
                linkRowMapper, kind.getValue(), limit);
        }
        return jdbcTemplate.query(
            "SELECT * FROM fragment_links ORDER BY created_at DESC, rowid DESC LIMIT ?",
            linkRowMapper, limit);
    }

    public List<RelatedFragment> getRelatedFragments(String fragmentId, LinkKind kind) {
        return getRelatedFragments(fragmentId, kind, DEFAULT_RELATED_LIMIT);
    }

    /**
     * Fragments connected to the given one in either direction, strongest edge first.
     *
     * @param kind restrict to one link kind, or all when null
     * @param limit maximum number of related fragments
     * @throws NotFoundException if the fragment does not exist
     */
    public List<RelatedFragment> getRelatedFragments(String fragmentId, LinkKind kind, int limit) {
        String id = Identifiers.require(fragmentId, "fragment id");
        requirePositiveLimit(limit);

        StringBuilder sql = new StringBuilder("""
            SELECT f.*, l.strength AS link_strength, l.kind AS link_kind, l.source_id AS link_source
            FROM fragment_links l
            JOIN fragments f ON f.id = CASE WHEN l.source_id = ? THEN l.target_id ELSE l.source_id END
            WHERE (l.source_id = ? OR l.target_id = ?)
            """);
        List<Object> params = new ArrayList<>(List.of(id, id, id));
        if (kind != null) {
            sql.append(" AND l.kind = ?");
            params.add(kind.getValue());
        }
        sql.append(" ORDER BY l.strength DESC, f.captured_at DESC LIMIT ?");
        params.add(limit);

        return transactionTemplate.execute(status -> {
            if (!exists("fragments", id)) {
                throw new NotFoundException("Fragment", id);
            }
            return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> new RelatedFragment(
                    fragmentRowMapper.mapRow(rs, rowNum),
                    rs.getDouble("link_strength"),
                    LinkKind.fromValue(rs.getString("link_kind")),
                    id.equals(rs.getString("link_source"))
                        ? RelatedFragment.Direction.OUTGOING
                        : RelatedFragment.Direction.INCOMING
                ), params.toArray()).stream()
                .map(related -> new RelatedFragment(
                    withChildren(related.getFragment()),
                    related.getStrength(),
                    related.getKind(),
                    related.getDirection()))
                .toList();
        });
    }

    // ============== Helpers ==============

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private boolean exists(String table, String id) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + table + " WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    private Optional<Fragment> findFragmentRow(String id) {
        return jdbcTemplate.query("SELECT * FROM fragments WHERE id = ?", fragmentRowMapper, id)
            .stream().findFirst();
    }

    private Optional<FragmentLink> findLinkRow(String sourceId, String targetId, LinkKind kind) {
        return jdbcTemplate.query(
            "SELECT * FROM fragment_links WHERE source_id = ? AND target_id = ? AND kind = ?",
            linkRowMapper, sourceId, targetId, kind.getValue()
        ).stream().findFirst();
    }

    private Assumption requireAssumption(String id) {
        return jdbcTemplate.query("SELECT * FROM assumptions WHERE id = ?", assumptionRowMapper, id)
            .stream().findFirst()
            .orElseThrow(() -> new NotFoundException("Assumption", id));
    }

    private Fragment withChildren(Fragment fragment) {
        return fragment
            .withParticipants(loadValues("fragment_participants", "name", fragment.getId()))
            .withTopics(loadValues("fragment_topics", "topic", fragment.getId()));
    }

    private Set<String> loadValues(String table, String column, String fragmentId) {
        List<String> values = jdbcTemplate.queryForList(
            "SELECT " + column + " FROM " + table + " WHERE fragment_id = ? ORDER BY " + column,
            String.class, fragmentId);
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    private void insertValues(String table, String column, String fragmentId, Set<String> values) {
        for (String value : values) {
            jdbcTemplate.update(
                "INSERT OR IGNORE INTO " + table + " (fragment_id, " + column + ") VALUES (?, ?)",
                fragmentId, value);
        }
    }

    private List<Object> appendRecordFilter(StringBuilder sql, RecordFilter filter, String alias) {
        List<Object> params = new ArrayList<>();
        if (filter.getFragmentId() != null) {
            sql.append(" AND ").append(alias).append(".fragment_id = ?");
            params.add(Identifiers.require(filter.getFragmentId(), "fragment id"));
        }
        if (filter.getProject() != null) {
            sql.append(" AND f.project = ?");
            params.add(filter.getProject());
        }
        if (filter.getSince() != null) {
            sql.append(" AND ").append(alias).append(".created_at >= ?");
            params.add(filter.getSince().toEpochMilli());
        }
        if (filter.getUntil() != null) {
            sql.append(" AND ").append(alias).append(".created_at <= ?");
            params.add(filter.getUntil().toEpochMilli());
        }
        return params;
    }

    /**
     * Trim, drop blanks and duplicates. Order carries no meaning, so values are kept sorted.
     */
    static Set<String> normalizeValues(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        TreeSet<String> normalized = new TreeSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                normalized.add(value.trim());
            }
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(normalized));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static void requireUnitInterval(double value, String what) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(what + " must be between 0.0 and 1.0, got " + value);
        }
    }

    private static void requirePositiveLimit(int limit) {
        if (limit <= 0) {
            throw new ValidationException("Limit must be positive: " + limit);
        }
    }

    private static Instant instantOrNull(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    /**
     * Maps the fragments columns only; participants and topics come from their own tables.
     */
    private static class FragmentRowMapper implements RowMapper<Fragment> {
        @Override
        public Fragment mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Fragment.builder()
                .id(rs.getString("id"))
                .rawContent(rs.getString("raw_content"))
                .summary(rs.getString("summary"))
                .sourceKind(SourceKind.fromValue(rs.getString("source_kind")))
                .sourceRef(rs.getString("source_ref"))
                .capturedAt(instantOrNull(rs, "captured_at"))
                .project(rs.getString("project"))
                .createdAt(instantOrNull(rs, "created_at"))
                .build();
        }
    }

    private static class DecisionRowMapper implements RowMapper<Decision> {
        @Override
        public Decision mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Decision.builder()
                .id(rs.getString("id"))
                .fragmentId(rs.getString("fragment_id"))
                .what(rs.getString("what"))
                .why(rs.getString("why"))
                .confidence(rs.getDouble("confidence"))
                .createdAt(instantOrNull(rs, "created_at"))
                .build();
        }
    }

    private static class AssumptionRowMapper implements RowMapper<Assumption> {
        @Override
        public Assumption mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Assumption.builder()
                .id(rs.getString("id"))
                .fragmentId(rs.getString("fragment_id"))
                .statement(rs.getString("statement"))
                .explicit(rs.getInt("explicit") != 0)
                .validity(AssumptionValidity.fromValue(rs.getString("validity")))
                .invalidatedBy(rs.getString("invalidated_by"))
                .createdAt(instantOrNull(rs, "created_at"))
                .build();
        }
    }

    private static class LinkRowMapper implements RowMapper<FragmentLink> {
        @Override
        public FragmentLink mapRow(ResultSet rs, int rowNum) throws SQLException {
            return FragmentLink.builder()
                .id(rs.getString("id"))
                .sourceId(rs.getString("source_id"))
                .targetId(rs.getString("target_id"))
                .kind(LinkKind.fromValue(rs.getString("kind")))
                .strength(rs.getDouble("strength"))
                .createdAt(instantOrNull(rs, "created_at"))
                .build();
        }
    }
}
