package com.dcruver.provenance.lifecycle;

import com.dcruver.provenance.app.DataSourceConfig;
import com.dcruver.provenance.domain.Assumption;
import com.dcruver.provenance.domain.AssumptionValidity;
import com.dcruver.provenance.domain.Fragment;
import com.dcruver.provenance.domain.Identifiers;
import com.dcruver.provenance.error.NotFoundException;
import com.dcruver.provenance.error.ProviderConnectionException;
import com.dcruver.provenance.error.ValidationException;
import com.dcruver.provenance.storage.FragmentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AssumptionLifecycleTest {

    @TempDir
    Path tempDir;

    private FragmentStore store;
    private AssumptionLifecycle lifecycle;
    private Fragment original;
    private Fragment later;

    @BeforeEach
    void setUp() throws Exception {
        DataSource dataSource = DataSourceConfig.sqliteDataSource(tempDir.resolve("provenance.db"));
        DataSourceTransactionManager transactionManager = new DataSourceTransactionManager(dataSource);
        store = new FragmentStore(dataSource, transactionManager);
        store.init();
        lifecycle = new AssumptionLifecycle(store, transactionManager);

        original = store.createFragment(Fragment.builder().rawContent("We assume the budget is fixed").build());
        later = store.createFragment(Fragment.builder().rawContent("Budget was cut by 20%").build());
    }

    @Test
    void testUnknownToValidToInvalid() {
        Assumption assumption = newAssumption();

        Assumption valid = lifecycle.markValid(assumption.getId());
        assertEquals(AssumptionValidity.VALID, valid.getValidity());

        Assumption invalid = lifecycle.invalidate(assumption.getId(), later.getId());
        assertEquals(AssumptionValidity.INVALID, invalid.getValidity());
        assertEquals(later.getId(), invalid.getInvalidatedBy());
    }

    @Test
    void testUnknownToInvalid() {
        Assumption invalid = lifecycle.invalidate(newAssumption().getId(), later.getId());
        assertEquals(AssumptionValidity.INVALID, invalid.getValidity());
    }

    @Test
    void testInvalidIsTerminal() {
        Assumption assumption = newAssumption();
        lifecycle.invalidate(assumption.getId(), later.getId());

        assertThrows(ValidationException.class, () -> lifecycle.markValid(assumption.getId()));
        assertThrows(ValidationException.class, () -> lifecycle.invalidate(assumption.getId(), original.getId()));
    }

    @Test
    void testRepeatedCallsAreNoOps() {
        Assumption assumption = newAssumption();

        lifecycle.markValid(assumption.getId());
        assertEquals(AssumptionValidity.VALID, lifecycle.markValid(assumption.getId()).getValidity());

        lifecycle.invalidate(assumption.getId(), later.getId());
        Assumption again = lifecycle.invalidate(assumption.getId(), later.getId());
        assertEquals(AssumptionValidity.INVALID, again.getValidity());
        assertEquals(later.getId(), again.getInvalidatedBy());
    }

    @Test
    void testMissingRecordsRaiseNotFound() {
        Assumption assumption = newAssumption();

        assertThrows(NotFoundException.class, () -> lifecycle.markValid(Identifiers.newId()));
        assertThrows(NotFoundException.class, () -> lifecycle.invalidate(Identifiers.newId(), later.getId()));
        assertThrows(NotFoundException.class, () -> lifecycle.invalidate(assumption.getId(), Identifiers.newId()));
        assertEquals(AssumptionValidity.UNKNOWN, store.getAssumption(assumption.getId()).orElseThrow().getValidity());
    }

    @Test
    void testConcurrentMarkValidCallsAllSucceed() throws Exception {
        Assumption assumption = newAssumption();
        int callers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Assumption>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return lifecycle.markValid(assumption.getId());
                }));
            }
            start.countDown();

            for (Future<Assumption> result : results) {
                assertEquals(AssumptionValidity.VALID, result.get(30, TimeUnit.SECONDS).getValidity());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(AssumptionValidity.VALID, store.getAssumption(assumption.getId()).orElseThrow().getValidity());
    }

    @Test
    void testConcurrentValidateAndInvalidateEndInvalid() throws Exception {
        Assumption assumption = newAssumption();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Assumption> validate = executor.submit(() -> {
                start.await();
                return lifecycle.markValid(assumption.getId());
            });
            Future<Assumption> invalidate = executor.submit(() -> {
                start.await();
                return lifecycle.invalidate(assumption.getId(), later.getId());
            });
            start.countDown();

            assertEquals(AssumptionValidity.INVALID, invalidate.get(30, TimeUnit.SECONDS).getValidity());
            try {
                assertEquals(AssumptionValidity.VALID, validate.get(30, TimeUnit.SECONDS).getValidity());
            } catch (ExecutionException e) {
                // Lost the race: the assumption was already INVALID when validation ran
                assertInstanceOf(ValidationException.class, e.getCause());
            }
        } finally {
            executor.shutdownNow();
        }

        Assumption after = store.getAssumption(assumption.getId()).orElseThrow();
        assertEquals(AssumptionValidity.INVALID, after.getValidity());
        assertEquals(later.getId(), after.getInvalidatedBy());
    }

    @Test
    void testLockedStoreRaisesConnectionError() throws Exception {
        Assumption assumption = newAssumption();
        DriverManagerDataSource impatient = new DriverManagerDataSource(
            "jdbc:sqlite:" + tempDir.resolve("provenance.db").toAbsolutePath() + "?foreign_keys=true&busy_timeout=100");
        DataSourceTransactionManager transactionManager = new DataSourceTransactionManager(impatient);
        AssumptionLifecycle impatientLifecycle = new AssumptionLifecycle(
            new FragmentStore(impatient, transactionManager), transactionManager);

        try (Connection holder = impatient.getConnection()) {
            holder.setAutoCommit(false);
            try (Statement statement = holder.createStatement()) {
                statement.executeUpdate("UPDATE assumptions SET validity = validity");
            }

            ProviderConnectionException e = assertThrows(ProviderConnectionException.class,
                () -> impatientLifecycle.markValid(assumption.getId()));
            assertEquals("relational store", e.getProvider());

            holder.rollback();
        }
        assertEquals(AssumptionValidity.UNKNOWN, store.getAssumption(assumption.getId()).orElseThrow().getValidity());
    }

    @Test
    void testTransitionTable() {
        assertTrue(AssumptionValidity.UNKNOWN.canTransitionTo(AssumptionValidity.VALID));
        assertTrue(AssumptionValidity.UNKNOWN.canTransitionTo(AssumptionValidity.INVALID));
        assertTrue(AssumptionValidity.VALID.canTransitionTo(AssumptionValidity.INVALID));
        assertFalse(AssumptionValidity.VALID.canTransitionTo(AssumptionValidity.UNKNOWN));
        assertFalse(AssumptionValidity.INVALID.canTransitionTo(AssumptionValidity.VALID));
        assertFalse(AssumptionValidity.INVALID.canTransitionTo(AssumptionValidity.UNKNOWN));
    }

    private Assumption newAssumption() {
        return store.createAssumption(Assumption.builder()
            .fragmentId(original.getId())
            .statement("Budget is fixed for the quarter")
            .build());
    }
}
