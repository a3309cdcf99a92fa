package com.dcruver.provenance.lifecycle;

import com.dcruver.provenance.domain.Assumption;
import com.dcruver.provenance.domain.AssumptionValidity;
import com.dcruver.provenance.domain.Identifiers;
import com.dcruver.provenance.error.NotFoundException;
import com.dcruver.provenance.error.ProviderConnectionException;
import com.dcruver.provenance.error.ValidationException;
import com.dcruver.provenance.storage.FragmentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;

/**
 * Validity state machine for assumptions.
 *
 * <pre>
 * UNKNOWN --validate--> VALID
 * UNKNOWN --invalidate(fragment)--> INVALID
 * VALID   --invalidate(fragment)--> INVALID
 * </pre>
 *
 * INVALID is terminal. Re-validating a VALID assumption, or re-invalidating with the
 * same fragment, returns it unchanged so retries are harmless. The state read, the
 * rule check and the update share one transaction, which takes the row's write lock
 * before reading so concurrent transitions on one assumption run one after the other.
 * If the store stays locked past its busy timeout the transition fails with a
 * {@link ProviderConnectionException} and can be retried.
 */
@Service
@Slf4j
public class AssumptionLifecycle {

    // SQLITE_BUSY and SQLITE_LOCKED primary result codes
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final FragmentStore fragmentStore;
    private final TransactionTemplate transactionTemplate;

    public AssumptionLifecycle(FragmentStore fragmentStore, PlatformTransactionManager transactionManager) {
        this.fragmentStore = fragmentStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @throws NotFoundException if the assumption does not exist
     * @throws ValidationException if the assumption is already INVALID
     */
    public Assumption markValid(String assumptionId) {
        String id = Identifiers.require(assumptionId, "assumption id");

        return inLockedTransaction(status -> {
            Assumption current = lockAndRead(id);

            if (current.getValidity() == AssumptionValidity.VALID) {
                return current;
            }
            requireTransition(current, AssumptionValidity.VALID);

            Assumption updated = fragmentStore.updateAssumptionValidity(id, AssumptionValidity.VALID);
            log.info("Assumption {} marked valid", id);
            return updated;
        });
    }

    /**
     * Mark an assumption INVALID because of a newer fragment.
     *
     * @throws NotFoundException if the assumption or the invalidating fragment does not exist
     * @throws ValidationException if the assumption was already invalidated by another fragment
     */
    public Assumption invalidate(String assumptionId, String invalidatingFragmentId) {
        String id = Identifiers.require(assumptionId, "assumption id");
        String invalidatedBy = Identifiers.require(invalidatingFragmentId, "invalidating fragment id");

        return inLockedTransaction(status -> {
            Assumption current = lockAndRead(id);

            if (current.getValidity() == AssumptionValidity.INVALID
                && invalidatedBy.equals(current.getInvalidatedBy())) {
                return current;
            }
            requireTransition(current, AssumptionValidity.INVALID);

            Assumption updated = fragmentStore.invalidateAssumption(id, invalidatedBy);
            log.info("Assumption {} invalidated by fragment {}", id, invalidatedBy);
            return updated;
        });
    }

    private Assumption inLockedTransaction(TransactionCallback<Assumption> work) {
        try {
            return transactionTemplate.execute(work);
        } catch (DataAccessException e) {
            if (isLockContention(e)) {
                throw new ProviderConnectionException("relational store", "assumption is locked by another writer", e);
            }
            throw e;
        }
    }

    private static boolean isLockContention(DataAccessException e) {
        if (e instanceof PessimisticLockingFailureException) {
            return true;
        }
        Throwable cause = e.getCause();
        if (cause instanceof SQLException) {
            int code = ((SQLException) cause).getErrorCode() & 0xff;
            return code == SQLITE_BUSY || code == SQLITE_LOCKED;
        }
        return false;
    }

    private Assumption lockAndRead(String id) {
        if (!fragmentStore.lockAssumption(id)) {
            throw new NotFoundException("Assumption", id);
        }
        return fragmentStore.getAssumption(id)
            .orElseThrow(() -> new NotFoundException("Assumption", id));
    }

    private static void requireTransition(Assumption current, AssumptionValidity target) {
        if (!current.getValidity().canTransitionTo(target)) {
            throw new ValidationException(String.format("Assumption %s cannot move from %s to %s",
                current.getId(), current.getValidity(), target));
        }
    }
}
