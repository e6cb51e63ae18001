package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.StatusRecord;

import java.time.Duration;

/**
 * Durable, lock-guarded record of all plan, phase and item status.
 *
 * Successful updates are totally ordered: the record revision increases by
 * exactly one per commit. Readers never observe a partially written record.
 * An update whose mutator changes no status commits nothing and returns the
 * current record.
 */
public interface StatusStore {

    /**
     * Latest committed snapshot. Never blocks.
     */
    StatusRecord read();

    /**
     * Install definitions into an empty store. Fresh definitions (revision 0)
     * commit as revision 1; a previously persisted record continues from its
     * own revision. Seeding an already seeded store with the same shape
     * returns the current record unchanged.
     *
     * @throws IllegalStateException if the store holds a different shape
     */
    StatusRecord seed(StatusRecord definitions);

    /**
     * Apply {@code mutator} under the lock, waiting as long as it takes.
     */
    StatusRecord update(StatusMutator mutator);

    /**
     * Apply {@code mutator} only if the record is still at {@code expectedRevision}.
     *
     * @throws org.neuralchilli.planwright.service.StatusConflictException if it is not
     */
    StatusRecord update(long expectedRevision, StatusMutator mutator);

    /**
     * Like {@link #update(StatusMutator)} but gives up after {@code maxWait}.
     *
     * @throws org.neuralchilli.planwright.service.LockTimeoutException when the lock stays busy
     */
    StatusRecord tryUpdate(StatusMutator mutator, Duration maxWait);

    StatusRecord tryUpdate(long expectedRevision, StatusMutator mutator, Duration maxWait);

    /**
     * {@link #tryUpdate(StatusMutator, Duration)} with the configured lock timeout.
     */
    StatusRecord tryUpdate(StatusMutator mutator);
}
