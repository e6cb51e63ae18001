package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.StatusRecord;

import java.util.Optional;

/**
 * Storage for the latest committed status record.
 */
public interface SnapshotRepository {

    /**
     * Latest committed snapshot, or empty if nothing was ever committed.
     */
    Optional<StatusRecord> load(String name);

    /**
     * Replace the committed snapshot if its revision still equals
     * {@code expectedRevision} (0 when nothing is stored yet).
     * Only called while the store lock is held.
     *
     * @return false if another commit got there first
     */
    boolean commit(String name, long expectedRevision, StatusRecord next);
}
