package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.StatusRecord;

/**
 * Notified after every successful commit, on the committing thread, while
 * the store lock is still held.
 */
@FunctionalInterface
public interface CommitListener {

    void onCommit(StatusRecord committed);
}
