package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.StatusRecord;

/**
 * Pure function from the current snapshot to the proposed next snapshot.
 * May change item statuses only; revisions and timestamps are stamped by the store.
 */
@FunctionalInterface
public interface StatusMutator {

    StatusRecord apply(StatusRecord current);
}
