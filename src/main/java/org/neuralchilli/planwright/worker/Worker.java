package org.neuralchilli.planwright.worker;

import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.domain.WorkResult;

/**
 * External unit that carries out one work item. Workers share no state with
 * each other or with the scheduler; their result is recorded by the coordinator.
 */
@FunctionalInterface
public interface Worker {

    WorkResult execute(WorkItem item, ItemRef ref);
}
