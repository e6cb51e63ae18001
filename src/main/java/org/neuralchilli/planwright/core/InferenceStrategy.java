package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.WorkItem;

import java.util.Optional;

/**
 * One link in the status inference cascade. Strategies are consulted in
 * order and the first one that answers wins.
 */
public interface InferenceStrategy {

    /**
     * @return empty if this strategy has no signal for the item
     */
    Optional<Inference> infer(WorkItem item, DeliverableProbe probe);
}
