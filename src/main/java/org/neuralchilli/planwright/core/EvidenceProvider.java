package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.domain.WorkItem;

/**
 * Source of externally observable evidence about a work item's deliverable.
 */
@FunctionalInterface
public interface EvidenceProvider {

    /**
     * Observe the deliverable of {@code item}. Only called for items that declare one.
     */
    DeliverableProbe probe(ItemRef ref, WorkItem item);
}
