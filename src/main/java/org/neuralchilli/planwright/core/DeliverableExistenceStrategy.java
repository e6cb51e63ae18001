package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.Confidence;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.domain.WorkStatus;

import java.util.Optional;

/**
 * Last resort: existence alone. Present means IN_PROGRESS, never COMPLETED.
 */
public class DeliverableExistenceStrategy implements InferenceStrategy {

    @Override
    public Optional<Inference> infer(WorkItem item, DeliverableProbe probe) {
        return switch (probe.presence()) {
            case FILE, UNINSPECTABLE -> Optional.of(
                    new Inference(WorkStatus.IN_PROGRESS, Confidence.LOW, "deliverable exists"));
            case ABSENT -> Optional.of(
                    new Inference(WorkStatus.NOT_STARTED, Confidence.LOW, "deliverable does not exist"));
            case AMBIGUOUS -> Optional.empty();
        };
    }
}
