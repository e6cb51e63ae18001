package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.Confidence;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.domain.WorkStatus;

import java.util.Optional;

/**
 * Explicit completion-criteria markers. All satisfied means COMPLETED, some
 * means IN_PROGRESS. With none satisfied an item already recorded as started
 * stays IN_PROGRESS; this signal alone never sends it back to NOT_STARTED.
 */
public class CompletionCriteriaStrategy implements InferenceStrategy {

    @Override
    public Optional<Inference> infer(WorkItem item, DeliverableProbe probe) {
        if (probe.presence() != DeliverableProbe.Presence.FILE || !probe.hasCriteria()) {
            return Optional.empty();
        }

        int total = probe.criteriaTotal();
        int satisfied = probe.criteriaSatisfied();
        String tally = satisfied + "/" + total + " completion criteria satisfied";

        if (satisfied == total) {
            return Optional.of(new Inference(WorkStatus.COMPLETED, Confidence.HIGH, tally));
        }
        if (satisfied > 0 || item.status().isStarted()) {
            return Optional.of(new Inference(WorkStatus.IN_PROGRESS, Confidence.HIGH, tally));
        }
        return Optional.of(new Inference(WorkStatus.NOT_STARTED, Confidence.HIGH, tally));
    }
}
