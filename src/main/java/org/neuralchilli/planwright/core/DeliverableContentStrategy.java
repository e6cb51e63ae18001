package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.Confidence;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.domain.WorkStatus;

import java.util.Optional;

/**
 * Inspects an existing deliverable's content: unresolved-work markers or too
 * little substance mean IN_PROGRESS, anything else COMPLETED.
 */
public class DeliverableContentStrategy implements InferenceStrategy {

    private final ContentThresholds thresholds;

    public DeliverableContentStrategy(ContentThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public Optional<Inference> infer(WorkItem item, DeliverableProbe probe) {
        if (probe.presence() != DeliverableProbe.Presence.FILE) {
            return Optional.empty();
        }

        String content = probe.content() != null ? probe.content() : "";
        for (String marker : thresholds.unresolvedMarkers()) {
            if (content.contains(marker)) {
                return Optional.of(new Inference(WorkStatus.IN_PROGRESS, Confidence.MEDIUM,
                        "deliverable contains unresolved marker '" + marker + "'"));
            }
        }

        int length = content.trim().length();
        if (length < thresholds.minLength()) {
            return Optional.of(new Inference(WorkStatus.IN_PROGRESS, Confidence.MEDIUM,
                    "deliverable has " + length + " characters, below " + thresholds.minLength()));
        }
        return Optional.of(new Inference(WorkStatus.COMPLETED, Confidence.MEDIUM,
                "deliverable content looks complete"));
    }
}
