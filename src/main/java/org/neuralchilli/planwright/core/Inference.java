package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.Confidence;
import org.neuralchilli.planwright.domain.WorkStatus;

/**
 * Status suggested by one inference strategy.
 */
public record Inference(
        WorkStatus status,
        Confidence confidence,
        String reason
) {
}
