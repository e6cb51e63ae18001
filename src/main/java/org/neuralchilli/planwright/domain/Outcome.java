package org.neuralchilli.planwright.domain;

import java.time.Duration;

/**
 * Result of dispatching one item. {@code revision} is the store revision that
 * recorded the outcome, or null if nothing was recorded.
 */
public record Outcome(
        ItemRef ref,
        OutcomeKind kind,
        String message,
        Long revision,
        Duration duration
) {
    public Outcome {
        if (ref == null || kind == null) {
            throw new IllegalArgumentException("Outcome needs a reference and a kind");
        }
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static Outcome notDispatched(ItemRef ref) {
        return new Outcome(ref, OutcomeKind.NOT_DISPATCHED, "Dispatch cancelled before submission", null, Duration.ZERO);
    }

    public boolean isRecorded() {
        return revision != null;
    }
}
