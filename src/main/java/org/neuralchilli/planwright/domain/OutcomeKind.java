package org.neuralchilli.planwright.domain;

import java.util.Locale;

/**
 * Outcome of dispatching one item, as reported back to the status store.
 */
public enum OutcomeKind {
    COMPLETED(WorkStatus.COMPLETED),
    FAILED(WorkStatus.FAILED),
    INCOMPLETE(WorkStatus.IN_PROGRESS),
    NOT_DISPATCHED(null);

    private final WorkStatus recordedStatus;

    OutcomeKind(WorkStatus recordedStatus) {
        this.recordedStatus = recordedStatus;
    }

    /**
     * Status written to the store, or null when nothing is written.
     */
    public WorkStatus recordedStatus() {
        return recordedStatus;
    }

    public static OutcomeKind from(WorkResult.Kind kind) {
        return switch (kind) {
            case SUCCESS -> COMPLETED;
            case FAILURE -> FAILED;
            case INCOMPLETE -> INCOMPLETE;
        };
    }

    public static OutcomeKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Outcome cannot be empty");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
