package org.neuralchilli.planwright.domain;

import java.util.Map;

/**
 * What an external worker reported for one item.
 */
public record WorkResult(
        Kind kind,
        String message,
        Map<String, Object> data
) {

    public enum Kind {
        SUCCESS,
        FAILURE,
        INCOMPLETE
    }

    public WorkResult {
        if (kind == null) {
            throw new IllegalArgumentException("Result kind cannot be null");
        }
        data = data != null ? Map.copyOf(data) : Map.of();
    }

    public static WorkResult success(Map<String, Object> data) {
        return new WorkResult(Kind.SUCCESS, null, data);
    }

    public static WorkResult failure(String message) {
        return new WorkResult(Kind.FAILURE, message, Map.of());
    }

    public static WorkResult incomplete(String message) {
        return new WorkResult(Kind.INCOMPLETE, message, Map.of());
    }

    /**
     * Status to record for this result.
     */
    public WorkStatus toStatus() {
        return switch (kind) {
            case SUCCESS -> WorkStatus.COMPLETED;
            case FAILURE -> WorkStatus.FAILED;
            case INCOMPLETE -> WorkStatus.IN_PROGRESS;
        };
    }
}
