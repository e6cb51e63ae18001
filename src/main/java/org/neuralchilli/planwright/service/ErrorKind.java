package org.neuralchilli.planwright.service;

/**
 * Failure taxonomy surfaced to callers.
 */
public enum ErrorKind {
    /**
     * Dependency cycle at graph construction (fatal)
     */
    CYCLE(false),

    /**
     * Definitions reference unknown or duplicate identifiers (fatal)
     */
    VALIDATION(false),

    /**
     * Store lock could not be acquired in time
     */
    LOCK_TIMEOUT(true),

    /**
     * Caller's view of the record is stale; re-read and retry
     */
    STATUS_CONFLICT(true),

    PLAN_NOT_FOUND(false),

    ITEM_NOT_FOUND(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
