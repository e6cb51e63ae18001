package org.neuralchilli.planwright.domain;

/**
 * Lifecycle status of a work item.
 */
public enum WorkStatus {
    /**
     * Not yet picked up
     */
    NOT_STARTED,

    /**
     * Claimed by a dispatcher or partially evidenced
     */
    IN_PROGRESS,

    /**
     * Finished successfully
     */
    COMPLETED,

    /**
     * Cannot proceed because an upstream item failed or is blocked
     */
    BLOCKED,

    /**
     * Worker reported a failure (not retried automatically)
     */
    FAILED;

    /**
     * Check if this status stops dependents from ever becoming executable
     * without intervention.
     */
    public boolean isBlocking() {
        return this == BLOCKED || this == FAILED;
    }

    /**
     * Check if the item has been started in any way.
     */
    public boolean isStarted() {
        return this != NOT_STARTED;
    }
}
