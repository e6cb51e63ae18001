package org.neuralchilli.planwright.domain;

/**
 * Why a NOT_STARTED item is not in the executable set.
 */
public enum BlockReason {
    /**
     * At least one dependency is not COMPLETED yet
     */
    WAITING_ON_DEPENDENCY,

    /**
     * A dependency is BLOCKED or FAILED; the item is reported as BLOCKED
     */
    DEPENDENCY_BLOCKED,

    /**
     * An earlier phase has not satisfied its gating rule
     */
    PHASE_GATED,

    /**
     * Another item of the same exclusivity group is running or already selected
     */
    EXCLUSIVITY_CONFLICT,

    /**
     * The executable set already reached the requested limit
     */
    CONCURRENCY_LIMIT;

    /**
     * The effective status to report for an item blocked for this reason.
     */
    public WorkStatus reportedStatus() {
        return this == DEPENDENCY_BLOCKED ? WorkStatus.BLOCKED : WorkStatus.NOT_STARTED;
    }
}
