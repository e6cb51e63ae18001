package org.neuralchilli.planwright.service;

import java.util.Map;

/**
 * A mutation was based on a revision that is no longer current. Re-read and retry.
 */
public class StatusConflictException extends PlanwrightException {

    private final long expectedRevision;
    private final long actualRevision;

    public StatusConflictException(long expectedRevision, long actualRevision) {
        super(ErrorKind.STATUS_CONFLICT,
                "Status record changed: expected revision " + expectedRevision
                        + " but current is " + actualRevision,
                Map.of("expectedRevision", expectedRevision, "actualRevision", actualRevision));
        this.expectedRevision = expectedRevision;
        this.actualRevision = actualRevision;
    }

    public long expectedRevision() {
        return expectedRevision;
    }

    public long actualRevision() {
        return actualRevision;
    }
}
