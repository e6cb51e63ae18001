package org.neuralchilli.planwright.domain;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Named, time-stamped exclusive token guarding one read-modify-write cycle of
 * the status record. {@code reclaimedFrom} names the owner whose stale token
 * was replaced, or is null for a clean acquisition.
 */
public record LockToken(
        String name,
        String owner,
        Instant acquiredAt,
        String reclaimedFrom
) implements Serializable {

    public LockToken {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Lock name cannot be null or empty");
        }
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("Lock owner cannot be null or empty");
        }
        if (acquiredAt == null) {
            throw new IllegalArgumentException("Acquisition time cannot be null");
        }
    }

    public static LockToken acquire(String name, String owner, Instant now) {
        return new LockToken(name, owner, now, null);
    }

    public Duration age(Instant now) {
        return Duration.between(acquiredAt, now);
    }

    public boolean isStale(Instant now, Duration threshold) {
        return age(now).compareTo(threshold) > 0;
    }

    public boolean wasReclaimed() {
        return reclaimedFrom != null;
    }
}
