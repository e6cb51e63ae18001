package org.neuralchilli.planwright.core;

import java.time.Duration;

/**
 * Lock acquisition timing.
 *
 * @param pollInterval fixed backoff between acquisition attempts
 * @param timeout      default bound for {@code tryUpdate}
 * @param staleness    age after which a held token is treated as abandoned;
 *                     must exceed the longest single update
 */
public record LockPolicy(
        Duration pollInterval,
        Duration timeout,
        Duration staleness
) {
    public LockPolicy {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout cannot be negative");
        }
        if (staleness == null || staleness.isNegative() || staleness.isZero()) {
            throw new IllegalArgumentException("Staleness threshold must be positive");
        }
    }

    public static LockPolicy defaults() {
        return new LockPolicy(Duration.ofMillis(50), Duration.ofSeconds(10), Duration.ofMinutes(2));
    }
}
