package org.neuralchilli.planwright.service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The store lock could not be acquired within the allowed wait. Transient.
 */
public class LockTimeoutException extends PlanwrightException {

    private final String lockName;
    private final Duration waited;
    private final String holder;

    public LockTimeoutException(String lockName, Duration waited, String holder) {
        super(ErrorKind.LOCK_TIMEOUT,
                "Could not acquire lock '" + lockName + "' within " + waited.toMillis() + "ms"
                        + (holder != null ? " (held by " + holder + ")" : ""),
                context(lockName, waited, holder));
        this.lockName = lockName;
        this.waited = waited;
        this.holder = holder;
    }

    private static Map<String, Object> context(String lockName, Duration waited, String holder) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("lock", lockName);
        context.put("waitedMillis", waited.toMillis());
        if (holder != null) {
            context.put("holder", holder);
        }
        return context;
    }

    public String lockName() {
        return lockName;
    }

    public Duration waited() {
        return waited;
    }

    public String holder() {
        return holder;
    }
}
