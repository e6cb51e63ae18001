package org.neuralchilli.planwright.service;

import java.util.Map;

/**
 * Base of every rejected operation. Carries the failure kind and enough
 * context for the caller to act without re-deriving state.
 */
public abstract class PlanwrightException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> context;

    protected PlanwrightException(ErrorKind kind, String message, Map<String, Object> context) {
        this(kind, message, context, null);
    }

    protected PlanwrightException(ErrorKind kind, String message, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.context = context != null ? Map.copyOf(context) : Map.of();
    }

    public ErrorKind kind() {
        return kind;
    }

    public Map<String, Object> context() {
        return context;
    }

    public boolean retryable() {
        return kind.isRetryable();
    }
}
