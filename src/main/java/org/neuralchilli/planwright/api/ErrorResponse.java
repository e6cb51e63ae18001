package org.neuralchilli.planwright.api;

import java.util.Map;

/**
 * Error body returned for every rejected request.
 *
 * @param kind    failure kind, e.g. CYCLE or LOCK_TIMEOUT
 * @param context what the caller needs to act: cycle path, revisions, candidates
 */
public record ErrorResponse(
        String kind,
        String message,
        boolean retryable,
        Map<String, Object> context
) {
    public ErrorResponse {
        context = context != null ? context : Map.of();
    }
}
