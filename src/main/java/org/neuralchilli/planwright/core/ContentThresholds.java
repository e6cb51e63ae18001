package org.neuralchilli.planwright.core;

import java.util.List;

/**
 * When a deliverable still counts as a stub.
 *
 * @param minLength         trimmed content shorter than this is a stub
 * @param unresolvedMarkers any of these substrings marks unfinished work
 */
public record ContentThresholds(
        int minLength,
        List<String> unresolvedMarkers
) {

    public ContentThresholds {
        if (minLength < 0) {
            throw new IllegalArgumentException("Minimum length cannot be negative");
        }
        unresolvedMarkers = unresolvedMarkers != null
                ? unresolvedMarkers.stream().filter(m -> m != null && !m.isBlank()).toList()
                : List.of();
    }

    public static ContentThresholds defaults() {
        return new ContentThresholds(200, List.of("TODO", "TBD", "FIXME", "PLACEHOLDER"));
    }
}
