package org.neuralchilli.planwright.domain;

import java.util.EnumMap;
import java.util.Map;

/**
 * Counts of work items by status.
 */
public record StatusSummary(
        int total,
        Map<WorkStatus, Integer> byStatus
) {

    public StatusSummary {
        if (total < 0) {
            throw new IllegalArgumentException("Total cannot be negative");
        }
        EnumMap<WorkStatus, Integer> counts = new EnumMap<>(WorkStatus.class);
        for (WorkStatus status : WorkStatus.values()) {
            counts.put(status, 0);
        }
        if (byStatus != null) {
            counts.putAll(byStatus);
        }
        byStatus = Map.copyOf(counts);
    }

    public int count(WorkStatus status) {
        return byStatus.getOrDefault(status, 0);
    }

    public boolean allCompleted() {
        return total == count(WorkStatus.COMPLETED);
    }
}
