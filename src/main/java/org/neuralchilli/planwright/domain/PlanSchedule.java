package org.neuralchilli.planwright.domain;

import java.util.List;

/**
 * Executable items of one plan, in dispatch order.
 */
public record PlanSchedule(
        String planId,
        String phaseId,
        List<ScheduledItem> items
) {
    public PlanSchedule {
        items = items != null ? List.copyOf(items) : List.of();
    }
}
