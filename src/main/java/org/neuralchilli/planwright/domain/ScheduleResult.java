package org.neuralchilli.planwright.domain;

import java.util.List;

/**
 * Output of one scheduling pass: executable items grouped by plan plus an
 * explanation for every in-scope NOT_STARTED item that was left out.
 */
public record ScheduleResult(
        long revision,
        List<PlanSchedule> plans,
        List<BlockedItem> blocked
) {
    public ScheduleResult {
        plans = plans != null ? List.copyOf(plans) : List.of();
        blocked = blocked != null ? List.copyOf(blocked) : List.of();
    }

    /**
     * Flattened executable items, preserving group and priority order.
     */
    public List<ScheduledItem> executable() {
        return plans.stream().flatMap(p -> p.items().stream()).toList();
    }

    public List<ItemRef> executableRefs() {
        return executable().stream().map(ScheduledItem::ref).toList();
    }

    public boolean isEmpty() {
        return plans.stream().allMatch(p -> p.items().isEmpty());
    }
}
