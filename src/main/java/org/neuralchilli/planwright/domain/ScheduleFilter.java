package org.neuralchilli.planwright.domain;

/**
 * Optional restrictions on the executable set. Null fields mean "no restriction";
 * {@code limit} of zero or less means unbounded.
 */
public record ScheduleFilter(
        String planId,
        Priority minimumPriority,
        int limit
) {
    public static ScheduleFilter none() {
        return new ScheduleFilter(null, null, 0);
    }

    public static ScheduleFilter forPlan(String planId) {
        return new ScheduleFilter(planId, null, 0);
    }

    public ScheduleFilter withLimit(int newLimit) {
        return new ScheduleFilter(planId, minimumPriority, newLimit);
    }

    public boolean isBounded() {
        return limit > 0;
    }

    public boolean includesPlan(String candidate) {
        return planId == null || planId.equals(candidate);
    }

    public boolean includesPriority(Priority priority) {
        return priority.isAtLeast(minimumPriority);
    }
}
