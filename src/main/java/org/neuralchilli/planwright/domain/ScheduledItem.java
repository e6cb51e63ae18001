package org.neuralchilli.planwright.domain;

/**
 * An executable item as handed to dispatch.
 */
public record ScheduledItem(
        ItemRef ref,
        Priority priority,
        boolean parallelizable
) {
}
