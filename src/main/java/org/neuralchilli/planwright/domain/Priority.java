package org.neuralchilli.planwright.domain;

import java.util.Locale;

/**
 * Priority of a work item. Declaration order is scheduling order.
 */
public enum Priority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Check if this priority is at least as urgent as the given one.
     */
    public boolean isAtLeast(Priority minimum) {
        return minimum == null || this.ordinal() <= minimum.ordinal();
    }

    /**
     * Parse a priority, falling back to LOW when absent.
     */
    public static Priority fromString(String value) {
        if (value == null || value.isBlank()) {
            return LOW;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown priority: " + value, e);
        }
    }
}
