package org.neuralchilli.planwright.domain;

import java.util.Locale;

/**
 * Whether reconciliation only reports drift or also writes corrections.
 */
public enum ReconcileMode {
    REPORT,
    APPLY;

    public static ReconcileMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return REPORT;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
