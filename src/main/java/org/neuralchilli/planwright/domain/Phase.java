package org.neuralchilli.planwright.domain;

import java.util.List;

/**
 * Ordered grouping of plans. {@code gatingRule} may be null, in which case the
 * configured default applies.
 */
public record Phase(
        String id,
        GatingRule gatingRule,
        List<String> planIds
) {

    public Phase {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Phase id cannot be null or empty");
        }
        planIds = planIds != null ? List.copyOf(planIds) : List.of();
    }

    public GatingRule effectiveRule(GatingRule defaultRule) {
        return gatingRule != null ? gatingRule : defaultRule;
    }
}
