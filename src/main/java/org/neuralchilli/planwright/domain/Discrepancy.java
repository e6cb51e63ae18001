package org.neuralchilli.planwright.domain;

import java.util.List;

/**
 * Difference between recorded status and observed evidence for one item.
 * {@code observed} and {@code confidence} are null for AMBIGUOUS entries.
 */
public record Discrepancy(
        ItemRef ref,
        DiscrepancyKind kind,
        WorkStatus recorded,
        WorkStatus observed,
        Confidence confidence,
        String reason,
        List<String> candidatePaths
) {
    public Discrepancy {
        if (ref == null || kind == null || recorded == null) {
            throw new IllegalArgumentException("Discrepancy needs a reference, kind and recorded status");
        }
        if (kind == DiscrepancyKind.STATUS_DRIFT && observed == null) {
            throw new IllegalArgumentException("Status drift for " + ref + " needs an observed status");
        }
        candidatePaths = candidatePaths != null ? List.copyOf(candidatePaths) : List.of();
    }

    public static Discrepancy drift(ItemRef ref, WorkStatus recorded, WorkStatus observed,
                                    Confidence confidence, String reason) {
        return new Discrepancy(ref, DiscrepancyKind.STATUS_DRIFT, recorded, observed,
                confidence, reason, List.of());
    }

    public static Discrepancy ambiguous(ItemRef ref, WorkStatus recorded, String reason,
                                        List<String> candidatePaths) {
        return new Discrepancy(ref, DiscrepancyKind.AMBIGUOUS, recorded, null,
                null, reason, candidatePaths);
    }

    public boolean isCorrection() {
        return kind == DiscrepancyKind.STATUS_DRIFT;
    }
}
