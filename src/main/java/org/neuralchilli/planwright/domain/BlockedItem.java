package org.neuralchilli.planwright.domain;

import java.util.List;

/**
 * A NOT_STARTED item that is not executable, with the reason and the
 * identifiers responsible (dependencies, gating phase, conflicting items).
 */
public record BlockedItem(
        ItemRef ref,
        BlockReason reason,
        WorkStatus reportedStatus,
        List<String> blockedBy
) {
    public BlockedItem {
        if (ref == null || reason == null) {
            throw new IllegalArgumentException("Blocked item needs a reference and a reason");
        }
        reportedStatus = reportedStatus != null ? reportedStatus : reason.reportedStatus();
        blockedBy = blockedBy != null ? List.copyOf(blockedBy) : List.of();
    }

    public static BlockedItem of(ItemRef ref, BlockReason reason, List<String> blockedBy) {
        return new BlockedItem(ref, reason, reason.reportedStatus(), blockedBy);
    }
}
