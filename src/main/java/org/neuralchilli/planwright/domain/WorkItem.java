package org.neuralchilli.planwright.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Atomic schedulable unit: an implementation task or a verification case.
 * Only status, revision and lastUpdated ever change after creation.
 */
public record WorkItem(
        String id,
        WorkItemKind kind,
        WorkStatus status,
        Priority priority,
        List<String> dependsOn,
        boolean parallelizable,
        String exclusivityGroup,
        String deliverable,
        long revision,
        Instant lastUpdated
) {

    public WorkItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Work item id cannot be null or empty");
        }
        if (id.indexOf(ItemRef.SEPARATOR) >= 0) {
            throw new IllegalArgumentException(
                    "Work item id cannot contain '" + ItemRef.SEPARATOR + "': " + id);
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null for item: " + id);
        }
        if (revision < 0) {
            throw new IllegalArgumentException("Revision cannot be negative for item: " + id);
        }

        // Defaults
        kind = kind != null ? kind : WorkItemKind.TASK;
        priority = priority != null ? priority : Priority.LOW;
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }

    /**
     * Exclusivity group this item belongs to, defaulting to the owning plan.
     */
    public String effectiveExclusivityGroup(String planId) {
        return exclusivityGroup != null && !exclusivityGroup.isBlank() ? exclusivityGroup : planId;
    }

    public boolean hasDeliverable() {
        return deliverable != null && !deliverable.isBlank();
    }

    /**
     * Copy with a new status. Revision and timestamp are stamped by the store on commit.
     */
    public WorkItem withStatus(WorkStatus newStatus) {
        return new WorkItem(id, kind, newStatus, priority, dependsOn, parallelizable,
                exclusivityGroup, deliverable, revision, lastUpdated);
    }

    WorkItem stamped(long newRevision, Instant timestamp) {
        return new WorkItem(id, kind, status, priority, dependsOn, parallelizable,
                exclusivityGroup, deliverable, newRevision, timestamp);
    }

    /**
     * Compare everything except the mutable status fields.
     */
    public boolean sameShapeAs(WorkItem other) {
        return other != null
                && id.equals(other.id)
                && kind == other.kind
                && priority == other.priority
                && dependsOn.equals(other.dependsOn)
                && parallelizable == other.parallelizable
                && Objects.equals(exclusivityGroup, other.exclusivityGroup)
                && Objects.equals(deliverable, other.deliverable);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private WorkItemKind kind = WorkItemKind.TASK;
        private WorkStatus status = WorkStatus.NOT_STARTED;
        private Priority priority = Priority.LOW;
        private List<String> dependsOn = List.of();
        private boolean parallelizable = true;
        private String exclusivityGroup;
        private String deliverable;

        public Builder(String id) {
            this.id = id;
        }

        public Builder kind(WorkItemKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder status(WorkStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder dependsOn(String... dependsOn) {
            this.dependsOn = List.of(dependsOn);
            return this;
        }

        public Builder parallelizable(boolean parallelizable) {
            this.parallelizable = parallelizable;
            return this;
        }

        public Builder exclusivityGroup(String exclusivityGroup) {
            this.exclusivityGroup = exclusivityGroup;
            return this;
        }

        public Builder deliverable(String deliverable) {
            this.deliverable = deliverable;
            return this;
        }

        public WorkItem build() {
            return new WorkItem(id, kind, status, priority, dependsOn, parallelizable,
                    exclusivityGroup, deliverable, 0L, null);
        }
    }
}
