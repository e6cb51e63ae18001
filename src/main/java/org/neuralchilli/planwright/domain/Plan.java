package org.neuralchilli.planwright.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered collection of work items belonging to exactly one phase.
 * The plan's own status is always derived from its items.
 */
@JsonIgnoreProperties(value = {"status"}, allowGetters = true)
public record Plan(
        String id,
        String phaseId,
        List<WorkItem> items
) {

    public Plan {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Plan id cannot be null or empty");
        }
        if (id.indexOf(ItemRef.SEPARATOR) >= 0) {
            throw new IllegalArgumentException(
                    "Plan id cannot contain '" + ItemRef.SEPARATOR + "': " + id);
        }
        if (phaseId == null || phaseId.isBlank()) {
            throw new IllegalArgumentException("Plan '" + id + "' must belong to a phase");
        }
        items = items != null ? List.copyOf(items) : List.of();

        Set<String> seen = new HashSet<>();
        for (WorkItem item : items) {
            if (!seen.add(item.id())) {
                throw new IllegalArgumentException(
                        "Duplicate work item id '" + item.id() + "' in plan '" + id + "'");
            }
        }
    }

    /**
     * NOT_STARTED if no item started, COMPLETED if all items completed,
     * IN_PROGRESS otherwise.
     */
    @JsonProperty("status")
    public WorkStatus status() {
        boolean anyStarted = items.stream().anyMatch(i -> i.status().isStarted());
        if (!anyStarted) {
            return WorkStatus.NOT_STARTED;
        }
        return allItemsCompleted() ? WorkStatus.COMPLETED : WorkStatus.IN_PROGRESS;
    }

    /**
     * True when every item is COMPLETED (vacuously true for an empty plan).
     */
    public boolean allItemsCompleted() {
        return items.stream().allMatch(i -> i.status() == WorkStatus.COMPLETED);
    }

    public Optional<WorkItem> item(String itemId) {
        return items.stream().filter(i -> i.id().equals(itemId)).findFirst();
    }

    public boolean hasItem(String itemId) {
        return item(itemId).isPresent();
    }

    public ItemRef ref(WorkItem item) {
        return ItemRef.of(id, item.id());
    }

    /**
     * Copy with one item replaced (matched by id).
     */
    public Plan withItem(WorkItem replacement) {
        List<WorkItem> updated = new ArrayList<>(items.size());
        boolean found = false;
        for (WorkItem item : items) {
            if (item.id().equals(replacement.id())) {
                updated.add(replacement);
                found = true;
            } else {
                updated.add(item);
            }
        }
        if (!found) {
            throw new IllegalArgumentException(
                    "Plan '" + id + "' has no item '" + replacement.id() + "'");
        }
        return new Plan(id, phaseId, updated);
    }

    boolean sameShapeAs(Plan other) {
        if (other == null || !id.equals(other.id) || !phaseId.equals(other.phaseId)
                || items.size() != other.items.size()) {
            return false;
        }
        for (int i = 0; i < items.size(); i++) {
            if (!items.get(i).sameShapeAs(other.items.get(i))) {
                return false;
            }
        }
        return true;
    }
}
