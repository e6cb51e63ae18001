package org.neuralchilli.planwright.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persisted snapshot of every phase, plan and work item together with a
 * record-wide revision counter. Instances are immutable; the status store is
 * the only component that turns one snapshot into the next committed one.
 */
@JsonIgnoreProperties(value = {"summary"}, allowGetters = true)
public record StatusRecord(
        long revision,
        Instant lastUpdated,
        List<Phase> phases,
        List<Plan> plans
) {

    public StatusRecord {
        if (revision < 0) {
            throw new IllegalArgumentException("Revision cannot be negative");
        }
        phases = phases != null ? List.copyOf(phases) : List.of();
        plans = plans != null ? List.copyOf(plans) : List.of();
    }

    /**
     * Unseeded record holding definitions only.
     */
    public static StatusRecord of(List<Phase> phases, List<Plan> plans) {
        return new StatusRecord(0L, null, phases, plans);
    }

    public static StatusRecord empty() {
        return new StatusRecord(0L, null, List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return plans.isEmpty() && phases.isEmpty();
    }

    public Optional<Plan> plan(String planId) {
        return plans.stream().filter(p -> p.id().equals(planId)).findFirst();
    }

    public Optional<Phase> phase(String phaseId) {
        return phases.stream().filter(p -> p.id().equals(phaseId)).findFirst();
    }

    public Optional<WorkItem> item(ItemRef ref) {
        return plan(ref.planId()).flatMap(p -> p.item(ref.itemId()));
    }

    /**
     * All item references in plan declaration order.
     */
    public List<ItemRef> itemRefs() {
        List<ItemRef> refs = new ArrayList<>();
        for (Plan plan : plans) {
            for (WorkItem item : plan.items()) {
                refs.add(plan.ref(item));
            }
        }
        return refs;
    }

    /**
     * Plans ordered by phase order, then by the order each phase lists them.
     * Plans whose phase does not list them keep their relative order at the end.
     */
    public List<Plan> plansInPhaseOrder() {
        Map<String, Plan> byId = new LinkedHashMap<>();
        plans.forEach(p -> byId.put(p.id(), p));

        List<Plan> ordered = new ArrayList<>(plans.size());
        for (Phase phase : phases) {
            for (String planId : phase.planIds()) {
                Plan plan = byId.remove(planId);
                if (plan != null) {
                    ordered.add(plan);
                }
            }
        }
        ordered.addAll(byId.values());
        return ordered;
    }

    /**
     * Copy with one item's status replaced.
     *
     * @throws IllegalArgumentException if the item does not exist
     */
    public StatusRecord withItemStatus(ItemRef ref, WorkStatus status) {
        Plan plan = plan(ref.planId()).orElseThrow(() ->
                new IllegalArgumentException("Unknown plan: " + ref.planId()));
        WorkItem item = plan.item(ref.itemId()).orElseThrow(() ->
                new IllegalArgumentException("Unknown item: " + ref));
        if (item.status() == status) {
            return this;
        }
        return withPlan(plan.withItem(item.withStatus(status)));
    }

    /**
     * Copy with several statuses replaced at once.
     */
    public StatusRecord withItemStatuses(Map<ItemRef, WorkStatus> updates) {
        StatusRecord result = this;
        for (Map.Entry<ItemRef, WorkStatus> entry : updates.entrySet()) {
            result = result.withItemStatus(entry.getKey(), entry.getValue());
        }
        return result;
    }

    private StatusRecord withPlan(Plan replacement) {
        List<Plan> updated = new ArrayList<>(plans.size());
        for (Plan plan : plans) {
            updated.add(plan.id().equals(replacement.id()) ? replacement : plan);
        }
        return new StatusRecord(revision, lastUpdated, phases, updated);
    }

    @JsonProperty("summary")
    public StatusSummary summary() {
        Map<WorkStatus, Integer> counts = new EnumMap<>(WorkStatus.class);
        int total = 0;
        for (Plan plan : plans) {
            for (WorkItem item : plan.items()) {
                counts.merge(item.status(), 1, Integer::sum);
                total++;
            }
        }
        return new StatusSummary(total, counts);
    }

    /**
     * True when both records describe the same phases, plans and items,
     * ignoring status, revisions and timestamps.
     */
    public boolean sameShapeAs(StatusRecord other) {
        if (other == null || !phases.equals(other.phases) || plans.size() != other.plans.size()) {
            return false;
        }
        for (int i = 0; i < plans.size(); i++) {
            if (!plans.get(i).sameShapeAs(other.plans.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Produce the committed form of this record: the record revision becomes
     * {@code newRevision}, and every item whose status differs from
     * {@code previous} is stamped with that revision and {@code now}.
     */
    public StatusRecord stamp(StatusRecord previous, long newRevision, Instant now) {
        List<Plan> stampedPlans = new ArrayList<>(plans.size());
        for (Plan plan : plans) {
            Plan before = previous != null ? previous.plan(plan.id()).orElse(null) : null;
            List<WorkItem> items = new ArrayList<>(plan.items().size());
            for (WorkItem item : plan.items()) {
                WorkItem old = before != null ? before.item(item.id()).orElse(null) : null;
                boolean changed = old == null || old.status() != item.status();
                items.add(changed ? item.stamped(newRevision, now) : item);
            }
            stampedPlans.add(new Plan(plan.id(), plan.phaseId(), items));
        }
        return new StatusRecord(newRevision, now, phases, stampedPlans);
    }
}
