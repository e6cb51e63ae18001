package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.Discrepancy;
import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.domain.Plan;
import org.neuralchilli.planwright.domain.ReconcileMode;
import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.domain.WorkStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compares recorded item status with observable evidence.
 *
 * Each item with a deliverable runs through the strategy cascade; the first
 * strategy that answers decides the observed status. Ambiguous evidence is
 * reported and never corrected. FAILED and BLOCKED items are only corrected
 * by a COMPLETED observation.
 */
public class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final List<InferenceStrategy> strategies;

    public Reconciler(List<InferenceStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one inference strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Default cascade: completion criteria, deliverable content, deliverable existence.
     */
    public static Reconciler withDefaultStrategies(ContentThresholds thresholds) {
        return new Reconciler(List.of(
                new CompletionCriteriaStrategy(),
                new DeliverableContentStrategy(thresholds),
                new DeliverableExistenceStrategy()
        ));
    }

    /**
     * Reconcile {@code items} (all items when null) against the store.
     * In APPLY mode every correction is written through one store update; an
     * item whose status changed since it was inspected is left alone.
     */
    public List<Discrepancy> reconcile(
            StatusStore store,
            Collection<ItemRef> items,
            EvidenceProvider evidence,
            ReconcileMode mode
    ) {
        StatusRecord snapshot = store.read();
        List<Discrepancy> discrepancies = inspect(snapshot, items, evidence);

        Map<ItemRef, Discrepancy> corrections = new LinkedHashMap<>();
        discrepancies.stream()
                .filter(Discrepancy::isCorrection)
                .forEach(d -> corrections.put(d.ref(), d));

        log.info("Reconciliation at revision {}: {} discrepancies ({} corrections) in {} mode",
                snapshot.revision(), discrepancies.size(), corrections.size(), mode);

        if (mode == ReconcileMode.APPLY && !corrections.isEmpty()) {
            StatusRecord committed = store.update(current -> applyCorrections(current, corrections));
            log.info("Applied reconciliation corrections at revision {}", committed.revision());
        }
        return discrepancies;
    }

    /**
     * Pure comparison of a snapshot against evidence; never writes.
     */
    public List<Discrepancy> inspect(StatusRecord record, Collection<ItemRef> items, EvidenceProvider evidence) {
        Set<ItemRef> scope = items != null ? Set.copyOf(items) : null;
        List<Discrepancy> discrepancies = new ArrayList<>();

        for (Plan plan : record.plans()) {
            for (WorkItem item : plan.items()) {
                ItemRef ref = plan.ref(item);
                if (scope != null && !scope.contains(ref)) {
                    continue;
                }
                if (!item.hasDeliverable()) {
                    continue;
                }
                compare(ref, item, evidence.probe(ref, item)).ifPresent(discrepancies::add);
            }
        }
        return discrepancies;
    }

    private Optional<Discrepancy> compare(ItemRef ref, WorkItem item, DeliverableProbe probe) {
        WorkStatus recorded = item.status();

        if (probe.presence() == DeliverableProbe.Presence.AMBIGUOUS) {
            String reason = probe.candidates().isEmpty()
                    ? "deliverable '" + probe.reference() + "' does not resolve to any file"
                    : "deliverable '" + probe.reference() + "' resolves to " + probe.candidates().size() + " files";
            log.debug("{}: ambiguous - {}", ref, reason);
            return Optional.of(Discrepancy.ambiguous(ref, recorded, reason, probe.candidates()));
        }

        Optional<Inference> inference = infer(item, probe);
        if (inference.isEmpty()) {
            return Optional.empty();
        }
        Inference observed = inference.get();

        if (observed.status() == recorded) {
            return Optional.empty();
        }
        if (recorded.isBlocking() && observed.status() != WorkStatus.COMPLETED) {
            log.debug("{}: keeping {} despite observed {}", ref, recorded, observed.status());
            return Optional.empty();
        }

        log.debug("{}: recorded {} but observed {} ({})", ref, recorded, observed.status(), observed.reason());
        return Optional.of(Discrepancy.drift(ref, recorded, observed.status(), observed.confidence(),
                observed.reason()));
    }

    private Optional<Inference> infer(WorkItem item, DeliverableProbe probe) {
        for (InferenceStrategy strategy : strategies) {
            Optional<Inference> inference = strategy.infer(item, probe);
            if (inference.isPresent()) {
                return inference;
            }
        }
        return Optional.empty();
    }

    private static StatusRecord applyCorrections(StatusRecord current, Map<ItemRef, Discrepancy> corrections) {
        Map<ItemRef, WorkStatus> updates = new LinkedHashMap<>();
        corrections.forEach((ref, correction) -> {
            WorkStatus now = current.item(ref).map(WorkItem::status).orElse(null);
            if (now == correction.recorded()) {
                updates.put(ref, correction.observed());
            } else {
                log.warn("Skipping correction of {}: status changed from {} to {} since inspection",
                        ref, correction.recorded(), now);
            }
        });
        return current.withItemStatuses(updates);
    }
}
