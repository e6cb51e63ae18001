package org.neuralchilli.planwright.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.planwright.config.PlanwrightConfig;
import org.neuralchilli.planwright.core.CachedGraph;
import org.neuralchilli.planwright.core.DependencyGraph;
import org.neuralchilli.planwright.core.EvidenceProvider;
import org.neuralchilli.planwright.core.Reconciler;
import org.neuralchilli.planwright.core.Scheduler;
import org.neuralchilli.planwright.core.StatusStore;
import org.neuralchilli.planwright.domain.Discrepancy;
import org.neuralchilli.planwright.domain.GraphStatistics;
import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.domain.Outcome;
import org.neuralchilli.planwright.domain.OutcomeKind;
import org.neuralchilli.planwright.domain.Plan;
import org.neuralchilli.planwright.domain.Priority;
import org.neuralchilli.planwright.domain.ReconcileMode;
import org.neuralchilli.planwright.domain.ScheduleFilter;
import org.neuralchilli.planwright.domain.ScheduleResult;
import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.domain.WorkStatus;
import org.neuralchilli.planwright.worker.ExecutionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Query and command surface used by dispatch tooling.
 *
 * Combines the status store, the cached dependency graph, the scheduler, the
 * reconciler and the execution coordinator. Every write goes through the store.
 */
@ApplicationScoped
public class SchedulingService {

    private static final Logger log = LoggerFactory.getLogger(SchedulingService.class);

    @Inject
    StatusStore store;

    @Inject
    CachedGraph graphs;

    @Inject
    Scheduler scheduler;

    @Inject
    Reconciler reconciler;

    @Inject
    EvidenceProvider evidence;

    @Inject
    ExecutionCoordinator coordinator;

    @Inject
    PlanwrightConfig config;

    /**
     * Validate definitions and install them into an empty store.
     *
     * @throws ValidationException     for unknown or duplicate references
     * @throws CycleDetectedException  if dependencies and phase gating form a cycle
     */
    public StatusRecord seed(StatusRecord definitions) {
        DependencyGraph graph = graphs.graphFor(definitions);
        log.info("Definitions valid: {}", graph.statistics());
        return store.seed(definitions);
    }

    /**
     * Executable items for the current record.
     *
     * A dry run only reads. A real run claims the returned items (IN_PROGRESS)
     * in one store update, computed against the latest record under the lock,
     * so its output matches a dry run against the same revision.
     */
    public ScheduleResult listExecutable(String planId, Priority minimumPriority, int limit, boolean dryRun) {
        ScheduleFilter filter = new ScheduleFilter(planId, minimumPriority, limit);

        StatusRecord snapshot = store.read();
        ScheduleResult preview = schedule(snapshot, filter);
        if (dryRun || preview.isEmpty()) {
            log.debug("Executable at revision {}: {} (dry run: {})",
                    snapshot.revision(), preview.executableRefs(), dryRun);
            return preview;
        }

        AtomicReference<ScheduleResult> claimed = new AtomicReference<>();
        StatusRecord committed = store.tryUpdate(current -> {
            ScheduleResult result = schedule(current, filter);
            claimed.set(result);
            Map<ItemRef, WorkStatus> claims = new LinkedHashMap<>();
            result.executableRefs().forEach(ref -> claims.put(ref, WorkStatus.IN_PROGRESS));
            return current.withItemStatuses(claims);
        });

        ScheduleResult result = claimed.get();
        log.info("Claimed {} executable items at revision {}", result.executableRefs().size(), committed.revision());
        return result;
    }

    public List<Discrepancy> applyReconciliation(ReconcileMode mode) {
        return reconciler.reconcile(store, null, evidence, mode != null ? mode : ReconcileMode.REPORT);
    }

    /**
     * Record a worker outcome for one item.
     *
     * @param reference qualified {@code plan:item}, or a bare item id that is unique across plans
     */
    public Outcome recordOutcome(String reference, OutcomeKind outcome, String message) {
        if (outcome == null || outcome.recordedStatus() == null) {
            throw new IllegalArgumentException("Outcome " + outcome + " cannot be recorded");
        }
        ItemRef ref = resolve(reference, store.read());
        WorkStatus status = outcome.recordedStatus();

        StatusRecord committed = store.tryUpdate(current -> current.withItemStatus(ref, status));
        log.info("Recorded {} for {} at revision {}{}", outcome, ref, committed.revision(),
                message != null ? ": " + message : "");
        return new Outcome(ref, outcome, message, committed.revision(), Duration.ZERO);
    }

    /**
     * Claim and dispatch executable items until nothing is executable or the
     * dispatch is cancelled.
     *
     * @param limit concurrency bound; zero or less uses the configured limit
     */
    public List<Outcome> runCycle(int limit) {
        int concurrency = limit > 0 ? limit : config.coordinator().concurrencyLimit();
        List<Outcome> outcomes = new ArrayList<>();

        while (true) {
            ScheduleResult result = listExecutable(null, null, concurrency, false);
            if (result.isEmpty()) {
                log.info("Cycle finished: nothing executable, {} blocked", result.blocked().size());
                break;
            }

            List<Outcome> batch = coordinator.dispatch(result.executableRefs(), concurrency);
            outcomes.addAll(batch);
            if (batch.stream().anyMatch(o -> o.kind() == OutcomeKind.NOT_DISPATCHED)) {
                log.info("Cycle stopped after cancellation");
                break;
            }
        }
        return outcomes;
    }

    public void cancelDispatch() {
        coordinator.cancel();
    }

    public StatusRecord status() {
        return store.read();
    }

    public GraphStatistics statistics() {
        return graphs.graphFor(store.read()).statistics();
    }

    private ScheduleResult schedule(StatusRecord record, ScheduleFilter filter) {
        return scheduler.executable(graphs.graphFor(record), record, filter);
    }

    static ItemRef resolve(String reference, StatusRecord record) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Item reference cannot be empty");
        }

        if (ItemRef.isQualified(reference)) {
            ItemRef ref = ItemRef.parse(reference);
            Plan plan = record.plan(ref.planId()).orElseThrow(() -> new PlanNotFoundException(ref.planId()));
            if (!plan.hasItem(ref.itemId())) {
                throw new ItemNotFoundException(reference);
            }
            return ref;
        }

        List<ItemRef> matches = record.plans().stream()
                .filter(p -> p.hasItem(reference))
                .map(p -> ItemRef.of(p.id(), reference))
                .toList();
        if (matches.isEmpty()) {
            throw new ItemNotFoundException(reference);
        }
        if (matches.size() > 1) {
            throw new ItemNotFoundException(reference, matches.stream().map(ItemRef::toString).toList());
        }
        return matches.get(0);
    }
}
