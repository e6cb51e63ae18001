package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.BlockReason;
import org.neuralchilli.planwright.domain.BlockedItem;
import org.neuralchilli.planwright.domain.GatingRule;
import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.domain.Phase;
import org.neuralchilli.planwright.domain.Plan;
import org.neuralchilli.planwright.domain.PlanSchedule;
import org.neuralchilli.planwright.domain.Priority;
import org.neuralchilli.planwright.domain.ScheduleFilter;
import org.neuralchilli.planwright.domain.ScheduleResult;
import org.neuralchilli.planwright.domain.ScheduledItem;
import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.domain.WorkStatus;
import org.neuralchilli.planwright.service.PlanNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Computes the executable set for a snapshot of the status record.
 *
 * A NOT_STARTED item is executable when every dependency is COMPLETED, every
 * earlier phase satisfies its gating rule, and it is either parallelizable or
 * no other item of its exclusivity group is running. A limit keeps the
 * highest-priority items across all plans. Output is grouped by plan in phase
 * order; within a plan, items are ordered by priority then declaration order.
 *
 * Pure function of its inputs: no locking, no shared state.
 */
public class Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private static final Comparator<WorkItem> BY_PRIORITY = Comparator.comparingInt(i -> i.priority().ordinal());

    public ScheduleResult executable(DependencyGraph graph, StatusRecord record, ScheduleFilter filter) {
        ScheduleFilter effective = filter != null ? filter : ScheduleFilter.none();
        if (effective.planId() != null && record.plan(effective.planId()).isEmpty()) {
            throw new PlanNotFoundException(effective.planId());
        }

        Map<String, String> gatedBy = phaseGates(graph, record);
        Map<String, List<ItemRef>> running = inProgressByGroup(record);
        List<BlockedItem> blocked = new ArrayList<>();

        // First pass: dependencies and phase gates
        List<Candidate> eligible = new ArrayList<>();
        for (Plan plan : record.plansInPhaseOrder()) {
            if (!effective.includesPlan(plan.id())) {
                continue;
            }
            List<WorkItem> candidates = plan.items().stream()
                    .filter(i -> i.status() == WorkStatus.NOT_STARTED)
                    .filter(i -> effective.includesPriority(i.priority()))
                    .sorted(BY_PRIORITY)
                    .toList();
            for (WorkItem item : candidates) {
                ItemRef ref = plan.ref(item);
                Optional<BlockedItem> reason = blockReason(graph, record, plan, item, ref, gatedBy);
                if (reason.isPresent()) {
                    logBlocked(item, reason.get());
                    blocked.add(reason.get());
                } else {
                    eligible.add(new Candidate(plan, item, ref));
                }
            }
        }

        // Second pass in global priority order; equal priorities keep phase, plan and declaration order
        List<Candidate> ranked = new ArrayList<>(eligible);
        ranked.sort(Comparator.comparingInt(c -> c.item().priority().ordinal()));

        Map<String, List<ItemRef>> selectedByGroup = new HashMap<>();
        Set<ItemRef> chosen = new HashSet<>();
        for (Candidate candidate : ranked) {
            WorkItem item = candidate.item();
            ItemRef ref = candidate.ref();
            String group = item.effectiveExclusivityGroup(candidate.plan().id());

            Optional<BlockedItem> reason = exclusivityConflict(item, ref, group, running, selectedByGroup);
            if (reason.isEmpty() && effective.isBounded() && chosen.size() >= effective.limit()) {
                reason = Optional.of(BlockedItem.of(ref, BlockReason.CONCURRENCY_LIMIT,
                        List.of(String.valueOf(effective.limit()))));
            }
            if (reason.isPresent()) {
                logBlocked(item, reason.get());
                blocked.add(reason.get());
                continue;
            }

            log.debug("  {} [{}] - executable", ref, item.priority());
            chosen.add(ref);
            selectedByGroup.computeIfAbsent(group, g -> new ArrayList<>()).add(ref);
        }

        Map<String, List<ScheduledItem>> byPlan = new LinkedHashMap<>();
        Map<String, String> phaseOfPlan = new HashMap<>();
        for (Candidate candidate : eligible) {
            if (chosen.contains(candidate.ref())) {
                WorkItem item = candidate.item();
                byPlan.computeIfAbsent(candidate.plan().id(), k -> new ArrayList<>())
                        .add(new ScheduledItem(candidate.ref(), item.priority(), item.parallelizable()));
                phaseOfPlan.put(candidate.plan().id(), candidate.plan().phaseId());
            }
        }
        List<PlanSchedule> groups = new ArrayList<>();
        byPlan.forEach((planId, items) -> groups.add(new PlanSchedule(planId, phaseOfPlan.get(planId), items)));

        log.debug("Scheduled {} executable, {} blocked at revision {}", chosen.size(), blocked.size(), record.revision());
        return new ScheduleResult(record.revision(), groups, blocked);
    }

    private record Candidate(Plan plan, WorkItem item, ItemRef ref) {
    }

    private static void logBlocked(WorkItem item, BlockedItem reason) {
        log.debug("  {} [{}] - {} {}", reason.ref(), item.priority(), reason.reason(), reason.blockedBy());
    }

    private Optional<BlockedItem> blockReason(
            DependencyGraph graph,
            StatusRecord record,
            Plan plan,
            WorkItem item,
            ItemRef ref,
            Map<String, String> gatedBy
    ) {
        List<String> failedUpstream = blockingUpstream(graph, record, ref);
        if (!failedUpstream.isEmpty()) {
            return Optional.of(BlockedItem.of(ref, BlockReason.DEPENDENCY_BLOCKED, failedUpstream));
        }

        String gate = gatedBy.get(plan.phaseId());
        if (gate != null) {
            return Optional.of(BlockedItem.of(ref, BlockReason.PHASE_GATED, List.of(gate)));
        }

        List<String> pending = graph.dependencies(ref).stream()
                .filter(dep -> statusOf(record, dep) != WorkStatus.COMPLETED)
                .map(ItemRef::toString)
                .toList();
        if (!pending.isEmpty()) {
            return Optional.of(BlockedItem.of(ref, BlockReason.WAITING_ON_DEPENDENCY, pending));
        }
        return Optional.empty();
    }

    /**
     * Transitive dependencies that are BLOCKED or FAILED.
     */
    private List<String> blockingUpstream(DependencyGraph graph, StatusRecord record, ItemRef ref) {
        Set<String> blocking = new LinkedHashSet<>();
        Queue<ItemRef> queue = new ArrayDeque<>(graph.dependencies(ref));
        Set<ItemRef> visited = new HashSet<>();

        while (!queue.isEmpty()) {
            ItemRef dependency = queue.poll();
            if (!visited.add(dependency)) {
                continue;
            }
            WorkStatus status = statusOf(record, dependency);
            if (status.isBlocking()) {
                blocking.add(dependency.toString());
            } else if (status != WorkStatus.COMPLETED) {
                queue.addAll(graph.dependencies(dependency));
            }
        }
        return List.copyOf(blocking);
    }

    /**
     * Parallelizable items never conflict. A non-parallelizable item waits while
     * another item of its group is running or already selected in this result.
     */
    private Optional<BlockedItem> exclusivityConflict(
            WorkItem item,
            ItemRef ref,
            String group,
            Map<String, List<ItemRef>> running,
            Map<String, List<ItemRef>> selectedByGroup
    ) {
        if (item.parallelizable()) {
            return Optional.empty();
        }

        List<ItemRef> conflicts = new ArrayList<>(running.getOrDefault(group, List.of()));
        conflicts.addAll(selectedByGroup.getOrDefault(group, List.of()));
        if (!conflicts.isEmpty()) {
            return Optional.of(BlockedItem.of(ref, BlockReason.EXCLUSIVITY_CONFLICT, refs(conflicts)));
        }
        return Optional.empty();
    }

    /**
     * For every phase that is not yet eligible, the id of the earliest earlier
     * phase that has not satisfied its gating rule.
     */
    private Map<String, String> phaseGates(DependencyGraph graph, StatusRecord record) {
        Map<String, String> gatedBy = new HashMap<>();
        String firstUnsatisfied = null;
        for (String phaseId : graph.phaseOrder()) {
            if (firstUnsatisfied != null) {
                gatedBy.put(phaseId, firstUnsatisfied);
            } else if (!gatingSatisfied(record, phaseId, graph.gatingRule(phaseId))) {
                firstUnsatisfied = phaseId;
            }
        }
        return gatedBy;
    }

    /**
     * Whether a phase satisfies its own gating rule in the given record.
     */
    public static boolean gatingSatisfied(StatusRecord record, String phaseId, GatingRule rule) {
        Phase phase = record.phase(phaseId).orElseThrow(() ->
                new IllegalArgumentException("Unknown phase: " + phaseId));
        for (String planId : phase.planIds()) {
            Plan plan = record.plan(planId).orElseThrow(() -> new PlanNotFoundException(planId));
            for (WorkItem item : plan.items()) {
                boolean counts = rule == GatingRule.ALL_COMPLETED || item.priority() == Priority.CRITICAL;
                if (counts && item.status() != WorkStatus.COMPLETED) {
                    return false;
                }
            }
        }
        return true;
    }

    private static Map<String, List<ItemRef>> inProgressByGroup(StatusRecord record) {
        Map<String, List<ItemRef>> running = new HashMap<>();
        for (Plan plan : record.plans()) {
            for (WorkItem item : plan.items()) {
                if (item.status() == WorkStatus.IN_PROGRESS) {
                    running.computeIfAbsent(item.effectiveExclusivityGroup(plan.id()), g -> new ArrayList<>())
                            .add(plan.ref(item));
                }
            }
        }
        return running;
    }

    private static WorkStatus statusOf(StatusRecord record, ItemRef ref) {
        return record.item(ref).map(WorkItem::status).orElse(WorkStatus.NOT_STARTED);
    }

    private static List<String> refs(List<ItemRef> refs) {
        return refs == null ? List.of() : refs.stream().map(ItemRef::toString).toList();
    }
}
