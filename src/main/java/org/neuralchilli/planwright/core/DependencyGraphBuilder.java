package org.neuralchilli.planwright.core;

import org.jgrapht.GraphPath;
import org.jgrapht.alg.shortestpath.BFSShortestPath;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.planwright.domain.GatingRule;
import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.domain.Phase;
import org.neuralchilli.planwright.domain.Plan;
import org.neuralchilli.planwright.domain.Priority;
import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.service.CycleDetectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link DependencyGraph} from plan and phase definitions using JGraphT.
 *
 * Edge set (prerequisite -> dependent):
 * - dependency item -> item, or dependency plan -> item for cross-plan plan dependencies
 * - item -> owning plan
 * - plan -> phase (ALL_COMPLETED) or critical item -> phase (CRITICAL_COMPLETED)
 * - phase k -> phase k+1 and phase k -> every item of phase k+1
 *
 * Construction is all-or-nothing: validation errors and cycles throw before
 * any graph is returned.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final DefinitionValidator validator;
    private final GatingRule defaultGatingRule;

    public DependencyGraphBuilder(GatingRule defaultGatingRule) {
        this(new DefinitionValidator(), defaultGatingRule);
    }

    public DependencyGraphBuilder(DefinitionValidator validator, GatingRule defaultGatingRule) {
        this.validator = validator;
        this.defaultGatingRule = defaultGatingRule != null ? defaultGatingRule : GatingRule.ALL_COMPLETED;
    }

    public DependencyGraph build(StatusRecord record) {
        return build(record.plans(), record.phases());
    }

    /**
     * @throws org.neuralchilli.planwright.service.ValidationException for unknown or duplicate references
     * @throws CycleDetectedException if the edges, including phase gating, form a cycle
     */
    public DependencyGraph build(List<Plan> plans, List<Phase> phases) {
        log.debug("Building dependency graph: {} plans, {} phases", plans.size(), phases.size());

        validator.validate(plans, phases);

        // First pass: arena of nodes
        List<GraphNode> arena = new ArrayList<>();
        Map<ItemRef, Integer> itemIndex = new LinkedHashMap<>();
        Map<String, Integer> planIndex = new HashMap<>();
        Map<String, Integer> phaseIndex = new HashMap<>();
        Map<String, Plan> plansById = new HashMap<>();

        for (Phase phase : phases) {
            int index = arena.size();
            arena.add(GraphNode.phase(index, phase.id()));
            phaseIndex.put(phase.id(), index);
        }
        for (Plan plan : plans) {
            plansById.put(plan.id(), plan);
            int index = arena.size();
            arena.add(GraphNode.plan(index, plan.id()));
            planIndex.put(plan.id(), index);
        }
        for (Plan plan : orderedPlans(plans, phases)) {
            for (WorkItem item : plan.items()) {
                int index = arena.size();
                ItemRef ref = plan.ref(item);
                arena.add(GraphNode.item(index, ref));
                itemIndex.put(ref, index);
            }
        }

        // Second pass: edges
        List<int[]> edges = new ArrayList<>();
        Map<ItemRef, List<ItemRef>> itemDependencies = new HashMap<>();

        for (Plan plan : plans) {
            for (WorkItem item : plan.items()) {
                ItemRef ref = plan.ref(item);
                int target = itemIndex.get(ref);
                edges.add(new int[]{target, planIndex.get(plan.id())});

                List<ItemRef> expanded = new ArrayList<>();
                for (String declared : item.dependsOn()) {
                    DependencyTarget dependency = DependencyTarget.resolve(declared, plan, plansById)
                            .orElseThrow(() -> new IllegalStateException(
                                    "Unresolvable dependency passed validation: " + declared));

                    if (dependency instanceof DependencyTarget.OnItem onItem) {
                        edges.add(new int[]{itemIndex.get(onItem.ref()), target});
                        addDistinct(expanded, onItem.ref());
                    } else if (dependency instanceof DependencyTarget.OnPlan onPlan) {
                        edges.add(new int[]{planIndex.get(onPlan.planId()), target});
                        Plan other = plansById.get(onPlan.planId());
                        other.items().forEach(i -> addDistinct(expanded, other.ref(i)));
                    }
                }
                itemDependencies.put(ref, List.copyOf(expanded));
            }
        }

        Map<String, GatingRule> gatingRules = new HashMap<>();
        List<String> phaseOrder = new ArrayList<>();
        for (int k = 0; k < phases.size(); k++) {
            Phase phase = phases.get(k);
            GatingRule rule = phase.effectiveRule(defaultGatingRule);
            gatingRules.put(phase.id(), rule);
            phaseOrder.add(phase.id());
            int phaseNode = phaseIndex.get(phase.id());

            for (String planId : phase.planIds()) {
                Plan plan = plansById.get(planId);
                if (rule == GatingRule.ALL_COMPLETED) {
                    edges.add(new int[]{planIndex.get(planId), phaseNode});
                } else {
                    for (WorkItem item : plan.items()) {
                        if (item.priority() == Priority.CRITICAL) {
                            edges.add(new int[]{itemIndex.get(plan.ref(item)), phaseNode});
                        }
                    }
                }
            }

            if (k + 1 < phases.size()) {
                Phase next = phases.get(k + 1);
                edges.add(new int[]{phaseNode, phaseIndex.get(next.id())});
                for (String planId : next.planIds()) {
                    Plan plan = plansById.get(planId);
                    for (WorkItem item : plan.items()) {
                        edges.add(new int[]{phaseNode, itemIndex.get(plan.ref(item))});
                    }
                }
            }
        }

        DirectedAcyclicGraph<Integer, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);
        for (GraphNode node : arena) {
            dag.addVertex(node.index());
        }

        for (int[] edge : edges) {
            try {
                dag.addEdge(edge[0], edge[1]);
                log.trace("Added edge: {} -> {}", arena.get(edge[0]).label(), arena.get(edge[1]).label());
            } catch (IllegalArgumentException e) {
                // JGraphT rejects edges (and self-loops) that would close a cycle
                List<String> cycle = findMinimalCycle(arena, edges);
                log.warn("Rejecting definitions, dependency cycle: {}", cycle);
                throw new CycleDetectedException(cycle);
            }
        }

        log.debug("Dependency graph built: {} nodes, {} edges", dag.vertexSet().size(), dag.edgeSet().size());

        Map<String, String> phaseOfPlan = new HashMap<>();
        plans.forEach(p -> phaseOfPlan.put(p.id(), p.phaseId()));

        return new DependencyGraph(arena, dag, itemIndex, phaseOfPlan, phaseOrder, gatingRules, itemDependencies);
    }

    /**
     * Shortest cycle over the complete edge set. For every edge u -> v the
     * shortest path v ~> u closes a cycle through that edge; the overall
     * minimum is reported.
     */
    private List<String> findMinimalCycle(List<GraphNode> arena, List<int[]> edges) {
        DefaultDirectedGraph<Integer, DefaultEdge> full = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (GraphNode node : arena) {
            full.addVertex(node.index());
        }
        for (int[] edge : edges) {
            if (edge[0] == edge[1]) {
                String label = arena.get(edge[0]).label();
                return List.of(label, label);
            }
            full.addEdge(edge[0], edge[1]);
        }

        BFSShortestPath<Integer, DefaultEdge> bfs = new BFSShortestPath<>(full);
        List<Integer> best = null;
        for (DefaultEdge edge : full.edgeSet()) {
            int source = full.getEdgeSource(edge);
            int target = full.getEdgeTarget(edge);
            GraphPath<Integer, DefaultEdge> back = bfs.getPath(target, source);
            if (back == null) {
                continue;
            }
            List<Integer> cycle = new ArrayList<>();
            cycle.add(source);
            cycle.addAll(back.getVertexList());
            if (best == null || cycle.size() < best.size()) {
                best = cycle;
            }
        }

        if (best == null) {
            throw new IllegalStateException("Cycle reported by JGraphT but no cycle found in edge set");
        }
        return best.stream().map(i -> arena.get(i).label()).toList();
    }

    private static List<Plan> orderedPlans(List<Plan> plans, List<Phase> phases) {
        return new StatusRecord(0L, null, phases, plans).plansInPhaseOrder();
    }

    private static void addDistinct(List<ItemRef> list, ItemRef ref) {
        if (!list.contains(ref)) {
            list.add(ref);
        }
    }
}
