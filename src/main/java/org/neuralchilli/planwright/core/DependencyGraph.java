package org.neuralchilli.planwright.core;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.planwright.domain.GatingRule;
import org.neuralchilli.planwright.domain.GraphStatistics;
import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.service.ItemNotFoundException;
import org.neuralchilli.planwright.service.PlanNotFoundException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable, fully validated dependency graph over work items, plans and phases.
 * Nodes live in an integer-indexed arena; edges point from prerequisite to
 * dependent. Only {@link DependencyGraphBuilder} creates instances, and only
 * after the whole edge set was proven acyclic.
 */
public final class DependencyGraph {

    private final List<GraphNode> arena;
    private final DirectedAcyclicGraph<Integer, DefaultEdge> dag;
    private final Map<ItemRef, Integer> itemIndex;
    private final Map<String, String> phaseOfPlan;
    private final List<String> phaseOrder;
    private final Map<String, GatingRule> gatingRules;
    private final Map<ItemRef, List<ItemRef>> itemDependencies;
    private final Map<ItemRef, List<ItemRef>> itemDependents;

    DependencyGraph(
            List<GraphNode> arena,
            DirectedAcyclicGraph<Integer, DefaultEdge> dag,
            Map<ItemRef, Integer> itemIndex,
            Map<String, String> phaseOfPlan,
            List<String> phaseOrder,
            Map<String, GatingRule> gatingRules,
            Map<ItemRef, List<ItemRef>> itemDependencies
    ) {
        this.arena = List.copyOf(arena);
        this.dag = dag;
        this.itemIndex = Map.copyOf(itemIndex);
        this.phaseOfPlan = Map.copyOf(phaseOfPlan);
        this.phaseOrder = List.copyOf(phaseOrder);
        this.gatingRules = Map.copyOf(gatingRules);
        this.itemDependencies = Map.copyOf(itemDependencies);
        this.itemDependents = invert(itemDependencies, arena);
    }

    private static Map<ItemRef, List<ItemRef>> invert(Map<ItemRef, List<ItemRef>> dependencies, List<GraphNode> arena) {
        Map<ItemRef, List<ItemRef>> dependents = new HashMap<>();
        // Arena order keeps dependents in declaration order
        for (GraphNode node : arena) {
            if (node.kind() != NodeKind.ITEM) {
                continue;
            }
            dependents.putIfAbsent(node.itemRef(), new ArrayList<>());
            for (ItemRef dependency : dependencies.getOrDefault(node.itemRef(), List.of())) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(node.itemRef());
            }
        }
        Map<ItemRef, List<ItemRef>> frozen = new HashMap<>();
        dependents.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return Map.copyOf(frozen);
    }

    /**
     * Items this item waits on directly. A dependency on a whole plan expands
     * to every item of that plan.
     */
    public List<ItemRef> dependencies(ItemRef ref) {
        requireItem(ref);
        return itemDependencies.getOrDefault(ref, List.of());
    }

    /**
     * Items that wait on this item directly.
     */
    public List<ItemRef> dependents(ItemRef ref) {
        requireItem(ref);
        return itemDependents.getOrDefault(ref, List.of());
    }

    public String phaseOf(String planId) {
        String phaseId = phaseOfPlan.get(planId);
        if (phaseId == null) {
            throw new PlanNotFoundException(planId);
        }
        return phaseId;
    }

    /**
     * Phase ids in their total order.
     */
    public List<String> phaseOrder() {
        return phaseOrder;
    }

    public int phasePosition(String phaseId) {
        return phaseOrder.indexOf(phaseId);
    }

    /**
     * Effective gating rule of a phase (configured default already applied).
     */
    public GatingRule gatingRule(String phaseId) {
        return gatingRules.get(phaseId);
    }

    public boolean containsItem(ItemRef ref) {
        return itemIndex.containsKey(ref);
    }

    public Set<ItemRef> items() {
        return itemIndex.keySet();
    }

    public List<GraphNode> nodes() {
        return arena;
    }

    public int edgeCount() {
        return dag.edgeSet().size();
    }

    /**
     * Items in an order where every item follows all of its prerequisites,
     * including phase gating.
     */
    public List<ItemRef> topologicalOrder() {
        List<ItemRef> order = new ArrayList<>();
        TopologicalOrderIterator<Integer, DefaultEdge> iterator = new TopologicalOrderIterator<>(dag);
        while (iterator.hasNext()) {
            GraphNode node = arena.get(iterator.next());
            if (node.kind() == NodeKind.ITEM) {
                order.add(node.itemRef());
            }
        }
        return order;
    }

    /**
     * Item counts per execution level. The level of an item is one more than
     * the deepest item that must precede it through any path, including
     * plan and phase nodes.
     */
    public Map<ItemRef, Integer> executionLevels() {
        int[] depth = new int[arena.size()];
        TopologicalOrderIterator<Integer, DefaultEdge> iterator = new TopologicalOrderIterator<>(dag);
        Map<ItemRef, Integer> levels = new HashMap<>();
        while (iterator.hasNext()) {
            int vertex = iterator.next();
            int deepest = 0;
            for (DefaultEdge edge : dag.incomingEdgesOf(vertex)) {
                deepest = Math.max(deepest, depth[dag.getEdgeSource(edge)]);
            }
            GraphNode node = arena.get(vertex);
            depth[vertex] = node.kind() == NodeKind.ITEM ? deepest + 1 : deepest;
            if (node.kind() == NodeKind.ITEM) {
                levels.put(node.itemRef(), depth[vertex]);
            }
        }
        return levels;
    }

    public GraphStatistics statistics() {
        Map<ItemRef, Integer> levels = executionLevels();
        Map<Integer, Long> widths = levels.values().stream()
                .collect(Collectors.groupingBy(level -> level, Collectors.counting()));

        int roots = (int) levels.values().stream().filter(level -> level == 1).count();
        int leaves = (int) itemIndex.keySet().stream()
                .filter(ref -> itemDependents.getOrDefault(ref, List.of()).isEmpty())
                .count();
        int plans = (int) arena.stream().filter(n -> n.kind() == NodeKind.PLAN).count();

        return new GraphStatistics(
                itemIndex.size(),
                plans,
                phaseOrder.size(),
                roots,
                leaves,
                widths.keySet().stream().mapToInt(Integer::intValue).max().orElse(0),
                widths.values().stream().mapToInt(Long::intValue).max().orElse(0)
        );
    }

    private void requireItem(ItemRef ref) {
        if (!itemIndex.containsKey(ref)) {
            throw new ItemNotFoundException(ref.toString());
        }
    }

    @Override
    public String toString() {
        return "DependencyGraph[nodes=" + arena.size() + ", edges=" + dag.edgeSet().size()
                + ", phases=" + phaseOrder + "]";
    }
}
