package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.ItemRef;

import javax.annotation.Nonnull;

/**
 * Arena entry of the dependency graph. The integer index is the vertex used
 * in the underlying JGraphT graph.
 */
public record GraphNode(
        int index,
        NodeKind kind,
        String id,
        ItemRef itemRef
) {

    public static GraphNode item(int index, ItemRef ref) {
        return new GraphNode(index, NodeKind.ITEM, ref.toString(), ref);
    }

    public static GraphNode plan(int index, String planId) {
        return new GraphNode(index, NodeKind.PLAN, planId, null);
    }

    public static GraphNode phase(int index, String phaseId) {
        return new GraphNode(index, NodeKind.PHASE, phaseId, null);
    }

    /**
     * Identifier used in cycle reports.
     */
    public String label() {
        return switch (kind) {
            case ITEM -> itemRef.toString();
            case PLAN -> "plan(" + id + ")";
            case PHASE -> "phase(" + id + ")";
        };
    }

    @Nonnull
    @Override
    public String toString() {
        return "GraphNode[" + index + ", " + label() + "]";
    }
}
