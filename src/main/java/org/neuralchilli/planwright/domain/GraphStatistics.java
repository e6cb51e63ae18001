package org.neuralchilli.planwright.domain;

import javax.annotation.Nonnull;

/**
 * Statistics about a dependency graph. Counts refer to work items only;
 * plan and phase nodes are reported separately.
 */
public record GraphStatistics(
        int totalItems,
        int plans,
        int phases,
        int rootItems,
        int leafItems,
        int executionLevels,
        int maxParallelism
) {
    public GraphStatistics {
        if (totalItems < 0) {
            throw new IllegalArgumentException("Total items cannot be negative");
        }
        if (plans < 0 || phases < 0) {
            throw new IllegalArgumentException("Plan and phase counts cannot be negative");
        }
        if (rootItems < 0) {
            throw new IllegalArgumentException("Root items cannot be negative");
        }
        if (leafItems < 0) {
            throw new IllegalArgumentException("Leaf items cannot be negative");
        }
        if (executionLevels < 0) {
            throw new IllegalArgumentException("Execution levels cannot be negative");
        }
        if (maxParallelism < 0) {
            throw new IllegalArgumentException("Max parallelism cannot be negative");
        }
    }

    public boolean hasParallelism() {
        return maxParallelism > 1;
    }

    /**
     * Number of sequential execution levels
     */
    public int depth() {
        return executionLevels;
    }

    /**
     * Widest level
     */
    public int width() {
        return maxParallelism;
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "GraphStatistics[items=%d, plans=%d, phases=%d, levels=%d, max_parallel=%d, roots=%d, leaves=%d]",
                totalItems, plans, phases, executionLevels, maxParallelism, rootItems, leafItems
        );
    }
}
