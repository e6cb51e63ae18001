package org.neuralchilli.planwright.service;

import java.util.List;
import java.util.Map;

/**
 * Thrown when the dependency edges (including phase gating) contain a cycle.
 * The graph is never partially built when this is thrown.
 */
public class CycleDetectedException extends PlanwrightException {

    private final List<String> cycle;

    public CycleDetectedException(List<String> cycle) {
        super(ErrorKind.CYCLE,
                "Dependency cycle detected: " + String.join(" -> ", cycle),
                Map.of("cycle", List.copyOf(cycle)));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Participating identifiers in edge order; the first element is repeated
     * at the end to close the loop.
     */
    public List<String> cycle() {
        return cycle;
    }
}
