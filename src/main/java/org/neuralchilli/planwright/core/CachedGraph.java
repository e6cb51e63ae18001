package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.StatusRecord;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Caches the dependency graph built for a record shape. Shape never changes
 * after seeding, so one graph serves every subsequent revision; a record with
 * a different shape triggers a rebuild.
 */
public final class CachedGraph {

    private record Entry(StatusRecord shape, DependencyGraph graph) {
    }

    private final Function<StatusRecord, DependencyGraph> builder;
    private final AtomicReference<Entry> entry = new AtomicReference<>();

    public CachedGraph(Function<StatusRecord, DependencyGraph> builder) {
        if (builder == null) {
            throw new IllegalArgumentException("Graph builder cannot be null");
        }
        this.builder = builder;
    }

    /**
     * Graph for the given record, built on first use or when the shape changed.
     */
    public DependencyGraph graphFor(StatusRecord record) {
        Entry current = entry.get();
        if (current != null && current.shape().sameShapeAs(record)) {
            return current.graph();
        }
        DependencyGraph graph = builder.apply(record);
        entry.set(new Entry(record, graph));
        return graph;
    }

    public void invalidate() {
        entry.set(null);
    }

    @Override
    public String toString() {
        Entry current = entry.get();
        return current == null ? "CachedGraph[empty]" : "CachedGraph[" + current.graph() + "]";
    }
}
