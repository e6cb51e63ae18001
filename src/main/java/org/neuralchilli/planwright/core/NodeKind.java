package org.neuralchilli.planwright.core;

/**
 * Kind of a node in the dependency graph arena.
 */
public enum NodeKind {
    ITEM,
    PLAN,
    PHASE
}
