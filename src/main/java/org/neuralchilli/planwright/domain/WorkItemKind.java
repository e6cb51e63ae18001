package org.neuralchilli.planwright.domain;

/**
 * What a work item represents.
 */
public enum WorkItemKind {
    TASK,
    VERIFICATION_CASE
}
