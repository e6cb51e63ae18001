package org.neuralchilli.planwright.domain;

/**
 * Condition a phase must satisfy before the next phase becomes eligible.
 */
public enum GatingRule {
    /**
     * Every item of every plan in the phase is COMPLETED
     */
    ALL_COMPLETED,

    /**
     * Every CRITICAL item of the phase is COMPLETED
     */
    CRITICAL_COMPLETED
}
