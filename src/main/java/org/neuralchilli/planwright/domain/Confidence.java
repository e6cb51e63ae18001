package org.neuralchilli.planwright.domain;

/**
 * How strongly a piece of evidence supports an inferred status.
 */
public enum Confidence {
    HIGH,
    MEDIUM,
    LOW
}
