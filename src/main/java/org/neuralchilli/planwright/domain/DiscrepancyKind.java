package org.neuralchilli.planwright.domain;

public enum DiscrepancyKind {
    /**
     * Evidence points to a different status than the one recorded
     */
    STATUS_DRIFT,

    /**
     * Evidence could not be resolved; recorded status is left untouched
     */
    AMBIGUOUS
}
