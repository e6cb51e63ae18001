package org.neuralchilli.planwright.service;

import java.util.Map;

public class PlanNotFoundException extends PlanwrightException {

    public PlanNotFoundException(String planId) {
        super(ErrorKind.PLAN_NOT_FOUND, "Plan not found: " + planId, Map.of("plan", planId));
    }
}
