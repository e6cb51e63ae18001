package org.neuralchilli.planwright.service;

import java.util.List;
import java.util.Map;

/**
 * Definitions that cannot form a graph: unknown references, duplicates,
 * inconsistent phase membership.
 */
public class ValidationException extends PlanwrightException {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super(ErrorKind.VALIDATION,
                "Definition validation failed:\n" + String.join("\n", errors),
                Map.of("errors", List.copyOf(errors)));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
