package org.neuralchilli.planwright.api;

/**
 * Body of {@code POST /schedule/items/{ref}/outcome}.
 */
public record OutcomeRequest(
        String outcome,
        String message
) {
}
