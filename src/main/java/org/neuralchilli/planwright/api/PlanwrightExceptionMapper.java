package org.neuralchilli.planwright.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.neuralchilli.planwright.service.PlanwrightException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the exception hierarchy to HTTP: 409 for transient lock and conflict
 * failures, 404 for unknown plans and items, 422 for definitions that cannot
 * form a graph.
 */
@Provider
public class PlanwrightExceptionMapper implements ExceptionMapper<PlanwrightException> {

    private static final Logger log = LoggerFactory.getLogger(PlanwrightExceptionMapper.class);

    @Override
    public Response toResponse(PlanwrightException exception) {
        int status = switch (exception.kind()) {
            case LOCK_TIMEOUT, STATUS_CONFLICT -> 409;
            case PLAN_NOT_FOUND, ITEM_NOT_FOUND -> 404;
            case CYCLE, VALIDATION -> 422;
        };
        log.debug("Rejected request with {}: {}", exception.kind(), exception.getMessage());

        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(
                        exception.kind().name(),
                        exception.getMessage(),
                        exception.retryable(),
                        exception.context()))
                .build();
    }
}
