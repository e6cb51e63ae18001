package org.neuralchilli.planwright.api;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.neuralchilli.planwright.domain.Discrepancy;
import org.neuralchilli.planwright.domain.GraphStatistics;
import org.neuralchilli.planwright.domain.Outcome;
import org.neuralchilli.planwright.domain.OutcomeKind;
import org.neuralchilli.planwright.domain.Priority;
import org.neuralchilli.planwright.domain.ReconcileMode;
import org.neuralchilli.planwright.domain.ScheduleResult;
import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.service.SchedulingService;

import java.util.List;

@Path("/schedule")
@Produces(MediaType.APPLICATION_JSON)
public class SchedulerResource {

    @Inject
    SchedulingService schedulingService;

    @POST
    @Path("/definitions")
    @Consumes(MediaType.APPLICATION_JSON)
    public StatusRecord seed(StatusRecord definitions) {
        return schedulingService.seed(definitions);
    }

    @GET
    @Path("/executable")
    public ScheduleResult executable(
            @QueryParam("plan") String plan,
            @QueryParam("priority") String priority,
            @QueryParam("limit") @DefaultValue("0") int limit,
            @QueryParam("dryRun") @DefaultValue("false") boolean dryRun
    ) {
        Priority minimum = priority != null && !priority.isBlank() ? Priority.fromString(priority) : null;
        return schedulingService.listExecutable(plan, minimum, limit, dryRun);
    }

    @POST
    @Path("/reconciliation")
    public List<Discrepancy> reconcile(@QueryParam("mode") @DefaultValue("report") String mode) {
        return schedulingService.applyReconciliation(ReconcileMode.fromString(mode));
    }

    @POST
    @Path("/items/{ref}/outcome")
    @Consumes(MediaType.APPLICATION_JSON)
    public Outcome recordOutcome(@PathParam("ref") String ref, OutcomeRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Outcome body is required");
        }
        return schedulingService.recordOutcome(ref, OutcomeKind.fromString(request.outcome()), request.message());
    }

    @POST
    @Path("/cycle")
    public List<Outcome> runCycle(@QueryParam("limit") @DefaultValue("0") int limit) {
        return schedulingService.runCycle(limit);
    }

    @GET
    @Path("/status")
    public StatusRecord status() {
        return schedulingService.status();
    }

    @GET
    @Path("/statistics")
    public GraphStatistics statistics() {
        return schedulingService.statistics();
    }
}
