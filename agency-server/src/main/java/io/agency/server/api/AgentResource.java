package io.agency.server.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.agency.core.execution.ProcessResult;
import io.agency.server.service.WorkflowService;
import io.agency.server.validation.ValidMessage;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

/// Single-turn agent endpoint.
///
/// ### Request
/// ```
/// POST /api/v1/agent/process
/// {"message": "What is the capital of France?", "max_steps": 5}
/// ```
///
/// ### Response (200 OK)
/// ```json
/// {"response": "Paris.", "steps_executed": 1, "completed": true}
/// ```
///
/// `completed` is `false` when the answer was cut off by the thinking-step
/// bound. A failed reasoning step answers 502.
///
/// @see WorkflowService#process(String, Integer)
@Path("/api/v1/agent")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AgentResource {

    private static final Logger LOG = Logger.getLogger(AgentResource.class);

    private final WorkflowService workflowService;

    @Inject
    public AgentResource(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @POST
    @Path("/process")
    public ProcessResponse process(@NotNull @Valid ProcessRequest request) {
        LOG.debugv("Process request: max_steps={0}", request.maxSteps());

        ProcessResult result = workflowService.process(request.message(), request.maxSteps());
        return new ProcessResponse(result.response(), result.stepsExecuted(), result.completed());
    }

    public record ProcessRequest(
            @ValidMessage String message,
            @JsonProperty("max_steps") @Min(1) @Max(1000) Integer maxSteps) {}

    public record ProcessResponse(
            String response,
            @JsonProperty("steps_executed") int stepsExecuted,
            boolean completed) {}
}
