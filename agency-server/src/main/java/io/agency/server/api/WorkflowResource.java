package io.agency.server.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.agency.core.execution.SuspendOutcome;
import io.agency.core.state.SnapshotSummary;
import io.agency.core.workflow.StepDescriptor;
import io.agency.core.workflow.StepState;
import io.agency.core.workflow.WorkflowSnapshot;
import io.agency.core.workflow.WorkflowStatus;
import io.agency.server.service.WorkflowService;
import io.agency.server.validation.InputValidator;
import io.agency.server.validation.LogSanitizer;
import io.agency.server.validation.ValidId;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST API for saga workflows and their snapshots.
///
/// Provides endpoints for:
/// - Creating workflows, which start running in the background
/// - Suspending and resuming them
/// - Querying live status and the persisted snapshot history
/// - Deleting finished workflows
///
/// Engine errors are translated by {@link io.agency.server.security.AgencyExceptionMapper}.
///
/// @see WorkflowService for the service layer
@Path("/api/v1/workflows")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class WorkflowResource {

    private static final Logger LOG = Logger.getLogger(WorkflowResource.class);

    private final WorkflowService workflowService;

    @Inject
    public WorkflowResource(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    /// Creates a workflow and starts it in the background.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/workflows
    /// {"workflow_id": "trip-42", "initial_message": "Book a trip to Lisbon", "max_steps": 5}
    /// ```
    ///
    /// An optional `steps` array replaces the single reasoning step:
    /// ```json
    /// {"workflow_id": "trip-42", "max_steps": 5, "steps": [
    ///   {"name": "reserve",
    ///    "forward": {"type": "tool", "toolName": "book", "arguments": {"city": "Lisbon"}},
    ///    "compensation": {"type": "tool", "toolName": "cancel", "arguments": {}}}
    /// ]}
    /// ```
    ///
    /// ### Response (202 Accepted)
    /// ```json
    /// {"workflow_id": "trip-42", "status": "PENDING"}
    /// ```
    @POST
    public Response create(@NotNull @Valid CreateWorkflowRequest request) {
        if (InputValidator.containsDangerousChars(request.initialMessage())) {
            throw new BadRequestException("initial_message must not contain control characters");
        }

        LOG.infov("Create workflow request: workflow={0}", request.workflowId());

        WorkflowSnapshot created =
                workflowService.create(
                        request.workflowId(),
                        request.initialMessage(),
                        request.maxSteps(),
                        request.steps());
        return Response.accepted(
                        Map.of("workflow_id", created.workflowId(), "status", created.status()))
                .build();
    }

    /// Returns the current state of a workflow, live or recovered from storage.
    @GET
    @Path("/{workflowId}")
    public WorkflowView get(@PathParam("workflowId") @ValidId String workflowId) {
        WorkflowSnapshot snapshot = workflowService.get(workflowId);
        return WorkflowView.of(snapshot, workflowService.isExecuting(workflowId));
    }

    /// Requests a cooperative suspend.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"workflow_id": "trip-42", "outcome": "SUSPEND_REQUESTED"}
    /// ```
    ///
    /// `SUSPEND_REQUESTED` means the running step finishes first; poll the
    /// workflow until it reports `SUSPENDED`.
    @POST
    @Path("/{workflowId}/suspend")
    public Map<String, Object> suspend(
            @PathParam("workflowId") @ValidId String workflowId, @Valid SuspendRequest request) {
        LOG.infov("Suspend workflow request: workflow={0}", workflowId);

        String reason = request != null ? request.reason() : null;
        SuspendOutcome outcome = workflowService.suspend(workflowId, reason);
        return Map.of("workflow_id", workflowId, "outcome", outcome);
    }

    /// Resumes a suspended or interrupted workflow in the background.
    ///
    /// ### Response (202 Accepted)
    /// ```json
    /// {"workflow_id": "trip-42", "status": "SUSPENDED"}
    /// ```
    @POST
    @Path("/{workflowId}/resume")
    public Response resume(@PathParam("workflowId") @ValidId String workflowId) {
        LOG.infov("Resume workflow request: workflow={0}", workflowId);

        WorkflowSnapshot snapshot = workflowService.resume(workflowId);
        return Response.accepted(Map.of("workflow_id", workflowId, "status", snapshot.status()))
                .build();
    }

    /// Lists every persisted snapshot version.
    @GET
    @Path("/snapshots")
    public List<SnapshotView> listSnapshots() {
        List<SnapshotView> views = new ArrayList<>();
        for (SnapshotSummary summary : workflowService.listSnapshots()) {
            views.add(SnapshotView.of(summary));
        }
        return views;
    }

    /// Returns the full persisted snapshot, the latest one unless `version` is given.
    @GET
    @Path("/snapshots/{workflowId}")
    public WorkflowSnapshot getSnapshot(
            @PathParam("workflowId") @ValidId String workflowId,
            @QueryParam("version") @Min(1) Long version) {
        return version != null
                ? workflowService.getSnapshot(workflowId, version)
                : workflowService.getSnapshot(workflowId);
    }

    /// Deletes every snapshot of a finished workflow.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"deleted": 7}
    /// ```
    @DELETE
    @Path("/snapshots/{workflowId}")
    public Map<String, Integer> deleteSnapshots(
            @PathParam("workflowId") @ValidId String workflowId) {
        LOG.infov("Delete snapshots request: workflow={0}", LogSanitizer.sanitize(workflowId));

        return Map.of("deleted", workflowService.deleteSnapshots(workflowId));
    }

    // --- DTOs ---

    public record CreateWorkflowRequest(
            @JsonProperty("workflow_id") @ValidId String workflowId,
            @JsonProperty("initial_message") @Size(max = InputValidator.MAX_MESSAGE_BYTES)
                    String initialMessage,
            @JsonProperty("max_steps") @Min(1) @Max(1000) Integer maxSteps,
            List<StepDescriptor> steps) {}

    public record SuspendRequest(@Size(max = 1024) String reason) {}

    public record SnapshotView(
            @JsonProperty("workflow_id") String workflowId,
            long version,
            WorkflowStatus status,
            Instant timestamp) {

        static SnapshotView of(SnapshotSummary summary) {
            return new SnapshotView(
                    summary.workflowId(), summary.version(), summary.status(), summary.timestamp());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record WorkflowView(
            @JsonProperty("workflow_id") String workflowId,
            WorkflowStatus status,
            long version,
            boolean executing,
            @JsonProperty("checkpoint_reason") String checkpointReason,
            @JsonProperty("updated_at") Instant updatedAt,
            List<StepView> steps,
            String output,
            String failure) {

        static WorkflowView of(WorkflowSnapshot snapshot, boolean executing) {
            List<StepView> steps = new ArrayList<>();
            for (int i = 0; i < snapshot.steps().size(); i++) {
                steps.add(StepView.of(snapshot.step(i), snapshot.stepState(i)));
            }
            return new WorkflowView(
                    snapshot.workflowId(),
                    snapshot.status(),
                    snapshot.version(),
                    executing,
                    snapshot.checkpointReason(),
                    snapshot.updatedAt(),
                    steps,
                    snapshot.output(),
                    snapshot.failureDetail());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record StepView(
            String name,
            String action,
            String status,
            int attempts,
            @JsonProperty("thinking_steps") int thinkingSteps,
            String output,
            boolean truncated,
            String error) {

        static StepView of(StepDescriptor step, StepState state) {
            return new StepView(
                    step.name(),
                    step.forward().kind(),
                    state.status().name(),
                    state.attemptCount(),
                    state.thinkingSteps(),
                    state.output(),
                    state.truncated(),
                    state.error());
        }
    }
}
