package io.agency.server.service;

import io.agency.core.AgencyConfig;
import io.agency.core.exception.CompensationFailedException;
import io.agency.core.execution.ProcessResult;
import io.agency.core.execution.SuspendOutcome;
import io.agency.core.execution.WorkflowManager;
import io.agency.core.state.SnapshotSummary;
import io.agency.core.workflow.StepDescriptor;
import io.agency.core.workflow.WorkflowSnapshot;
import io.agency.server.validation.LogSanitizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.jboss.logging.Logger;

/// Server-side facade over the {@link WorkflowManager}.
///
/// Fills in configured defaults, dispatches runs to the background pool and
/// logs how background runs end, since their outcome is only visible through
/// later status queries.
///
/// ### Contracts
/// - **Postcondition**: `create` and `resume` return as soon as the run is
///   submitted; the returned snapshot is the state at submission time
/// - **Failure**: rejections (duplicate id, busy, disabled suspend/resume,
///   storage errors) are raised on the calling thread
///
/// @see io.agency.server.api.WorkflowResource
/// @see io.agency.server.api.AgentResource
@ApplicationScoped
public class WorkflowService {

    private static final Logger LOG = Logger.getLogger(WorkflowService.class);

    private final WorkflowManager workflowManager;
    private final AgencyConfig config;

    @Inject
    public WorkflowService(WorkflowManager workflowManager, AgencyConfig config) {
        this.workflowManager =
                Objects.requireNonNull(workflowManager, "workflowManager must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Answers one message synchronously.
    ///
    /// @param message the user message, not blank
    /// @param maxSteps thinking-step bound, null for the configured default
    /// @return the answer, never null
    public ProcessResult process(String message, Integer maxSteps) {
        return workflowManager.process(message, maxSteps != null ? maxSteps : defaultMaxSteps());
    }

    /// Creates a workflow and submits it for execution.
    ///
    /// Without `steps` the workflow has a single reasoning step over
    /// `initialMessage`.
    ///
    /// @param workflowId caller-supplied identifier, not null
    /// @param initialMessage the originating message, may be null when steps are given
    /// @param maxSteps thinking-step bound, null for the configured default
    /// @param steps explicit step list, null or empty for the single-step form
    /// @return the snapshot as created, never null
    public WorkflowSnapshot create(
            String workflowId, String initialMessage, Integer maxSteps, List<StepDescriptor> steps) {
        int bound = maxSteps != null ? maxSteps : defaultMaxSteps();
        WorkflowSnapshot created =
                steps == null || steps.isEmpty()
                        ? workflowManager.create(workflowId, initialMessage, bound)
                        : workflowManager.create(workflowId, steps, bound, initialMessage);

        LOG.infov(
                "Workflow created: id={0}, steps={1}",
                LogSanitizer.sanitize(workflowId),
                created.steps().size());
        track(workflowId, workflowManager.startAsync(workflowId));
        return created;
    }

    /// Resumes a suspended or interrupted workflow in the background.
    ///
    /// @param workflowId workflow identifier, not null
    /// @return the reloaded snapshot the run starts from, never null
    public WorkflowSnapshot resume(String workflowId) {
        CompletableFuture<WorkflowSnapshot> run = workflowManager.resumeAsync(workflowId);
        LOG.infov("Workflow resume submitted: id={0}", LogSanitizer.sanitize(workflowId));
        track(workflowId, run);
        return run.isDone() && !run.isCompletedExceptionally()
                ? run.join()
                : workflowManager.get(workflowId);
    }

    public SuspendOutcome suspend(String workflowId, String reason) {
        SuspendOutcome outcome = workflowManager.suspend(workflowId, reason);
        LOG.infov(
                "Workflow suspend: id={0}, outcome={1}, reason={2}",
                LogSanitizer.sanitize(workflowId),
                outcome,
                LogSanitizer.sanitize(reason));
        return outcome;
    }

    public WorkflowSnapshot get(String workflowId) {
        return workflowManager.get(workflowId);
    }

    public boolean isExecuting(String workflowId) {
        return workflowManager.isExecuting(workflowId);
    }

    public List<SnapshotSummary> listSnapshots() {
        return workflowManager.listSnapshots();
    }

    public WorkflowSnapshot getSnapshot(String workflowId) {
        return workflowManager.getSnapshot(workflowId);
    }

    public WorkflowSnapshot getSnapshot(String workflowId, long version) {
        return workflowManager.getSnapshot(workflowId, version);
    }

    public int deleteSnapshots(String workflowId) {
        int removed = workflowManager.deleteSnapshots(workflowId);
        LOG.infov(
                "Workflow deleted: id={0}, versions={1}", LogSanitizer.sanitize(workflowId), removed);
        return removed;
    }

    private int defaultMaxSteps() {
        return config.getMaxThinkingSteps();
    }

    private static void track(String workflowId, CompletableFuture<WorkflowSnapshot> run) {
        String id = LogSanitizer.sanitize(workflowId);
        run.whenComplete(
                (snapshot, error) -> {
                    if (error == null) {
                        LOG.infov(
                                "Workflow run ended: id={0}, status={1}, version={2}",
                                id,
                                snapshot.status(),
                                snapshot.version());
                        return;
                    }
                    Throwable cause = error instanceof CompletionException ? error.getCause() : error;
                    if (cause instanceof CompensationFailedException cfe) {
                        LOG.errorv(
                                "Workflow {0} needs manual remediation: compensation of step #{1}"
                                        + " ({2}) failed: {3}",
                                id,
                                cfe.getStepIndex(),
                                cfe.getStepName(),
                                cfe.getMessage());
                    } else {
                        LOG.errorv(cause, "Workflow run aborted: id={0}", id);
                    }
                });
    }
}
