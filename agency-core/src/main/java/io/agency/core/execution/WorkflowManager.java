package io.agency.core.execution;

import io.agency.core.AgencyConfig;
import io.agency.core.exception.ConfigurationException;
import io.agency.core.exception.SnapshotVersionConflictException;
import io.agency.core.exception.UnrecoverableException;
import io.agency.core.exception.WorkflowBusyException;
import io.agency.core.exception.WorkflowConflictException;
import io.agency.core.exception.WorkflowNotFoundException;
import io.agency.core.state.InMemorySnapshotStore;
import io.agency.core.state.SnapshotStore;
import io.agency.core.state.SnapshotSummary;
import io.agency.core.workflow.StepAction;
import io.agency.core.workflow.StepDescriptor;
import io.agency.core.workflow.StepState;
import io.agency.core.workflow.StepStatus;
import io.agency.core.workflow.Workflow;
import io.agency.core.workflow.WorkflowSnapshot;
import io.agency.core.workflow.WorkflowStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Owns the set of live workflows and the executors that drive them.
///
/// Every operation that advances a workflow first claims it in an
/// {@link ExecutionGuard}; a concurrent start or resume of the same id fails
/// with {@link WorkflowBusyException} instead of running a second executor.
/// Background runs use the supplied {@link ExecutorService}.
///
/// ### Lifecycle
/// ```
/// create ──► start/startAsync ──► RUNNING ──► COMPLETED | COMPENSATED | FAILED
///                                    │
///                              suspend (step boundary)
///                                    ▼
///                                SUSPENDED ──► resume/resumeAsync ──► RUNNING
/// ```
///
/// ### Contracts
/// - **Exclusivity**: at most one thread advances a given workflow
/// - **Idempotence**: resuming a terminal workflow returns it unchanged
/// - **Validation**: invalid definitions are rejected before anything is persisted
///
/// @implNote Thread-safe. Request threads and pool threads share the live
/// handles through a concurrent map; handle state only changes through
/// {@link SagaExecutor} commits.
///
/// @see SagaExecutor
/// @see io.agency.core.AgencyEnvironment
public class WorkflowManager {

    /// Name of the single step built for a message-only workflow.
    public static final String RESPOND_STEP = "respond";

    private static final Logger logger = Logger.getLogger(WorkflowManager.class.getName());

    private final AgencyConfig config;
    private final SnapshotStore snapshotStore;
    private final ActionRunner actionRunner;
    private final SagaExecutor executor;
    private final ExecutorService executorService;
    private final ExecutionGuard guard = new ExecutionGuard();
    private final Map<String, Workflow> workflows = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<WorkflowSnapshot>> inFlight =
            new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    public WorkflowManager(
            AgencyConfig config,
            SnapshotStore snapshotStore,
            ActionRunner actionRunner,
            ExecutionListener listener,
            ExecutorService executorService) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "snapshotStore must not be null");
        this.actionRunner = Objects.requireNonNull(actionRunner, "actionRunner must not be null");
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        this.executor = new SagaExecutor(snapshotStore, actionRunner, listener);
    }

    // --- Creation ---

    /// Creates a workflow with one reasoning step over the message.
    ///
    /// @param workflowId caller-supplied identifier, not blank
    /// @param initialMessage the task for the default agent, not blank
    /// @param maxThinkingSteps reasoning bound, at least 1
    /// @return the persisted `PENDING` snapshot, never null
    /// @throws ConfigurationException if the id is taken or an argument is invalid
    public WorkflowSnapshot create(String workflowId, String initialMessage, int maxThinkingSteps) {
        if (initialMessage == null || initialMessage.isBlank()) {
            throw new ConfigurationException("initial_message must not be blank");
        }
        List<StepDescriptor> steps =
                List.of(StepDescriptor.of(RESPOND_STEP, StepAction.Reason.of(initialMessage)));
        return create(workflowId, steps, maxThinkingSteps, initialMessage);
    }

    /// Creates a multi-step saga from a pre-built step list.
    ///
    /// @param workflowId caller-supplied identifier, not blank
    /// @param steps ordered step definitions with unique names, not empty
    /// @param maxThinkingSteps reasoning bound per action, at least 1
    /// @param initialMessage originating message, may be null
    /// @return the persisted `PENDING` snapshot, never null
    /// @throws ConfigurationException if the id is taken or the definition is invalid
    /// @throws io.agency.core.exception.StorageException if the first snapshot cannot be written
    public WorkflowSnapshot create(
            String workflowId,
            List<StepDescriptor> steps,
            int maxThinkingSteps,
            String initialMessage) {
        validateDefinition(workflowId, steps, maxThinkingSteps);

        WorkflowSnapshot initial =
                WorkflowSnapshot.initial(workflowId, steps, maxThinkingSteps, initialMessage);
        Workflow handle = new Workflow(initial);
        if (workflows.putIfAbsent(workflowId, handle) != null) {
            throw duplicate(workflowId);
        }
        try {
            snapshotStore.put(initial);
        } catch (SnapshotVersionConflictException e) {
            workflows.remove(workflowId, handle);
            throw duplicate(workflowId);
        } catch (RuntimeException e) {
            workflows.remove(workflowId, handle);
            throw e;
        }
        logger.info("Workflow '" + workflowId + "' created with " + steps.size() + " step(s)");
        return initial;
    }

    // --- Execution ---

    /// Runs a `PENDING` workflow on the calling thread until it stops.
    ///
    /// @param workflowId workflow identifier, not null
    /// @return the final committed snapshot, never null
    /// @throws WorkflowBusyException if an executor already holds the workflow
    /// @throws io.agency.core.exception.CompensationFailedException if a compensation fails
    public WorkflowSnapshot start(String workflowId) {
        Workflow handle = requireHandle(workflowId);
        guard.claim(workflowId);
        try {
            requirePending(handle);
            return executor.runToCompletion(handle);
        } finally {
            guard.release(workflowId);
        }
    }

    /// Submits a `PENDING` workflow to the background pool.
    ///
    /// Rejections (unknown id, busy, not pending) are raised on the calling thread.
    ///
    /// @param workflowId workflow identifier, not null
    /// @return future completed with the final snapshot of the run, never null
    public CompletableFuture<WorkflowSnapshot> startAsync(String workflowId) {
        requireAccepting();
        Workflow handle = requireHandle(workflowId);
        guard.claim(workflowId);
        try {
            requirePending(handle);
        } catch (RuntimeException e) {
            guard.release(workflowId);
            throw e;
        }
        return submit(handle);
    }

    /// Reloads the latest snapshot and runs the workflow on the calling thread.
    ///
    /// A step left `IN_PROGRESS` by a crash is failed and compensated rather than
    /// re-run. Terminal workflows are returned unchanged.
    ///
    /// @param workflowId workflow identifier, not null
    /// @return the final committed snapshot, never null
    /// @throws ConfigurationException if suspend/resume is disabled
    /// @throws WorkflowNotFoundException if no snapshot exists
    /// @throws WorkflowBusyException if an executor already holds the workflow
    public WorkflowSnapshot resume(String workflowId) {
        requireSuspendResume("resume");
        guard.claim(workflowId);
        try {
            Workflow handle = reload(workflowId);
            if (handle.current().status().isTerminal()) {
                return handle.current();
            }
            return executor.runToCompletion(handle);
        } finally {
            guard.release(workflowId);
        }
    }

    /// Background variant of {@link #resume(String)}.
    ///
    /// Reloading and crash recovery happen on the calling thread, so storage
    /// failures are raised to the caller; only the run itself is submitted.
    ///
    /// @param workflowId workflow identifier, not null
    /// @return future completed with the final snapshot of the run, never null
    public CompletableFuture<WorkflowSnapshot> resumeAsync(String workflowId) {
        requireSuspendResume("resume");
        requireAccepting();
        guard.claim(workflowId);
        Workflow handle;
        try {
            handle = reload(workflowId);
        } catch (RuntimeException e) {
            guard.release(workflowId);
            throw e;
        }
        if (handle.current().status().isTerminal()) {
            guard.release(workflowId);
            return CompletableFuture.completedFuture(handle.current());
        }
        return submit(handle);
    }

    /// Requests a cooperative suspend.
    ///
    /// A workflow held by an executor suspends at its next step boundary. An idle
    /// `RUNNING` workflow is suspended immediately.
    ///
    /// @param workflowId workflow identifier, not null
    /// @param reason recorded as the checkpoint reason, may be null
    /// @return what happened, never null
    /// @throws ConfigurationException if suspend/resume is disabled
    /// @throws WorkflowConflictException if the workflow is not running
    public SuspendOutcome suspend(String workflowId, String reason) {
        requireSuspendResume("suspend");
        Workflow handle = requireHandle(workflowId);
        WorkflowStatus status = handle.current().status();
        if (status == WorkflowStatus.SUSPENDED) {
            return SuspendOutcome.ALREADY_SUSPENDED;
        }
        if (status != WorkflowStatus.RUNNING && status != WorkflowStatus.PENDING) {
            throw new WorkflowConflictException(
                    "Workflow '" + workflowId + "' cannot be suspended while " + status);
        }

        handle.requestSuspend(reason);
        if (!guard.tryClaim(workflowId)) {
            logger.info("Suspend requested for workflow '" + workflowId + "'");
            return SuspendOutcome.SUSPEND_REQUESTED;
        }
        try {
            WorkflowSnapshot current = handle.current();
            if (current.status() == WorkflowStatus.SUSPENDED) {
                return SuspendOutcome.SUSPENDED;
            }
            if (current.status() != WorkflowStatus.RUNNING
                    || current.indexOf(StepStatus.IN_PROGRESS) >= 0) {
                handle.takeSuspendRequest();
                throw new WorkflowConflictException(
                        "Workflow '"
                                + workflowId
                                + "' is not running an executor and cannot be suspended while "
                                + current.status());
            }
            executor.advance(handle);
            return SuspendOutcome.SUSPENDED;
        } finally {
            guard.release(workflowId);
        }
    }

    // --- Queries ---

    /// Returns the last committed state of a workflow.
    ///
    /// @param workflowId workflow identifier, not null
    /// @return the committed snapshot, never null
    /// @throws WorkflowNotFoundException if the workflow is unknown
    public WorkflowSnapshot get(String workflowId) {
        Workflow handle = workflows.get(workflowId);
        if (handle != null) {
            return handle.current();
        }
        return snapshotStore
                .getLatest(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    /// Returns whether an executor currently holds the workflow.
    public boolean isExecuting(String workflowId) {
        return guard.isClaimed(workflowId);
    }

    public List<SnapshotSummary> listSnapshots() {
        return snapshotStore.list();
    }

    /// @throws WorkflowNotFoundException if no snapshot exists
    public WorkflowSnapshot getSnapshot(String workflowId) {
        return snapshotStore
                .getLatest(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    /// @throws WorkflowNotFoundException if that version does not exist
    public WorkflowSnapshot getSnapshot(String workflowId, long version) {
        return snapshotStore
                .get(workflowId, version)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId + "@" + version));
    }

    // --- Deletion ---

    /// Removes every snapshot of a terminal workflow and forgets it.
    ///
    /// @param workflowId workflow identifier, not null
    /// @return number of snapshot versions removed
    /// @throws WorkflowNotFoundException if the workflow is unknown
    /// @throws WorkflowConflictException if the workflow is live
    public int deleteSnapshots(String workflowId) {
        WorkflowSnapshot latest = get(workflowId);
        if (guard.isClaimed(workflowId)) {
            throw new WorkflowBusyException(workflowId);
        }
        if (!latest.status().isTerminal()) {
            throw new WorkflowConflictException(
                    "Workflow '" + workflowId + "' is " + latest.status() + " and cannot be deleted");
        }
        int removed = snapshotStore.delete(workflowId);
        workflows.remove(workflowId);
        logger.info("Deleted " + removed + " snapshot(s) of workflow '" + workflowId + "'");
        return removed;
    }

    /// Removes terminal workflows last updated before the cutoff.
    ///
    /// @param cutoff retention boundary, not null
    /// @return number of workflows removed
    public int purgeTerminalOlderThan(Instant cutoff) {
        int removed = snapshotStore.deleteTerminalOlderThan(cutoff);
        workflows.entrySet()
                .removeIf(
                        entry -> {
                            WorkflowSnapshot current = entry.getValue().current();
                            return current.status().isTerminal()
                                    && current.updatedAt().isBefore(cutoff)
                                    && !guard.isClaimed(entry.getKey());
                        });
        if (removed > 0) {
            logger.info("Purged " + removed + " terminal workflow(s) older than " + cutoff);
        }
        return removed;
    }

    // --- Single-turn processing ---

    /// Answers one message with the configured default thinking-step bound.
    ///
    /// @see #process(String, int)
    public ProcessResult process(String message) {
        return process(message, config.getMaxThinkingSteps());
    }

    /// Answers one message through a throwaway one-step workflow.
    ///
    /// The run uses its own in-memory snapshot store, so nothing is written to the
    /// shared store and no workflow id is registered.
    ///
    /// @param message the user message, not blank
    /// @param maxThinkingSteps reasoning bound, at least 1
    /// @return the answer, never null
    /// @throws ConfigurationException if an argument is invalid
    /// @throws UnrecoverableException if the reasoning step failed
    public ProcessResult process(String message, int maxThinkingSteps) {
        if (message == null || message.isBlank()) {
            throw new ConfigurationException("message must not be blank");
        }
        if (maxThinkingSteps < 1) {
            throw new ConfigurationException("max_steps must be at least 1");
        }

        String id = "process-" + UUID.randomUUID();
        WorkflowSnapshot initial =
                WorkflowSnapshot.initial(
                        id,
                        List.of(StepDescriptor.of(RESPOND_STEP, StepAction.Reason.of(message))),
                        maxThinkingSteps,
                        message);
        InMemorySnapshotStore scratch = new InMemorySnapshotStore();
        scratch.put(initial);
        SagaExecutor adHoc = new SagaExecutor(scratch, actionRunner, ExecutionListener.NOOP);

        WorkflowSnapshot result = adHoc.runToCompletion(new Workflow(initial));
        StepState step = result.stepState(0);
        if (result.status() != WorkflowStatus.COMPLETED) {
            throw new UnrecoverableException(
                    step.error() != null ? step.error() : "Processing ended " + result.status());
        }
        return new ProcessResult(step.output(), step.thinkingSteps(), !step.truncated());
    }

    // --- Lifecycle ---

    /// Registers unfinished workflows found in the snapshot store.
    ///
    /// Suspended workflows wait for an explicit resume. Interrupted ones
    /// (`PENDING`, `RUNNING`, `COMPENSATING`) are resumed in the background when
    /// suspend/resume is enabled and startup resumption is on; otherwise they are
    /// abandoned and left as they are.
    ///
    /// @return the ids found per category, never null
    /// @throws io.agency.core.exception.StorageException if the store cannot be listed
    public RecoveryReport recover() {
        List<String> suspended = new ArrayList<>();
        List<String> resumed = new ArrayList<>();
        List<String> abandoned = new ArrayList<>();

        for (WorkflowSnapshot latest : snapshotStore.listLatest()) {
            WorkflowStatus status = latest.status();
            if (status.isTerminal()) {
                continue;
            }
            String id = latest.workflowId();
            workflows.putIfAbsent(id, new Workflow(latest));

            if (status == WorkflowStatus.SUSPENDED) {
                suspended.add(id);
            } else if (!config.isEnableSuspendResume() || !config.isResumeInterruptedOnStartup()) {
                logger.warning(
                        "Workflow '" + id + "' was interrupted while " + status + "; abandoned");
                abandoned.add(id);
            } else {
                try {
                    resumeAsync(id);
                    resumed.add(id);
                } catch (RuntimeException e) {
                    logger.log(Level.SEVERE, "Failed to resume workflow '" + id + "'", e);
                    abandoned.add(id);
                }
            }
        }

        RecoveryReport report = new RecoveryReport(suspended, resumed, abandoned);
        if (report.total() > 0) {
            logger.info(
                    "Recovered "
                            + report.total()
                            + " workflow(s): "
                            + suspended.size()
                            + " suspended, "
                            + resumed.size()
                            + " resumed, "
                            + abandoned.size()
                            + " abandoned");
        }
        return report;
    }

    /// Stops accepting background runs and waits for in-flight ones.
    ///
    /// When suspend/resume is enabled every running workflow is asked to suspend
    /// at its next step boundary first, so the wait is bounded by one step.
    ///
    /// @param timeout how long to wait, not null
    /// @return `true` if every in-flight run finished in time
    public boolean shutdown(Duration timeout) {
        accepting = false;
        Set<String> running = new HashSet<>(guard.claimed());
        if (config.isEnableSuspendResume()) {
            for (String id : running) {
                Workflow handle = workflows.get(id);
                if (handle != null) {
                    handle.requestSuspend("shutdown");
                }
            }
        }
        if (!running.isEmpty()) {
            logger.info("Waiting for " + running.size() + " workflow(s) to reach a step boundary");
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        for (Map.Entry<String, CompletableFuture<WorkflowSnapshot>> entry : inFlight.entrySet()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            try {
                entry.getValue().get(remaining, TimeUnit.NANOSECONDS);
            } catch (ExecutionException e) {
                logger.fine("Workflow '" + entry.getKey() + "' ended with " + e.getCause());
            } catch (TimeoutException e) {
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        boolean drained = inFlight.isEmpty();
        if (!drained) {
            logger.warning(
                    inFlight.size() + " workflow(s) still running at shutdown: " + inFlight.keySet());
        }
        return drained;
    }

    // --- Helpers ---

    private CompletableFuture<WorkflowSnapshot> submit(Workflow handle) {
        String id = handle.getId();
        CompletableFuture<WorkflowSnapshot> future = new CompletableFuture<>();
        inFlight.put(id, future);
        try {
            executorService.execute(() -> run(handle, future));
        } catch (RejectedExecutionException e) {
            inFlight.remove(id, future);
            guard.release(id);
            throw new WorkflowConflictException("Executor is not accepting workflow '" + id + "'");
        }
        return future;
    }

    private void run(Workflow handle, CompletableFuture<WorkflowSnapshot> future) {
        String id = handle.getId();
        WorkflowSnapshot result = null;
        RuntimeException failure = null;
        try {
            result = executor.runToCompletion(handle);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Workflow '" + id + "' stopped with an error", e);
            failure = e;
        } finally {
            inFlight.remove(id, future);
            guard.release(id);
        }
        // Complete after release so a caller joining the future can act on the workflow again.
        if (failure != null) {
            future.completeExceptionally(failure);
        } else {
            future.complete(result);
        }
    }

    /// Refreshes the live handle from the latest persisted state. Caller holds the claim.
    ///
    /// The handle is updated in place so a suspend request raised while the
    /// snapshot loads still reaches the resumed run.
    private Workflow reload(String workflowId) {
        WorkflowSnapshot latest =
                snapshotStore
                        .getLatest(workflowId)
                        .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
        Workflow handle =
                workflows.compute(
                        workflowId,
                        (id, existing) -> {
                            if (existing == null) {
                                return new Workflow(latest);
                            }
                            existing.commit(latest);
                            return existing;
                        });
        executor.prepareResume(handle);
        return handle;
    }

    private Workflow requireHandle(String workflowId) {
        Workflow handle = workflows.get(workflowId);
        if (handle == null) {
            throw new WorkflowNotFoundException(workflowId);
        }
        return handle;
    }

    private static void requirePending(Workflow handle) {
        WorkflowStatus status = handle.current().status();
        if (status != WorkflowStatus.PENDING) {
            throw new WorkflowConflictException(
                    "Workflow '" + handle.getId() + "' was already started and is " + status);
        }
    }

    private void requireSuspendResume(String operation) {
        if (!config.isEnableSuspendResume()) {
            throw new ConfigurationException("Cannot " + operation + ": suspend/resume is disabled");
        }
    }

    private void requireAccepting() {
        if (!accepting) {
            throw new WorkflowConflictException("Workflow manager is shutting down");
        }
    }

    private void validateDefinition(
            String workflowId, List<StepDescriptor> steps, int maxThinkingSteps) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new ConfigurationException("workflow_id must not be blank");
        }
        if (steps == null || steps.isEmpty()) {
            throw new ConfigurationException("Workflow '" + workflowId + "' has no steps");
        }
        if (maxThinkingSteps < 1) {
            throw new ConfigurationException("max_steps must be at least 1");
        }
        Set<String> names = new HashSet<>();
        for (StepDescriptor step : steps) {
            if (step == null) {
                throw new ConfigurationException("Workflow '" + workflowId + "' has a null step");
            }
            if (!names.add(step.name())) {
                throw new ConfigurationException(
                        "Workflow '" + workflowId + "' has duplicate step name: " + step.name());
            }
        }
        if (snapshotStore.getLatest(workflowId).isPresent()) {
            throw duplicate(workflowId);
        }
    }

    private static ConfigurationException duplicate(String workflowId) {
        return new ConfigurationException("Workflow already exists: " + workflowId);
    }
}
