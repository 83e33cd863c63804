package io.agency.server.execution;

import io.agency.core.execution.ExecutionListener;
import io.agency.core.workflow.StepState;
import io.agency.core.workflow.WorkflowSnapshot;
import org.jboss.logging.Logger;

/// Logs saga progress to the server log at INFO level.
///
/// Enabled by the `agency.verbose.enabled` configuration property.
///
/// ### Log Format
/// ```
/// [workflowId] v3 RUNNING (step-succeeded)
/// [workflowId] → #0 reserve
/// [workflowId] ← #0 reserve SUCCEEDED attempts=1
/// [workflowId] ↺ #0 reserve
/// [workflowId] ↺ #0 reserve COMPENSATED
/// [workflowId] finished COMPENSATED at v7
/// ```
///
/// @apiNote **Side effects**: writes to the JBoss log category
/// `io.agency.server.execution.LoggingExecutionListener` at INFO level.
///
/// @implNote Thread-safe. Stateless.
public class LoggingExecutionListener implements ExecutionListener {

    private static final Logger LOG = Logger.getLogger(LoggingExecutionListener.class);

    @Override
    public void onCheckpoint(WorkflowSnapshot snapshot) {
        LOG.infov(
                "[{0}] v{1} {2} ({3})",
                snapshot.workflowId(),
                snapshot.version(),
                snapshot.status(),
                snapshot.checkpointReason());
    }

    @Override
    public void onStepStarted(String workflowId, int stepIndex, String stepName) {
        LOG.infov("[{0}] → #{1} {2}", workflowId, stepIndex, stepName);
    }

    @Override
    public void onStepFinished(String workflowId, int stepIndex, String stepName, StepState state) {
        if (state.error() != null) {
            LOG.infov(
                    "[{0}] ← #{1} {2} {3} attempts={4}: {5}",
                    workflowId,
                    stepIndex,
                    stepName,
                    state.status(),
                    state.attemptCount(),
                    state.error());
        } else {
            LOG.infov(
                    "[{0}] ← #{1} {2} {3} attempts={4}",
                    workflowId,
                    stepIndex,
                    stepName,
                    state.status(),
                    state.attemptCount());
        }
    }

    @Override
    public void onCompensationStarted(String workflowId, int stepIndex, String stepName) {
        LOG.infov("[{0}] ↺ #{1} {2}", workflowId, stepIndex, stepName);
    }

    @Override
    public void onCompensationFinished(
            String workflowId, int stepIndex, String stepName, StepState state) {
        LOG.infov("[{0}] ↺ #{1} {2} {3}", workflowId, stepIndex, stepName, state.status());
    }

    @Override
    public void onWorkflowFinished(WorkflowSnapshot snapshot) {
        LOG.infov(
                "[{0}] finished {1} at v{2}",
                snapshot.workflowId(),
                snapshot.status(),
                snapshot.version());
    }
}
