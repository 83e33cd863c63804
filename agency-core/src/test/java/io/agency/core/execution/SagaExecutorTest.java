package io.agency.core.execution;

import static io.agency.core.execution.EngineFixture.irreversible;
import static io.agency.core.execution.EngineFixture.recorded;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agency.core.agent.AgentResponse;
import io.agency.core.agent.ScriptedAgent;
import io.agency.core.exception.CompensationFailedException;
import io.agency.core.exception.StorageException;
import io.agency.core.state.FailingSnapshotStore;
import io.agency.core.state.SnapshotSummary;
import io.agency.core.tool.RecordingTool;
import io.agency.core.workflow.StepAction;
import io.agency.core.workflow.StepDescriptor;
import io.agency.core.workflow.StepState;
import io.agency.core.workflow.StepStatus;
import io.agency.core.workflow.Workflow;
import io.agency.core.workflow.WorkflowSnapshot;
import io.agency.core.workflow.WorkflowStatus;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SagaExecutorTest {

    private EngineFixture fixture;
    private FailingSnapshotStore store;
    private SagaExecutor executor;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        store = new FailingSnapshotStore();
        executor = new SagaExecutor(store, fixture.runner, ExecutionListener.NOOP);
    }

    private Workflow create(String id, StepDescriptor... steps) {
        WorkflowSnapshot initial = WorkflowSnapshot.initial(id, List.of(steps), 3, null);
        store.put(initial);
        return new Workflow(initial);
    }

    private static List<StepStatus> statuses(WorkflowSnapshot snapshot) {
        return snapshot.stepStates().stream().map(StepState::status).toList();
    }

    @Nested
    class ForwardPath {

        @Test
        void shouldRunStepsInDeclaredOrderAndComplete() {
            var workflow = create("wf-1", recorded("a"), recorded("b"), recorded("c"));

            var result = executor.runToCompletion(workflow);

            assertThat(result.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(statuses(result)).containsOnly(StepStatus.SUCCEEDED);
            assertThat(fixture.tool.calls()).containsExactly("a", "b", "c");
            assertThat(result.output()).isEqualTo("done:c");
        }

        @Test
        void shouldPersistEveryVersionContiguously() {
            var workflow = create("wf-1", recorded("a"), recorded("b"));

            var result = executor.runToCompletion(workflow);

            var versions = store.list().stream().map(SnapshotSummary::version).toList();
            assertThat(versions).hasSize((int) result.version());
            for (int i = 0; i < versions.size(); i++) {
                assertThat(versions.get(i)).isEqualTo(i + 1L);
            }
            assertThat(store.getLatest("wf-1")).contains(result);
        }

        @Test
        void shouldCheckpointStepAsInProgressBeforeRunningIt() {
            var workflow = create("wf-1", recorded("a"));

            executor.runToCompletion(workflow);

            // v1 created, v2 running, v3 step-started, v4 step-succeeded, v5 completed
            var started = store.get("wf-1", 3).orElseThrow();
            assertThat(started.checkpointReason()).isEqualTo("step-started:a");
            assertThat(started.stepState(0).status()).isEqualTo(StepStatus.IN_PROGRESS);
            assertThat(started.stepState(0).attemptCount()).isEqualTo(1);
        }

        @Test
        void shouldRecordTransientRetriesInAttemptCount() {
            fixture.tool.failTransiently("a", 2);
            var workflow = create("wf-1", recorded("a"));

            var result = executor.runToCompletion(workflow);

            assertThat(result.stepState(0).status()).isEqualTo(StepStatus.SUCCEEDED);
            assertThat(result.stepState(0).attemptCount()).isEqualTo(3);
            assertThat(fixture.tool.calls()).containsExactly("a", "a", "a");
        }

        @Test
        void shouldMarkTruncatedReasoningAsSucceeded() {
            // Scenario B: the model never answers within one thinking step
            fixture.agent(
                    ScriptedAgent.of(
                            "assistant",
                            AgentResponse.ToolRequest.of(
                                    RecordingTool.NAME, RecordingTool.label("probe"))));
            WorkflowSnapshot initial =
                    WorkflowSnapshot.initial(
                            "wf-b",
                            List.of(StepDescriptor.of("think", StepAction.Reason.of("hard task"))),
                            1,
                            "hard task");
            store.put(initial);

            var result = executor.runToCompletion(new Workflow(initial));

            assertThat(result.status()).isEqualTo(WorkflowStatus.COMPLETED);
            StepState step = result.stepState(0);
            assertThat(step.status()).isEqualTo(StepStatus.SUCCEEDED);
            assertThat(step.truncated()).isTrue();
            assertThat(step.output()).isEqualTo("done:probe");
            assertThat(step.thinkingSteps()).isEqualTo(1);
        }

        @Test
        void shouldPassPreviousOutputToNextStep() {
            var agent =
                    ScriptedAgent.answering(
                            "assistant",
                            context ->
                                    AgentResponse.TextResponse.of(
                                            "saw " + context.get("previous_output")));
            fixture.agent(agent);
            var workflow =
                    create(
                            "wf-1",
                            recorded("a"),
                            StepDescriptor.of("summarize", StepAction.Reason.of("summarize")));

            var result = executor.runToCompletion(workflow);

            assertThat(result.output()).isEqualTo("saw done:a");
            assertThat(agent.contexts().get(0))
                    .containsEntry("workflow_id", "wf-1")
                    .containsEntry("step", "summarize")
                    .containsEntry("step_index", 1);
        }
    }

    @Nested
    class CompensationPath {

        @Test
        void shouldCompensatePriorStepsWhenMiddleStepFails() {
            // Scenario A
            fixture.tool.failOn("b");
            var workflow = create("wf-a", recorded("a"), recorded("b"), recorded("c"));

            var result = executor.runToCompletion(workflow);

            assertThat(result.status()).isEqualTo(WorkflowStatus.COMPENSATED);
            assertThat(statuses(result))
                    .containsExactly(
                            StepStatus.COMPENSATED, StepStatus.FAILED, StepStatus.NOT_STARTED);
            assertThat(result.stepState(1).error()).contains("refused: b");
            assertThat(fixture.tool.calls()).containsExactly("a", "b", "undo-a");
        }

        @Test
        void shouldCompensateInExactReverseOrder() {
            fixture.tool.failOn("d");
            var workflow =
                    create("wf-1", recorded("a"), recorded("b"), recorded("c"), recorded("d"));

            executor.runToCompletion(workflow);

            assertThat(fixture.tool.calls())
                    .containsExactly("a", "b", "c", "d", "undo-c", "undo-b", "undo-a");
        }

        @Test
        void shouldSkipStepsWithoutCompensation() {
            fixture.tool.failOn("c");
            var workflow = create("wf-1", recorded("a"), irreversible("b"), recorded("c"));

            var result = executor.runToCompletion(workflow);

            assertThat(result.status()).isEqualTo(WorkflowStatus.COMPENSATED);
            assertThat(statuses(result))
                    .containsExactly(
                            StepStatus.COMPENSATED, StepStatus.SUCCEEDED, StepStatus.FAILED);
            assertThat(fixture.tool.calls()).containsExactly("a", "b", "c", "undo-a");
        }

        @Test
        void shouldCompensateWhenToolFailsWithEngineException() {
            fixture.tool.throwOn("ledger", new StorageException("ledger backend down"));
            var workflow = create("wf-1", recorded("a"), recorded("ledger"));

            var result = executor.runToCompletion(workflow);

            assertThat(result.status()).isEqualTo(WorkflowStatus.COMPENSATED);
            assertThat(statuses(result))
                    .containsExactly(StepStatus.COMPENSATED, StepStatus.FAILED);
            assertThat(result.stepState(1).error()).contains("ledger backend down");
            assertThat(fixture.tool.calls()).containsExactly("a", "ledger", "undo-a");
            assertThat(store.getLatest("wf-1").orElseThrow().status())
                    .isEqualTo(WorkflowStatus.COMPENSATED);
        }

        @Test
        void shouldReachCompensatedWhenFirstStepFails() {
            fixture.tool.failOn("a");
            var workflow = create("wf-1", recorded("a"), recorded("b"));

            var result = executor.runToCompletion(workflow);

            assertThat(result.status()).isEqualTo(WorkflowStatus.COMPENSATED);
            assertThat(fixture.tool.calls()).containsExactly("a");
        }

        @Test
        void shouldHaltAtFirstFailedCompensation() {
            fixture.tool.failOn("c").failOn("undo-b");
            var workflow = create("wf-1", recorded("a"), recorded("b"), recorded("c"));

            assertThatThrownBy(() -> executor.runToCompletion(workflow))
                    .isInstanceOf(CompensationFailedException.class)
                    .satisfies(
                            e -> {
                                var failure = (CompensationFailedException) e;
                                assertThat(failure.getWorkflowId()).isEqualTo("wf-1");
                                assertThat(failure.getStepIndex()).isEqualTo(1);
                                assertThat(failure.getStepName()).isEqualTo("b");
                            });

            var latest = store.getLatest("wf-1").orElseThrow();
            assertThat(latest.status()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(statuses(latest))
                    .containsExactly(
                            StepStatus.SUCCEEDED,
                            StepStatus.COMPENSATION_FAILED,
                            StepStatus.FAILED);
            assertThat(latest.failureDetail()).contains("b").contains("refused: undo-b");
            assertThat(fixture.tool.calls()).containsExactly("a", "b", "c", "undo-b");
            assertThat(workflow.current()).isEqualTo(latest);
        }
    }

    @Nested
    class Suspension {

        @Test
        void shouldSuspendAtStepBoundaryAndResumeAtNextStep() {
            // Scenario C
            AtomicReference<Workflow> handle = new AtomicReference<>();
            var suspending =
                    new SagaExecutor(
                            store,
                            fixture.runner,
                            new ExecutionListener() {
                                @Override
                                public void onStepFinished(
                                        String workflowId, int index, String name, StepState state) {
                                    if (index == 0) {
                                        handle.get().requestSuspend("operator pause");
                                    }
                                }
                            });
            handle.set(create("wf-c", recorded("a"), recorded("b")));

            var suspended = suspending.runToCompletion(handle.get());

            assertThat(suspended.status()).isEqualTo(WorkflowStatus.SUSPENDED);
            var reloaded = store.getLatest("wf-c").orElseThrow();
            assertThat(reloaded.status()).isEqualTo(WorkflowStatus.SUSPENDED);
            assertThat(reloaded.checkpointReason()).isEqualTo("operator pause");
            assertThat(statuses(reloaded))
                    .containsExactly(StepStatus.SUCCEEDED, StepStatus.NOT_STARTED);
            assertThat(handle.get().isSuspendRequested()).isFalse();

            var resumed = new Workflow(reloaded);
            assertThat(executor.prepareResume(resumed).status()).isEqualTo(WorkflowStatus.RUNNING);
            var result = executor.runToCompletion(resumed);

            assertThat(result.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(fixture.tool.calls()).containsExactly("a", "b");
        }

        @Test
        void shouldIgnoreSuspendRequestWhileCompensating() {
            fixture.tool.failOn("b");
            var workflow = create("wf-1", recorded("a"), recorded("b"));
            executor.advance(workflow); // start
            executor.advance(workflow); // a
            executor.advance(workflow); // b fails
            workflow.requestSuspend(null);

            var result = executor.runToCompletion(workflow);

            assertThat(result.status()).isEqualTo(WorkflowStatus.COMPENSATED);
        }
    }

    @Nested
    class Persistence {

        @Test
        void shouldNotReportResultWhoseSnapshotWasRejected() {
            // Scenario D
            store.failWhen(s -> "step-succeeded:a".equals(s.checkpointReason()));
            var workflow = create("wf-d", recorded("a"), recorded("b"));

            assertThatThrownBy(() -> executor.runToCompletion(workflow))
                    .isInstanceOf(StorageException.class)
                    .hasMessageContaining("disk full");

            assertThat(workflow.current().status()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(workflow.current().stepState(0).status())
                    .isEqualTo(StepStatus.IN_PROGRESS);
            assertThat(store.getLatest("wf-d")).contains(workflow.current());
        }

        @Test
        void shouldCompensateInsteadOfRerunningInterruptedStep() {
            store.failWhen(s -> "step-succeeded:b".equals(s.checkpointReason()));
            var workflow = create("wf-1", recorded("a"), recorded("b"), recorded("c"));
            assertThatThrownBy(() -> executor.runToCompletion(workflow))
                    .isInstanceOf(StorageException.class);
            store.heal();

            var reloaded = new Workflow(store.getLatest("wf-1").orElseThrow());
            var recovered = executor.prepareResume(reloaded);

            assertThat(recovered.status()).isEqualTo(WorkflowStatus.COMPENSATING);
            assertThat(recovered.stepState(1).status()).isEqualTo(StepStatus.FAILED);
            assertThat(recovered.stepState(1).error()).contains("Interrupted");

            var result = executor.runToCompletion(reloaded);

            assertThat(result.status()).isEqualTo(WorkflowStatus.COMPENSATED);
            assertThat(fixture.tool.calls()).containsExactly("a", "b", "undo-a");
        }

        @Test
        void shouldLeaveTerminalWorkflowUntouchedOnResume() {
            var workflow = create("wf-1", recorded("a"));
            var completed = executor.runToCompletion(workflow);

            var reloaded = new Workflow(store.getLatest("wf-1").orElseThrow());
            var prepared = executor.prepareResume(reloaded);
            var again = executor.runToCompletion(reloaded);

            assertThat(prepared).isEqualTo(completed);
            assertThat(again.version()).isEqualTo(completed.version());
            assertThat(fixture.tool.calls()).containsExactly("a");
        }

        @Test
        void shouldRefuseToAdvanceWithStepInProgress() {
            store.failWhen(s -> "step-succeeded:a".equals(s.checkpointReason()));
            var workflow = create("wf-1", recorded("a"));
            assertThatThrownBy(() -> executor.runToCompletion(workflow))
                    .isInstanceOf(StorageException.class);

            assertThatThrownBy(() -> executor.advance(workflow))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("in progress");
        }
    }
}
