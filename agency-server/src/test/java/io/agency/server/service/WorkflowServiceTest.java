package io.agency.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.agency.core.AgencyConfig;
import io.agency.core.exception.ConfigurationException;
import io.agency.core.exception.WorkflowBusyException;
import io.agency.core.execution.ProcessResult;
import io.agency.core.execution.WorkflowManager;
import io.agency.core.workflow.StepAction;
import io.agency.core.workflow.StepDescriptor;
import io.agency.core.workflow.WorkflowSnapshot;
import io.agency.core.workflow.WorkflowStatus;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WorkflowServiceTest {

    @Mock private WorkflowManager workflowManager;
    private WorkflowService service;

    @BeforeEach
    void setUp() {
        service =
                new WorkflowService(
                        workflowManager, AgencyConfig.builder().maxThinkingSteps(7).build());
    }

    private static WorkflowSnapshot snapshot(String id, List<StepDescriptor> steps) {
        return WorkflowSnapshot.initial(id, steps, 7, "hello");
    }

    @Nested
    class Process {

        @Test
        void shouldUseConfiguredBoundWhenMissing() {
            when(workflowManager.process("hi", 7)).thenReturn(new ProcessResult("hey", 1, true));

            assertThat(service.process("hi", null).response()).isEqualTo("hey");
        }

        @Test
        void shouldPassExplicitBound() {
            when(workflowManager.process("hi", 2)).thenReturn(new ProcessResult("", 2, false));

            assertThat(service.process("hi", 2).completed()).isFalse();
        }
    }

    @Nested
    class Create {

        @Test
        void shouldCreateSingleStepWorkflowFromMessage() {
            var created =
                    snapshot("wf-1", List.of(StepDescriptor.of("respond", StepAction.Reason.of("hello"))));
            when(workflowManager.create("wf-1", "hello", 7)).thenReturn(created);
            when(workflowManager.startAsync("wf-1"))
                    .thenReturn(CompletableFuture.completedFuture(created));

            assertThat(service.create("wf-1", "hello", null, null)).isSameAs(created);
            verify(workflowManager).startAsync("wf-1");
        }

        @Test
        void shouldCreateFromExplicitSteps() {
            List<StepDescriptor> steps =
                    List.of(
                            StepDescriptor.of("a", StepAction.NoOp.of()),
                            StepDescriptor.of("b", StepAction.NoOp.of()));
            var created = snapshot("wf-2", steps);
            when(workflowManager.create("wf-2", steps, 3, null)).thenReturn(created);
            when(workflowManager.startAsync("wf-2")).thenReturn(new CompletableFuture<>());

            assertThat(service.create("wf-2", null, 3, steps).steps()).hasSize(2);
        }

        @Test
        void shouldNotStartRejectedWorkflow() {
            when(workflowManager.create("wf-1", "hello", 7))
                    .thenThrow(new ConfigurationException("Workflow 'wf-1' already exists"));

            assertThatThrownBy(() -> service.create("wf-1", "hello", null, List.of()))
                    .isInstanceOf(ConfigurationException.class);
            verify(workflowManager, never()).startAsync(anyString());
        }

        @Test
        void shouldToleratePendingRunFailure() {
            var created =
                    snapshot("wf-3", List.of(StepDescriptor.of("respond", StepAction.NoOp.of())));
            when(workflowManager.create("wf-3", "hello", 7)).thenReturn(created);
            when(workflowManager.startAsync("wf-3"))
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

            assertThat(service.create("wf-3", "hello", null, null)).isSameAs(created);
        }
    }

    @Nested
    class Resume {

        @Test
        void shouldReturnTerminalSnapshotOfFinishedRun() {
            var done =
                    snapshot("wf-1", List.of(StepDescriptor.of("respond", StepAction.NoOp.of())))
                            .next()
                            .status(WorkflowStatus.COMPLETED)
                            .build();
            when(workflowManager.resumeAsync("wf-1"))
                    .thenReturn(CompletableFuture.completedFuture(done));

            assertThat(service.resume("wf-1").status()).isEqualTo(WorkflowStatus.COMPLETED);
        }

        @Test
        void shouldReturnCurrentStateWhileRunning() {
            var suspended =
                    snapshot("wf-1", List.of(StepDescriptor.of("respond", StepAction.NoOp.of())))
                            .next()
                            .status(WorkflowStatus.SUSPENDED)
                            .build();
            when(workflowManager.resumeAsync("wf-1")).thenReturn(new CompletableFuture<>());
            when(workflowManager.get("wf-1")).thenReturn(suspended);

            assertThat(service.resume("wf-1").status()).isEqualTo(WorkflowStatus.SUSPENDED);
        }

        @Test
        void shouldPropagateBusy() {
            when(workflowManager.resumeAsync("wf-1")).thenThrow(new WorkflowBusyException("wf-1"));

            assertThatThrownBy(() -> service.resume("wf-1"))
                    .isInstanceOf(WorkflowBusyException.class);
        }
    }
}
