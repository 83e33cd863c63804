package io.agency.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agency.core.workflow.StepAction;
import io.agency.core.workflow.StepDescriptor;
import io.agency.core.workflow.StepState;
import io.agency.core.workflow.StepStatus;
import io.agency.core.workflow.WorkflowSnapshot;
import io.agency.core.workflow.WorkflowStatus;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SnapshotSerializerTest {

    private static List<StepDescriptor> steps() {
        return List.of(
                StepDescriptor.of(
                        "book",
                        StepAction.Reason.of("Book a flight", "planner"),
                        StepAction.InvokeTool.of("cancel_booking", Map.of("ref", "AB12"))),
                StepDescriptor.of("notify", StepAction.NoOp.of()));
    }

    @Nested
    class Snapshots {

        @Test
        void shouldRestoreCompensatingSnapshot() {
            var original =
                    WorkflowSnapshot.initial("trip-1", steps(), 4, "plan my trip")
                            .next()
                            .status(WorkflowStatus.COMPENSATING)
                            .step(0, StepState.notStarted().inProgress().succeeded("AB12", true, 1, 4))
                            .step(1, StepState.notStarted().inProgress().failed("mail down", 0))
                            .compensationCursor(0)
                            .checkpointReason("step_failed")
                            .build();

            var restored = SnapshotSerializer.fromJson(SnapshotSerializer.toJson(original));

            assertThat(restored).isEqualTo(original);
            assertThat(restored.step(0).forward()).isInstanceOf(StepAction.Reason.class);
            assertThat(restored.step(0).compensation())
                    .isEqualTo(StepAction.InvokeTool.of("cancel_booking", Map.of("ref", "AB12")));
            assertThat(restored.step(1).compensation()).isNull();
            assertThat(restored.stepState(0).truncated()).isTrue();
            assertThat(restored.stepState(1).status()).isEqualTo(StepStatus.FAILED);
        }

        @Test
        void shouldWriteInstantsAsIsoText() {
            var snapshot = WorkflowSnapshot.initial("wf", steps(), 2, null);

            var json = SnapshotSerializer.toJson(snapshot);

            assertThat(json).contains("\"createdAt\":\"" + snapshot.createdAt() + "\"");
        }

        @Test
        void shouldIgnoreUnknownProperties() {
            var json =
                    SnapshotSerializer.toJson(WorkflowSnapshot.initial("wf", steps(), 2, null))
                            .replaceFirst("\\{", "{\"schemaRevision\":7,");

            assertThat(SnapshotSerializer.fromJson(json).workflowId()).isEqualTo("wf");
        }
    }

    @Nested
    class StepActions {

        @Test
        void shouldWriteTypeDiscriminator() {
            var json =
                    SnapshotSerializer.toJson(WorkflowSnapshot.initial("wf", steps(), 2, null));

            assertThat(json)
                    .contains("{\"type\":\"reason\",\"instruction\":\"Book a flight\",\"agentId\":\"planner\"}")
                    .contains("{\"type\":\"tool\",\"toolName\":\"cancel_booking\",\"arguments\":{\"ref\":\"AB12\"}}")
                    .contains("{\"type\":\"noop\"}");
        }

        @Test
        void shouldReadStepDefinitions() {
            var steps =
                    SnapshotSerializer.stepsFromJson(
                            """
                            [
                              {"name": "draft", "forward": {"type": "reason", "instruction": "Draft it",
                               "parameters": {"tone": "formal"}}},
                              {"name": "publish", "forward": {"type": "tool", "toolName": "publish"},
                               "compensation": {"type": "tool", "toolName": "unpublish"}}
                            ]
                            """);

            assertThat(steps).hasSize(2);
            var draft = (StepAction.Reason) steps.get(0).forward();
            assertThat(draft.agentId()).isNull();
            assertThat(draft.parameters()).containsEntry("tone", "formal");
            assertThat(steps.get(1).forward()).isEqualTo(StepAction.InvokeTool.of("publish", Map.of()));
            assertThat(steps.get(1).hasCompensation()).isTrue();
        }

        @Test
        void shouldRejectUnknownActionType() {
            assertThatThrownBy(
                            () ->
                                    SnapshotSerializer.stepsFromJson(
                                            "[{\"name\":\"x\",\"forward\":{\"type\":\"shell\"}}]"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown step action type: shell");
        }

        @Test
        void shouldRejectReasonWithoutInstruction() {
            assertThatThrownBy(
                            () ->
                                    SnapshotSerializer.stepsFromJson(
                                            "[{\"name\":\"x\",\"forward\":{\"type\":\"reason\"}}]"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("requires 'instruction'");
        }
    }
}
