package io.agency.core.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.agency.core.exception.SnapshotVersionConflictException;
import io.agency.core.workflow.StepAction;
import io.agency.core.workflow.StepDescriptor;
import io.agency.core.workflow.WorkflowSnapshot;
import io.agency.core.workflow.WorkflowStatus;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemorySnapshotStoreTest {

    private InMemorySnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySnapshotStore();
    }

    private static WorkflowSnapshot initial(String id) {
        return WorkflowSnapshot.initial(
                id, List.of(StepDescriptor.of("only", StepAction.NoOp.of())), 3, null);
    }

    private static WorkflowSnapshot completed(WorkflowSnapshot snapshot) {
        return snapshot.next().status(WorkflowStatus.COMPLETED).build();
    }

    @Nested
    class Versioning {

        @Test
        void shouldAcceptContiguousVersions() {
            var v1 = initial("wf-1");
            var v2 = v1.next().status(WorkflowStatus.RUNNING).build();

            store.put(v1);
            store.put(v2);

            assertThat(store.getLatest("wf-1")).contains(v2);
            assertThat(store.get("wf-1", 1)).contains(v1);
        }

        @Test
        void shouldRejectSkippedVersion() {
            var v1 = initial("wf-1");
            store.put(v1);
            var v3 = v1.next().build().next().build();

            assertThatThrownBy(() -> store.put(v3))
                    .isInstanceOf(SnapshotVersionConflictException.class)
                    .satisfies(
                            e -> {
                                var conflict = (SnapshotVersionConflictException) e;
                                assertThat(conflict.getExpectedVersion()).isEqualTo(2);
                                assertThat(conflict.getActualVersion()).isEqualTo(3);
                            });
        }

        @Test
        void shouldRejectOverwriteOfExistingVersion() {
            var v1 = initial("wf-1");
            store.put(v1);

            assertThatThrownBy(() -> store.put(initial("wf-1")))
                    .isInstanceOf(SnapshotVersionConflictException.class);
            assertThat(store.getLatest("wf-1")).contains(v1);
        }

        @Test
        void shouldRejectFirstWriteAboveOne() {
            assertThatThrownBy(() -> store.put(initial("wf-1").next().build()))
                    .isInstanceOf(SnapshotVersionConflictException.class);
            assertThat(store.getLatest("wf-1")).isEmpty();
        }
    }

    @Nested
    class Listing {

        @Test
        void shouldListEveryVersionOrderedByIdThenVersion() {
            var b1 = initial("b");
            store.put(b1);
            store.put(b1.next().build());
            store.put(initial("a"));

            assertThat(store.list())
                    .extracting(SnapshotSummary::workflowId, SnapshotSummary::version)
                    .containsExactly(
                            tuple("a", 1L),
                            tuple("b", 1L),
                            tuple("b", 2L));
        }

        @Test
        void shouldListLatestPerWorkflow() {
            var a1 = initial("a");
            store.put(a1);
            var a2 = a1.next().status(WorkflowStatus.RUNNING).build();
            store.put(a2);
            store.put(initial("b"));

            assertThat(store.listLatest())
                    .extracting(WorkflowSnapshot::workflowId, WorkflowSnapshot::version)
                    .containsExactly(
                            tuple("a", 2L),
                            tuple("b", 1L));
        }

        @Test
        void shouldReturnEmptyForUnknownWorkflow() {
            assertThat(store.getLatest("missing")).isEmpty();
            assertThat(store.get("missing", 1)).isEmpty();
            assertThat(store.list()).isEmpty();
        }
    }

    @Nested
    class Deletion {

        @Test
        void shouldDeleteAllVersions() {
            var v1 = initial("wf-1");
            store.put(v1);
            store.put(v1.next().build());

            assertThat(store.delete("wf-1")).isEqualTo(2);
            assertThat(store.getLatest("wf-1")).isEmpty();
            assertThat(store.delete("wf-1")).isZero();
        }

        @Test
        void shouldDeleteOnlyExpiredTerminalWorkflows() {
            var done = initial("done");
            store.put(done);
            store.put(completed(done));
            store.put(initial("pending"));

            int removed = store.deleteTerminalOlderThan(Instant.now().plusSeconds(60));

            assertThat(removed).isEqualTo(1);
            assertThat(store.getLatest("done")).isEmpty();
            assertThat(store.getLatest("pending")).isPresent();
        }

        @Test
        void shouldKeepRecentTerminalWorkflows() {
            var done = initial("done");
            store.put(done);
            store.put(completed(done));

            assertThat(store.deleteTerminalOlderThan(Instant.now().minusSeconds(3600))).isZero();
            assertThat(store.getLatest("done")).isPresent();
        }
    }
}
