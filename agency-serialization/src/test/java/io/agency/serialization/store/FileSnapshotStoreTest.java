package io.agency.serialization.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agency.core.exception.SnapshotVersionConflictException;
import io.agency.core.exception.StorageException;
import io.agency.core.workflow.StepAction;
import io.agency.core.workflow.StepDescriptor;
import io.agency.core.workflow.StepState;
import io.agency.core.workflow.WorkflowSnapshot;
import io.agency.core.workflow.WorkflowStatus;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSnapshotStoreTest {

    private static final List<StepDescriptor> STEPS =
            List.of(StepDescriptor.of("only", StepAction.NoOp.of()));

    @TempDir Path dir;

    private FileSnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new FileSnapshotStore(dir);
    }

    private static WorkflowSnapshot initial(String id) {
        return WorkflowSnapshot.initial(id, STEPS, 3, "hi");
    }

    private static WorkflowSnapshot finishedAt(String id, Instant when) {
        return new WorkflowSnapshot(
                id,
                1,
                WorkflowStatus.COMPLETED,
                STEPS,
                List.of(StepState.notStarted()),
                3,
                null,
                when,
                when,
                "completed",
                -1,
                null);
    }

    @Nested
    class Versioning {

        @Test
        void shouldAppendContiguousVersions() {
            var v1 = initial("wf-1");
            var v2 = v1.next().status(WorkflowStatus.RUNNING).checkpointReason("started").build();

            store.put(v1);
            store.put(v2);

            assertThat(store.getLatest("wf-1")).contains(v2);
            assertThat(store.get("wf-1", 1)).contains(v1);
            assertThat(store.get("wf-1", 3)).isEmpty();
            assertThat(store.get("wf-1", 0)).isEmpty();
        }

        @Test
        void shouldRejectVersionGap() {
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
        void shouldRejectOverwrite() {
            store.put(initial("wf-1"));

            assertThatThrownBy(() -> store.put(initial("wf-1")))
                    .isInstanceOf(SnapshotVersionConflictException.class);
        }
    }

    @Nested
    class Durability {

        @Test
        void shouldSurviveReopen() {
            var v1 = initial("wf-1");
            store.put(v1);
            store.put(v1.next().status(WorkflowStatus.SUSPENDED).checkpointReason("shutdown").build());

            var reopened = new FileSnapshotStore(dir);

            assertThat(reopened.getLatest("wf-1"))
                    .hasValueSatisfying(
                            snapshot -> {
                                assertThat(snapshot.version()).isEqualTo(2);
                                assertThat(snapshot.status()).isEqualTo(WorkflowStatus.SUSPENDED);
                                assertThat(snapshot.checkpointReason()).isEqualTo("shutdown");
                            });
        }

        @Test
        void shouldIgnoreLeftoverTempFiles() throws Exception {
            var v1 = initial("wf-1");
            store.put(v1);
            Path workflowDir = dir.resolve(FileSnapshotStore.encode("wf-1"));
            Files.writeString(workflowDir.resolve("000000000002.json.tmp"), "{\"trunc");

            assertThat(store.getLatest("wf-1")).contains(v1);
            store.put(v1.next().build());
            assertThat(store.getLatest("wf-1").orElseThrow().version()).isEqualTo(2);
        }

        @Test
        void shouldReportCorruptFileAsStorageFailure() throws Exception {
            store.put(initial("wf-1"));
            Path file = dir.resolve(FileSnapshotStore.encode("wf-1")).resolve("000000000001.json");
            Files.writeString(file, "not json");

            assertThatThrownBy(() -> store.getLatest("wf-1"))
                    .isInstanceOf(StorageException.class)
                    .hasMessageContaining("Failed to read snapshot");
        }

        @Test
        void shouldKeepUnsafeIdsInsideRoot() {
            store.put(initial("../escape"));
            store.put(initial("a/b"));

            assertThat(store.listLatest())
                    .extracting(WorkflowSnapshot::workflowId)
                    .containsExactly("../escape", "a/b");
            assertThat(dir.getParent().resolve("escape")).doesNotExist();
        }

        @Test
        void shouldStoreIdsWhoseEncodingExceedsFileNameLimits() {
            String dotted = "a" + ".".repeat(254);
            String longer = "a" + ".".repeat(200) + "b";
            var v1 = initial(dotted);
            store.put(v1);
            store.put(v1.next().status(WorkflowStatus.RUNNING).build());
            store.put(initial(longer));

            assertThat(FileSnapshotStore.encode(dotted))
                    .hasSizeLessThanOrEqualTo(255)
                    .isNotEqualTo(FileSnapshotStore.encode(longer));
            assertThat(store.getLatest(dotted).orElseThrow().version()).isEqualTo(2);
            assertThat(store.listLatest())
                    .extracting(WorkflowSnapshot::workflowId)
                    .containsExactlyInAnyOrder(dotted, longer);
            assertThat(store.list()).hasSize(3);
            assertThat(store.delete(dotted)).isEqualTo(2);
            assertThat(store.getLatest(dotted)).isEmpty();
        }
    }

    @Nested
    class Administration {

        @Test
        void shouldListEveryVersionInOrder() {
            var b1 = initial("b");
            store.put(b1);
            store.put(b1.next().build());
            store.put(initial("a"));

            assertThat(store.list())
                    .extracting(s -> s.workflowId() + "@" + s.version())
                    .containsExactly("a@1", "b@1", "b@2");
        }

        @Test
        void shouldDeleteAllVersions() {
            var v1 = initial("wf-1");
            store.put(v1);
            store.put(v1.next().build());

            assertThat(store.delete("wf-1")).isEqualTo(2);
            assertThat(store.getLatest("wf-1")).isEmpty();
            assertThat(store.delete("wf-1")).isZero();
            store.put(initial("wf-1"));
        }

        @Test
        void shouldPurgeOnlyOldTerminalWorkflows() {
            Instant now = Instant.now();
            store.put(finishedAt("old-done", now.minus(Duration.ofDays(10))));
            store.put(finishedAt("fresh-done", now));
            store.put(initial("pending"));

            int removed = store.deleteTerminalOlderThan(now.minus(Duration.ofDays(7)));

            assertThat(removed).isEqualTo(1);
            assertThat(store.listLatest())
                    .extracting(WorkflowSnapshot::workflowId)
                    .containsExactly("fresh-done", "pending");
        }
    }
}
