package io.agency.core.state;

import io.agency.core.exception.SnapshotVersionConflictException;
import io.agency.core.workflow.WorkflowSnapshot;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory snapshot store (default implementation).
///
/// Thread-safe, no external dependencies. Each workflow maps to an immutable
/// list of its versions that is replaced on every write inside
/// {@link ConcurrentHashMap#compute}, which makes the version check and the
/// append one atomic step.
///
/// @see SnapshotStore for the contract
public final class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, List<WorkflowSnapshot>> storage = new ConcurrentHashMap<>();

    @Override
    public void put(WorkflowSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        storage.compute(
                snapshot.workflowId(),
                (id, versions) -> {
                    long last = versions == null ? 0 : versions.get(versions.size() - 1).version();
                    if (snapshot.version() != last + 1) {
                        throw new SnapshotVersionConflictException(
                                id, last + 1, snapshot.version());
                    }
                    List<WorkflowSnapshot> updated =
                            new ArrayList<>(versions == null ? List.of() : versions);
                    updated.add(snapshot);
                    return List.copyOf(updated);
                });
    }

    @Override
    public Optional<WorkflowSnapshot> getLatest(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");

        List<WorkflowSnapshot> versions = storage.get(workflowId);
        if (versions == null) {
            return Optional.empty();
        }
        return Optional.of(versions.get(versions.size() - 1));
    }

    @Override
    public Optional<WorkflowSnapshot> get(String workflowId, long version) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");

        List<WorkflowSnapshot> versions = storage.get(workflowId);
        if (versions == null || version < 1 || version > versions.size()) {
            return Optional.empty();
        }
        return Optional.of(versions.get((int) version - 1));
    }

    @Override
    public List<SnapshotSummary> list() {
        return storage.values().stream()
                .flatMap(List::stream)
                .map(WorkflowSnapshot::summary)
                .sorted(
                        Comparator.comparing(SnapshotSummary::workflowId)
                                .thenComparingLong(SnapshotSummary::version))
                .toList();
    }

    @Override
    public List<WorkflowSnapshot> listLatest() {
        return storage.values().stream()
                .map(versions -> versions.get(versions.size() - 1))
                .sorted(Comparator.comparing(WorkflowSnapshot::workflowId))
                .toList();
    }

    @Override
    public int delete(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");

        List<WorkflowSnapshot> removed = storage.remove(workflowId);
        return removed != null ? removed.size() : 0;
    }

    @Override
    public int deleteTerminalOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");

        int removed = 0;
        for (String workflowId : List.copyOf(storage.keySet())) {
            List<WorkflowSnapshot> versions =
                    storage.computeIfPresent(
                            workflowId,
                            (id, current) -> {
                                WorkflowSnapshot latest = current.get(current.size() - 1);
                                boolean expired =
                                        latest.status().isTerminal()
                                                && latest.updatedAt().isBefore(cutoff);
                                return expired ? null : current;
                            });
            if (versions == null) {
                removed++;
            }
        }
        return removed;
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }
}
