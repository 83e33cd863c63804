package io.agency.server.persistence;

import io.agency.core.exception.SnapshotVersionConflictException;
import io.agency.core.state.SnapshotStore;
import io.agency.core.state.SnapshotSummary;
import io.agency.core.workflow.WorkflowSnapshot;
import io.agency.core.workflow.WorkflowStatus;
import io.agency.serialization.SnapshotSerializer;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;

/// PostgreSQL-backed snapshot store.
///
/// Every version is its own row in `agency.workflow_snapshots`, with the full
/// snapshot in a JSONB column and `status`/`updated_at` copied out for listing
/// and retention queries.
///
/// ### Version Guard
/// {@link #put} is a single `INSERT ... SELECT ... WHERE` that only inserts
/// when the current maximum version is exactly one below the new version. The
/// primary key on `(workflow_id, version)` rejects a concurrent writer that
/// passed the same guard, so no explicit lock is taken.
///
/// ### Contracts
/// - **Precondition**: Flyway migration `V1__create_schema` has run
/// - **Postcondition**: rows are never updated; versions only grow
///
/// @implNote Thread-safe. Each call acquires its own JDBC connection from the
/// Agroal pool via {@link JdbcSupport}.
///
/// @see SnapshotStore
public class JdbcSnapshotStore implements SnapshotStore {

    // --- SQL constants ---

    private static final String SQL_INSERT_NEXT =
            """
            INSERT INTO agency.workflow_snapshots
                (workflow_id, version, status, updated_at, snapshot)
            SELECT ?, ?, ?, ?, ?::jsonb
            WHERE COALESCE(
                    (SELECT MAX(version) FROM agency.workflow_snapshots WHERE workflow_id = ?),
                    0) = ?
            ON CONFLICT (workflow_id, version) DO NOTHING
            """;

    private static final String SQL_MAX_VERSION =
            """
            SELECT COALESCE(MAX(version), 0) AS max_version
            FROM agency.workflow_snapshots
            WHERE workflow_id = ?
            """;

    private static final String SQL_FIND_LATEST =
            """
            SELECT snapshot FROM agency.workflow_snapshots
            WHERE workflow_id = ?
            ORDER BY version DESC
            LIMIT 1
            """;

    private static final String SQL_FIND_VERSION =
            """
            SELECT snapshot FROM agency.workflow_snapshots
            WHERE workflow_id = ? AND version = ?
            """;

    private static final String SQL_LIST =
            """
            SELECT workflow_id, version, status, updated_at
            FROM agency.workflow_snapshots
            ORDER BY workflow_id, version
            """;

    private static final String SQL_LIST_LATEST =
            """
            SELECT DISTINCT ON (workflow_id) snapshot
            FROM agency.workflow_snapshots
            ORDER BY workflow_id, version DESC
            """;

    private static final String SQL_DELETE =
            "DELETE FROM agency.workflow_snapshots WHERE workflow_id = ?";

    private static final String SQL_DELETE_TERMINAL_OLDER_THAN =
            """
            WITH latest AS (
                SELECT DISTINCT ON (workflow_id) workflow_id, status, updated_at
                FROM agency.workflow_snapshots
                ORDER BY workflow_id, version DESC
            ), doomed AS (
                SELECT workflow_id FROM latest
                WHERE status IN ('COMPLETED', 'COMPENSATED', 'FAILED') AND updated_at < ?
            ), removed AS (
                DELETE FROM agency.workflow_snapshots
                WHERE workflow_id IN (SELECT workflow_id FROM doomed)
                RETURNING workflow_id
            )
            SELECT COUNT(DISTINCT workflow_id) AS removed FROM removed
            """;

    private final JdbcSupport jdbc;

    /// Creates a store backed by the given data source.
    ///
    /// @param dataSource the JDBC connection pool, not null
    public JdbcSnapshotStore(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.jdbc = new JdbcSupport(dataSource);
    }

    @Override
    public void put(WorkflowSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        String workflowId = snapshot.workflowId();
        String json = SnapshotSerializer.toJson(snapshot);

        int inserted =
                jdbc.update(
                        SQL_INSERT_NEXT,
                        ps -> {
                            ps.setString(1, workflowId);
                            ps.setLong(2, snapshot.version());
                            ps.setString(3, snapshot.status().name());
                            ps.setObject(4, utc(snapshot.updatedAt()));
                            ps.setString(5, json);
                            ps.setString(6, workflowId);
                            ps.setLong(7, snapshot.version() - 1);
                        },
                        "Failed to write snapshot " + workflowId + " v" + snapshot.version());

        if (inserted == 0) {
            long last = maxVersion(workflowId);
            throw new SnapshotVersionConflictException(workflowId, last + 1, snapshot.version());
        }
    }

    @Override
    public Optional<WorkflowSnapshot> getLatest(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");

        return jdbc.queryOne(
                SQL_FIND_LATEST,
                ps -> ps.setString(1, workflowId),
                JdbcSnapshotStore::mapSnapshot,
                "Failed to read latest snapshot of " + workflowId);
    }

    @Override
    public Optional<WorkflowSnapshot> get(String workflowId, long version) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");

        return jdbc.queryOne(
                SQL_FIND_VERSION,
                ps -> {
                    ps.setString(1, workflowId);
                    ps.setLong(2, version);
                },
                JdbcSnapshotStore::mapSnapshot,
                "Failed to read snapshot " + workflowId + " v" + version);
    }

    @Override
    public List<SnapshotSummary> list() {
        return jdbc.queryList(
                SQL_LIST,
                JdbcSupport.StatementPreparer.NONE,
                rs ->
                        new SnapshotSummary(
                                rs.getString("workflow_id"),
                                rs.getLong("version"),
                                WorkflowStatus.valueOf(rs.getString("status")),
                                rs.getObject("updated_at", OffsetDateTime.class).toInstant()),
                "Failed to list snapshots");
    }

    @Override
    public List<WorkflowSnapshot> listLatest() {
        return jdbc.queryList(
                SQL_LIST_LATEST,
                JdbcSupport.StatementPreparer.NONE,
                JdbcSnapshotStore::mapSnapshot,
                "Failed to list latest snapshots");
    }

    @Override
    public int delete(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");

        return jdbc.update(
                SQL_DELETE,
                ps -> ps.setString(1, workflowId),
                "Failed to delete snapshots of " + workflowId);
    }

    @Override
    public int deleteTerminalOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");

        return jdbc.queryOne(
                        SQL_DELETE_TERMINAL_OLDER_THAN,
                        ps -> ps.setObject(1, utc(cutoff)),
                        rs -> rs.getInt("removed"),
                        "Failed to purge terminal snapshots")
                .orElse(0);
    }

    // --- Helpers ---

    private long maxVersion(String workflowId) {
        return jdbc.queryOne(
                        SQL_MAX_VERSION,
                        ps -> ps.setString(1, workflowId),
                        rs -> rs.getLong("max_version"),
                        "Failed to read version of " + workflowId)
                .orElse(0L);
    }

    private static WorkflowSnapshot mapSnapshot(ResultSet rs) throws SQLException {
        return SnapshotSerializer.fromJson(rs.getString("snapshot"));
    }

    private static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
