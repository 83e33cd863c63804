package io.agency.server.persistence;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;

/// Lightweight JDBC helper that removes try-with-resources and
/// {@link SQLException} boilerplate from the snapshot store.
///
/// SQL is always a {@code static final} constant and parameters are always
/// bound through a {@link StatementPreparer}, so values never reach the SQL text.
///
/// ### Contracts
/// - **Precondition**: {@link DataSource} is a valid Agroal-managed pool
/// - **Postcondition**: every acquired connection is released via try-with-resources
///
/// @implNote Thread-safe. Stateless beyond the injected {@link DataSource}.
///
/// @see JdbcSnapshotStore
final class JdbcSupport {

    private final DataSource dataSource;

    JdbcSupport(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /// Executes an INSERT, UPDATE, or DELETE statement.
    ///
    /// @param sql the SQL statement, not null
    /// @param preparer binds parameters to the statement, not null
    /// @param errorContext message prefix for {@link PersistenceException}, not null
    /// @return number of affected rows
    /// @throws PersistenceException if the statement fails
    int update(String sql, StatementPreparer preparer, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Executes a query returning zero or one mapped row.
    ///
    /// @param <T> the type produced by the mapper
    /// @param sql the query, not null
    /// @param preparer binds parameters to the statement, not null
    /// @param mapper converts a {@link ResultSet} row, not null
    /// @param errorContext message prefix for {@link PersistenceException}, not null
    /// @return the mapped row if present, empty otherwise, never null
    /// @throws PersistenceException if the query fails
    <T> Optional<T> queryOne(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Executes a query returning zero or more mapped rows.
    ///
    /// @param <T> the type produced by the mapper
    /// @param sql the query, not null
    /// @param preparer binds parameters to the statement, not null
    /// @param mapper converts each {@link ResultSet} row, not null
    /// @param errorContext message prefix for {@link PersistenceException}, not null
    /// @return list of mapped rows, may be empty, never null
    /// @throws PersistenceException if the query fails
    <T> List<T> queryList(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (var rs = ps.executeQuery()) {
                var results = new ArrayList<T>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Binds parameters to a {@link PreparedStatement} before execution.
    @FunctionalInterface
    interface StatementPreparer {

        StatementPreparer NONE = ps -> {};

        void prepare(PreparedStatement ps) throws SQLException;
    }

    /// Maps a single {@link ResultSet} row.
    ///
    /// @param <T> the type to produce
    @FunctionalInterface
    interface RowMapper<T> {

        T map(ResultSet rs) throws SQLException;
    }
}
