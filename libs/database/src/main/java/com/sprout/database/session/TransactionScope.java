package com.sprout.database.session;

import com.sprout.database.DatabaseException;
import com.sprout.database.ErrorKind;
import com.sprout.database.SqlErrorClassifier;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A transaction on one leased connection: atomic commit or complete rollback.
 *
 * <p>Obtained from {@link SessionManager#begin()} and closed with try-with-resources. Closing a scope
 * that was not {@linkplain #commit() committed} rolls it back, so every error path leaves no
 * partial writes behind. The scope belongs to the thread that opened it; other threads are refused.
 *
 * <pre>{@code
 * try (TransactionScope tx = sessions.begin()) {
 *     tx.update("UPDATE plants SET name = ? WHERE id = ?", "Monstera", plantId);
 *     tx.insert("INSERT INTO action_logs (...) VALUES (...)", ...);
 *     tx.commit();
 * }
 * }</pre>
 *
 * <p>The statement helpers translate {@link SQLException}s through {@link SqlErrorClassifier}; a
 * lost connection marks the handle broken so it is discarded on release.
 */
public final class TransactionScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransactionScope.class);

    private final ConnectionHandle handle;
    private final Connection connection;
    private final Thread owner;
    private boolean committed;
    private boolean closed;

    TransactionScope(ConnectionHandle handle) {
        this.handle = handle;
        this.owner = Thread.currentThread();
        this.connection = handle.connection();
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw failure("Opening transaction", e);
        }
    }

    /** The raw connection, for work the helpers do not cover. Do not close it. */
    public Connection connection() {
        checkUsable();
        return connection;
    }

    /**
     * Executes an INSERT, UPDATE or DELETE.
     *
     * @return the number of affected rows
     */
    public int update(String sql, Object... params) {
        checkUsable();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("Update", e);
        }
    }

    /**
     * Executes an INSERT into a table whose first column is a generated key.
     *
     * @return the generated key
     */
    public long insert(String sql, Object... params) {
        checkUsable();
        try (PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            bind(ps, params);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("Insert returned no generated key: " + sql);
                }
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw failure("Insert", e);
        }
    }

    /** Runs a query and maps every row. */
    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
        checkUsable();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
                return rows;
            }
        } catch (SQLException e) {
            throw failure("Query", e);
        }
    }

    /** Runs a query expected to return at most one row. */
    public <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... params) {
        List<T> rows = query(sql, mapper, params);
        if (rows.size() > 1) {
            throw new IllegalStateException("Expected at most one row, got %d: %s".formatted(rows.size(), sql));
        }
        return rows.stream().findFirst();
    }

    /** Commits. After a successful commit, {@link #close()} only releases the connection. */
    public void commit() {
        checkUsable();
        try {
            connection.commit();
            committed = true;
        } catch (SQLException e) {
            throw failure("Commit", e);
        }
    }

    /** Rolls back now. The scope stays open and may be reused for further statements. */
    public void rollback() {
        checkUsable();
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw failure("Rollback", e);
        }
    }

    public boolean committed() {
        return committed;
    }

    /** The underlying handle, mostly for diagnostics. */
    public ConnectionHandle handle() {
        return handle;
    }

    /**
     * Rolls back unless committed, restores auto-commit and releases the connection. A connection
     * that cannot be rolled back or reset is discarded rather than returned to the pool.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (!committed && !handle.broken()) {
                connection.rollback();
            }
            if (!handle.broken()) {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.warn("Could not roll back transaction on handle #{}, discarding its connection: {}",
                    handle.id(), e.getMessage());
            handle.markBroken();
        } finally {
            handle.close();
        }
    }

    /**
     * Translates a driver exception and marks the handle broken when the connection was lost.
     */
    DatabaseException failure(String operation, SQLException e) {
        DatabaseException translated = SqlErrorClassifier.translate(operation, e);
        if (translated.kind() == ErrorKind.CONNECTION_LOST) {
            handle.markBroken();
        }
        return translated;
    }

    private void checkUsable() {
        if (closed) {
            throw new IllegalStateException("Transaction scope on handle #%d is closed".formatted(handle.id()));
        }
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("Transaction scope on handle #%d belongs to thread '%s'"
                    .formatted(handle.id(), owner.getName()));
        }
    }

    private static void bind(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object value = params[i];
            if (value instanceof Instant instant) {
                value = OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
            } else if (value instanceof Enum<?> constant) {
                value = constant.name();
            }
            ps.setObject(i + 1, value);
        }
    }
}
