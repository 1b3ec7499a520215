package com.sprout.database.session;

import com.sprout.database.ConnectionLostException;
import com.sprout.database.DatabaseException;
import com.sprout.database.DatabaseSettings;
import com.sprout.database.ErrorKind;
import com.sprout.database.PersistenceException;
import com.sprout.database.PoolExhaustedException;
import com.sprout.database.SqlErrorClassifier;
import com.sprout.database.migration.MigrationReport;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second phase of startup: owns the connection pool and scopes connections and transactions for
 * the bot's units of work for the rest of the process lifetime.
 *
 * <p>Built on HikariCP. The manager can only be {@linkplain #open opened} with a successful
 * {@link MigrationReport}, so no unit of work ever sees a connection before the migration gate has
 * passed in this process.
 *
 * <h2>Scoped resources</h2>
 *
 * <ul>
 *   <li>{@link #acquire()} / {@link #withConnection(ConnectionWork)}: one connection, auto-commit
 *   <li>{@link #begin()} / {@link #inTransaction(TransactionWork)}: one transaction, committed only
 *       when the work completes normally, rolled back on every other path
 * </ul>
 *
 * <h2>Failure surface</h2>
 *
 * <ul>
 *   <li>acquisition timeout: {@link PoolExhaustedException}, retriable after backoff
 *   <li>store unreachable or connection dropped mid-work: {@link ConnectionLostException}; the
 *       connection is evicted and the pool replaces it up to its maximum
 *   <li>serialization failure or deadlock: {@code TransactionConflictException}
 *   <li>thread interrupted while waiting: {@link PersistenceException} of kind
 *       {@link ErrorKind#CANCELLED}, interrupt flag restored
 * </ul>
 *
 * <p>The manager never retries and never swallows an error; retry policy belongs to the caller.
 */
public final class SessionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final HikariDataSource dataSource;
    private final PoolSettings pool;
    private final String schemaVersion;
    private final Set<ConnectionHandle> openHandles = ConcurrentHashMap.newKeySet();
    private final AtomicLong handleSequence = new AtomicLong();
    private final Timer acquireTimer;
    private final Counter exhaustedCounter;
    private final Counter discardedCounter;

    private SessionManager(HikariDataSource dataSource, PoolSettings pool, String schemaVersion, MeterRegistry registry) {
        this.dataSource = dataSource;
        this.pool = pool;
        this.schemaVersion = schemaVersion;
        this.acquireTimer = Timer.builder("sprout.db.acquire")
                .description("Time spent checking a connection out of the pool")
                .tag("pool", pool.poolName())
                .register(registry);
        this.exhaustedCounter = Counter.builder("sprout.db.pool.exhausted")
                .description("Acquisitions that timed out because the pool was exhausted")
                .tag("pool", pool.poolName())
                .register(registry);
        this.discardedCounter = Counter.builder("sprout.db.connections.discarded")
                .description("Connections evicted from the pool as unhealthy")
                .tag("pool", pool.poolName())
                .register(registry);
    }

    /**
     * Starts the pool.
     *
     * @param database connection settings
     * @param pool pool sizing and timeouts
     * @param migration report of this process's migration gate run
     * @param registry meter registry for pool and session metrics
     * @throws IllegalStateException if the migration gate did not succeed
     * @throws ConnectionLostException if the pool cannot open its first connection
     */
    public static SessionManager open(
            DatabaseSettings database, PoolSettings pool, MigrationReport migration, MeterRegistry registry) {
        Objects.requireNonNull(migration, "migration report must not be null");
        if (!migration.succeeded()) {
            throw new IllegalStateException("Refusing to open database sessions: schema migration did not succeed (%s: %s)"
                    .formatted(migration.failure(), migration.detail()));
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(database.url());
        config.setUsername(database.username());
        config.setPassword(database.password());
        config.setPoolName(pool.poolName());
        config.setMaximumPoolSize(pool.maxSize());
        config.setMinimumIdle(pool.minIdle());
        config.setConnectionTimeout(pool.acquireTimeout().toMillis());
        config.setValidationTimeout(pool.validationTimeout().toMillis());
        config.setMaxLifetime(pool.maxLifetime().toMillis());
        config.setAutoCommit(true);
        config.setMetricRegistry(registry);

        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new ConnectionLostException("Unable to start connection pool '%s' against %s"
                    .formatted(pool.poolName(), database.url()), e);
        }
        log.info("Connection pool '{}' started (max={}, minIdle={}, acquireTimeout={} ms, schema version {})",
                pool.poolName(), pool.maxSize(), pool.minIdle(), pool.acquireTimeout().toMillis(),
                migration.finalVersion());
        return new SessionManager(dataSource, pool, migration.finalVersion(), registry);
    }

    /**
     * Checks out a connection. The caller must close the handle, normally with try-with-resources.
     *
     * @throws PoolExhaustedException if no connection frees up within the acquisition timeout
     * @throws ConnectionLostException if the store cannot be reached
     */
    public ConnectionHandle acquire() {
        if (dataSource.isClosed()) {
            throw new IllegalStateException("Session manager for pool '%s' is closed".formatted(pool.poolName()));
        }
        long start = System.nanoTime();
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLTransientConnectionException e) {
            throw acquisitionTimedOut(e);
        } catch (SQLException e) {
            if (e.getCause() instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                Thread.currentThread().interrupt();
                throw new PersistenceException(ErrorKind.CANCELLED,
                        "Interrupted while waiting for a connection from pool '%s'".formatted(pool.poolName()),
                        e.getSQLState(), e);
            }
            throw SqlErrorClassifier.translate("Acquiring connection", e);
        } finally {
            acquireTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        }

        ConnectionHandle handle = new ConnectionHandle(handleSequence.incrementAndGet(), connection, this::release);
        openHandles.add(handle);
        log.trace("Checked out {}", handle);
        return handle;
    }

    /**
     * Opens a transaction on a freshly checked-out connection.
     */
    public TransactionScope begin() {
        ConnectionHandle handle = acquire();
        try {
            return new TransactionScope(handle);
        } catch (RuntimeException e) {
            handle.close();
            throw e;
        }
    }

    /**
     * Runs work on one connection in auto-commit mode and releases it afterwards.
     */
    public <T> T withConnection(ConnectionWork<T> work) {
        try (ConnectionHandle handle = acquire()) {
            try {
                return work.execute(handle.connection());
            } catch (SQLException e) {
                DatabaseException translated = SqlErrorClassifier.translate("Connection work", e);
                if (translated.kind() == ErrorKind.CONNECTION_LOST) {
                    handle.markBroken();
                }
                throw translated;
            }
        }
    }

    /**
     * Runs work in one transaction: commits if it returns, rolls back if it throws anything.
     */
    public <T> T inTransaction(TransactionWork<T> work) {
        TransactionScope tx = begin();
        try {
            T result = work.execute(tx);
            tx.commit();
            return result;
        } catch (SQLException e) {
            throw tx.failure("Transaction", e);
        } finally {
            tx.close();
        }
    }

    /**
     * Round-trips to the store.
     *
     * @return true if a pooled connection answered within the validation timeout
     */
    public boolean ping() {
        int seconds = (int) Math.max(1, pool.validationTimeout().toSeconds());
        return withConnection(connection -> connection.isValid(seconds));
    }

    public PoolSnapshot snapshot() {
        HikariPoolMXBean mxBean = dataSource.getHikariPoolMXBean();
        if (mxBean == null) {
            return new PoolSnapshot(0, 0, 0, 0, openHandles.size());
        }
        return new PoolSnapshot(
                mxBean.getActiveConnections(),
                mxBean.getIdleConnections(),
                mxBean.getTotalConnections(),
                mxBean.getThreadsAwaitingConnection(),
                openHandles.size());
    }

    /** Schema version the migration gate left the store at. */
    public String schemaVersion() {
        return schemaVersion;
    }

    public PoolSettings poolSettings() {
        return pool;
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    /** Closes the pool. Handles still open at this point are logged; their connections are closed. */
    @Override
    public void close() {
        if (dataSource.isClosed()) {
            return;
        }
        if (!openHandles.isEmpty()) {
            log.warn("Closing pool '{}' with {} handle(s) still checked out: {}",
                    pool.poolName(), openHandles.size(), openHandles);
        }
        dataSource.close();
        log.info("Connection pool '{}' closed", pool.poolName());
    }

    // ── Private Helpers ──

    private DatabaseException acquisitionTimedOut(SQLTransientConnectionException e) {
        // Hikari reports "store down" and "pool busy" with the same exception type; the former
        // carries the last connection failure as its cause.
        if (e.getCause() instanceof SQLException cause
                && SqlErrorClassifier.classify(cause) == ErrorKind.CONNECTION_LOST) {
            return new ConnectionLostException("Store unreachable while acquiring from pool '%s': %s"
                    .formatted(pool.poolName(), cause.getMessage()), e);
        }
        exhaustedCounter.increment();
        log.warn("Pool '{}' exhausted: no connection within {} ms ({})",
                pool.poolName(), pool.acquireTimeout().toMillis(), snapshot());
        return new PoolExhaustedException(pool.poolName(), pool.acquireTimeout(), e);
    }

    private void release(ConnectionHandle handle) {
        Connection connection = handle.rawConnection();
        HandleState outcome = HandleState.IDLE;
        try {
            if (handle.broken()) {
                outcome = HandleState.DISCARDED;
                dataSource.evictConnection(connection);
            } else if (!connection.isClosed()) {
                connection.close();
            }
        } catch (SQLException e) {
            outcome = HandleState.DISCARDED;
            log.warn("Returning {} to the pool failed, evicting its connection: {}", handle, e.getMessage());
            dataSource.evictConnection(connection);
        } finally {
            openHandles.remove(handle);
            handle.finish(outcome);
        }
        if (outcome == HandleState.DISCARDED) {
            discardedCounter.increment();
            log.info("Discarded unhealthy connection of handle #{} from pool '{}'", handle.id(), pool.poolName());
        } else {
            log.trace("Released {}", handle);
        }
    }
}
