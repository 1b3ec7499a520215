package com.sprout.database.session;

import java.sql.Connection;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Exclusively owned, short-lived lease on one pooled connection.
 *
 * <p>Obtained from {@link SessionManager#acquire()} and released with {@link #close()}, normally
 * through try-with-resources so release happens on every exit path. Closing twice is a no-op. Once
 * released the handle refuses to hand out its connection again.
 *
 * <p>A handle whose connection misbehaved is {@linkplain #markBroken() marked broken}; on release
 * its connection is evicted instead of going back to the pool.
 */
public final class ConnectionHandle implements AutoCloseable {

    private final long id;
    private final Connection connection;
    private final Consumer<ConnectionHandle> releaser;
    private final AtomicReference<HandleState> state = new AtomicReference<>(HandleState.CHECKED_OUT);
    private volatile boolean broken;

    ConnectionHandle(long id, Connection connection, Consumer<ConnectionHandle> releaser) {
        this.id = id;
        this.connection = connection;
        this.releaser = releaser;
    }

    /**
     * Returns the leased connection and moves the handle to {@link HandleState#IN_USE}.
     *
     * @throws IllegalStateException if the handle was already released
     */
    public Connection connection() {
        HandleState current = state.get();
        if (current == HandleState.CHECKED_OUT) {
            state.compareAndSet(HandleState.CHECKED_OUT, HandleState.IN_USE);
        } else if (current != HandleState.IN_USE) {
            throw new IllegalStateException("Connection handle #%d is %s and can no longer be used".formatted(id, current));
        }
        return connection;
    }

    /** Flags the connection as unhealthy so release discards it. */
    public void markBroken() {
        broken = true;
    }

    public boolean broken() {
        return broken;
    }

    public HandleState state() {
        return state.get();
    }

    /** Process-unique sequence number, for logs. */
    public long id() {
        return id;
    }

    /** Releases the lease. Only the first call has an effect. */
    @Override
    public void close() {
        HandleState current = state.get();
        while (current.owned()) {
            if (state.compareAndSet(current, HandleState.RELEASING)) {
                releaser.accept(this);
                return;
            }
            current = state.get();
        }
    }

    Connection rawConnection() {
        return connection;
    }

    void finish(HandleState terminal) {
        state.set(terminal);
    }

    @Override
    public String toString() {
        return "ConnectionHandle[#%d, %s%s]".formatted(id, state.get(), broken ? ", broken" : "");
    }
}
