package com.sprout.database.session;

/**
 * Lifecycle of a pooled connection as seen through a {@link ConnectionHandle}.
 *
 * <pre>
 * IDLE ──acquire──▶ CHECKED_OUT ──connection()──▶ IN_USE ──close()──▶ RELEASING ──▶ IDLE
 *                                                                              └──▶ DISCARDED
 * </pre>
 *
 * A handle is created in {@link #CHECKED_OUT}; it never goes back to {@link #CHECKED_OUT} once
 * released. {@link #DISCARDED} connections are evicted and never returned to the pool.
 */
public enum HandleState {
    IDLE,
    CHECKED_OUT,
    IN_USE,
    RELEASING,
    DISCARDED;

    /** Whether the handle currently owns a live connection. */
    public boolean owned() {
        return this == CHECKED_OUT || this == IN_USE;
    }
}
