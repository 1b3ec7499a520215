package com.sprout.database;

/**
 * Classification of every failure the database layer surfaces.
 *
 * <p>Callers decide retry policy from {@link #retriable()}: the session manager itself never
 * retries and never swallows an error.
 */
public enum ErrorKind {

    /** Schema inconsistent or the migration tool failed. The process must not start. */
    MIGRATION_FATAL(false),

    /** No pooled connection became available within the acquisition timeout. */
    POOL_EXHAUSTED(true),

    /** The connection broke underneath a unit of work. The transaction was rolled back. */
    CONNECTION_LOST(true),

    /** Serialization failure or deadlock reported by the store. */
    TRANSACTION_CONFLICT(true),

    /** The calling thread was interrupted while waiting on the store. */
    CANCELLED(false),

    /** Any other SQL failure: constraint violations, syntax errors, bad data. */
    DATA_ACCESS(false);

    private final boolean retriable;

    ErrorKind(boolean retriable) {
        this.retriable = retriable;
    }

    public boolean retriable() {
        return retriable;
    }
}
