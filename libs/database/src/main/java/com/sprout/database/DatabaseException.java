package com.sprout.database;

/**
 * Root of the database error taxonomy.
 * <p>
 * Unchecked; the retry decision is taken once, at the unit-of-work boundary, from {@link #kind()}.
 */
public abstract class DatabaseException extends RuntimeException {

    private final ErrorKind kind;

    protected DatabaseException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** Whether re-running the whole unit of work may succeed. */
    public boolean retriable() {
        return kind.retriable();
    }
}
