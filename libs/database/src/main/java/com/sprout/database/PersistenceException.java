package com.sprout.database;

/**
 * Non-retriable database failure: constraint violations, bad SQL, interrupted acquisition.
 */
public class PersistenceException extends DatabaseException {

    private final String sqlState;

    public PersistenceException(String message, String sqlState, Throwable cause) {
        this(ErrorKind.DATA_ACCESS, message, sqlState, cause);
    }

    public PersistenceException(ErrorKind kind, String message, String sqlState, Throwable cause) {
        super(kind, message, cause);
        this.sqlState = sqlState;
    }

    /** SQLSTATE reported by the driver, or null when the failure did not come from the store. */
    public String sqlState() {
        return sqlState;
    }
}
