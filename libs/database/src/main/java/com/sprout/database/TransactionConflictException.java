package com.sprout.database;

/** Serialization failure or deadlock. The transaction was rolled back and may be retried. */
public class TransactionConflictException extends DatabaseException {

    private final String sqlState;

    public TransactionConflictException(String message, String sqlState, Throwable cause) {
        super(ErrorKind.TRANSACTION_CONFLICT, message, cause);
        this.sqlState = sqlState;
    }

    public String sqlState() {
        return sqlState;
    }
}
