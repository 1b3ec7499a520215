package com.sprout.database;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransactionRollbackException;
import java.util.Set;

/**
 * Maps driver {@link SQLException}s onto the {@link ErrorKind} taxonomy.
 *
 * <p>Classification is by SQLSTATE first (portable across PostgreSQL and H2), then by the JDBC 4
 * exception subclass the driver chose.
 */
public final class SqlErrorClassifier {

    /** SQLSTATE class 08: connection exception. */
    private static final String CONNECTION_EXCEPTION_CLASS = "08";

    /** PostgreSQL admin shutdown / crash shutdown / cannot connect now. */
    private static final Set<String> SERVER_GONE_STATES = Set.of("57P01", "57P02", "57P03");

    /** serialization_failure, deadlock_detected, H2 lock timeout. */
    private static final Set<String> CONFLICT_STATES = Set.of("40001", "40P01", "HYT00");

    private SqlErrorClassifier() {
        // Utility class
    }

    /**
     * Returns the kind of failure the exception represents.
     */
    public static ErrorKind classify(SQLException e) {
        String state = sqlState(e);
        if (state != null) {
            if (state.startsWith(CONNECTION_EXCEPTION_CLASS) || SERVER_GONE_STATES.contains(state)) {
                return ErrorKind.CONNECTION_LOST;
            }
            if (CONFLICT_STATES.contains(state)) {
                return ErrorKind.TRANSACTION_CONFLICT;
            }
        }
        if (e instanceof SQLRecoverableException || e instanceof SQLNonTransientConnectionException) {
            return ErrorKind.CONNECTION_LOST;
        }
        if (e instanceof SQLTransactionRollbackException) {
            return ErrorKind.TRANSACTION_CONFLICT;
        }
        return ErrorKind.DATA_ACCESS;
    }

    /**
     * Wraps the exception in the matching {@link DatabaseException} subclass.
     *
     * @param operation short description of what was being done, used in the message
     * @param e the driver exception
     */
    public static DatabaseException translate(String operation, SQLException e) {
        String state = sqlState(e);
        String message = "%s failed [SQLState %s]: %s".formatted(operation, state, e.getMessage());
        return switch (classify(e)) {
            case CONNECTION_LOST -> new ConnectionLostException(message, e);
            case TRANSACTION_CONFLICT -> new TransactionConflictException(message, state, e);
            default -> new PersistenceException(message, state, e);
        };
    }

    /**
     * Returns the first non-null SQLSTATE in the exception's chain of next exceptions and causes.
     */
    static String sqlState(SQLException e) {
        Throwable current = e;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof SQLException sql && sql.getSQLState() != null) {
                return sql.getSQLState();
            }
            current = current.getCause();
        }
        SQLException next = e.getNextException();
        return next != null ? next.getSQLState() : null;
    }
}
