package com.sprout.database.session;

import java.sql.SQLException;

/**
 * One unit of work inside a transaction. See {@link SessionManager#inTransaction}.
 *
 * <p>Returning normally commits; throwing anything rolls back.
 */
@FunctionalInterface
public interface TransactionWork<T> {

    T execute(TransactionScope tx) throws SQLException;
}
