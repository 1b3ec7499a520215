package com.sprout.database.session;

import java.sql.Connection;
import java.sql.SQLException;

/** Work run on a leased connection in auto-commit mode. See {@link SessionManager#withConnection}. */
@FunctionalInterface
public interface ConnectionWork<T> {

    T execute(Connection connection) throws SQLException;
}
