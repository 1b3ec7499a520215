package com.sprout.database;

/**
 * Thrown when the underlying connection broke during a unit of work. Any open transaction has
 * been rolled back and the connection has been discarded from the pool.
 */
public class ConnectionLostException extends DatabaseException {

    public ConnectionLostException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION_LOST, message, cause);
    }
}
