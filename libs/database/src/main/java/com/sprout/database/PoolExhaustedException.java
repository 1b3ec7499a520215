package com.sprout.database;

import java.time.Duration;

/**
 * Thrown when no connection could be checked out within the configured acquisition timeout.
 * Retriable: callers are expected to back off and try the unit of work again.
 */
public class PoolExhaustedException extends DatabaseException {

    private final String poolName;
    private final Duration timeout;

    public PoolExhaustedException(String poolName, Duration timeout, Throwable cause) {
        super(ErrorKind.POOL_EXHAUSTED,
                "Connection pool '%s' unavailable: no connection within %d ms, retry later"
                        .formatted(poolName, timeout.toMillis()),
                cause);
        this.poolName = poolName;
        this.timeout = timeout;
    }

    public String poolName() {
        return poolName;
    }

    public Duration timeout() {
        return timeout;
    }
}
