package com.sprout.database.session;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

/**
 * Connection pool configuration for the {@link SessionManager}.
 *
 * @param maxSize maximum number of live connections (checked out plus idle)
 * @param minIdle idle connections the pool keeps warm
 * @param acquireTimeout how long {@link SessionManager#acquire()} waits before reporting the pool
 *     as exhausted; HikariCP's floor is 250 ms
 * @param validationTimeout how long a liveness probe may take; capped at {@code acquireTimeout}
 * @param maxLifetime age after which an idle connection is retired and replaced
 * @param poolName name used in logs, thread names and metrics
 */
public record PoolSettings(
        @Min(1) int maxSize,
        @Min(0) int minIdle,
        @NotNull Duration acquireTimeout,
        @NotNull Duration validationTimeout,
        @NotNull Duration maxLifetime,
        String poolName) {

    public static final Duration MIN_ACQUIRE_TIMEOUT = Duration.ofMillis(250);

    public static final Duration MIN_MAX_LIFETIME = Duration.ofSeconds(30);

    public PoolSettings {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1");
        }
        if (minIdle < 0 || minIdle > maxSize) {
            throw new IllegalArgumentException("minIdle must be between 0 and maxSize (%d)".formatted(maxSize));
        }
        if (acquireTimeout == null || acquireTimeout.compareTo(MIN_ACQUIRE_TIMEOUT) < 0) {
            throw new IllegalArgumentException("acquireTimeout must be at least 250 ms");
        }
        if (validationTimeout == null || validationTimeout.compareTo(MIN_ACQUIRE_TIMEOUT) < 0) {
            validationTimeout = MIN_ACQUIRE_TIMEOUT;
        }
        if (validationTimeout.compareTo(acquireTimeout) > 0) {
            validationTimeout = acquireTimeout;
        }
        if (maxLifetime == null || maxLifetime.compareTo(MIN_MAX_LIFETIME) < 0) {
            maxLifetime = Duration.ofMinutes(30);
        }
        if (poolName == null || poolName.isBlank()) {
            poolName = "sprout-db";
        }
    }

    /** 10 connections, 2 idle, 5 s acquisition, 2 s validation, 30 min lifetime. */
    public static PoolSettings defaults() {
        return new PoolSettings(10, 2, Duration.ofSeconds(5), Duration.ofSeconds(2), Duration.ofMinutes(30), null);
    }
}
