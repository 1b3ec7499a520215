package com.sprout.bot.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

/**
 * Dispatch loop tuning.
 *
 * @param workers size of the worker pool running units of work
 * @param maxAttempts attempts per unit of work when it fails with a retriable database error
 * @param initialBackoff wait before the second attempt; doubled for every further attempt
 * @param pollTimeout how long one transport poll may block
 */
public record DispatchSettings(
        @Min(1) int workers,
        @Min(1) int maxAttempts,
        @NotNull Duration initialBackoff,
        @NotNull Duration pollTimeout) {

    public DispatchSettings {
        if (initialBackoff == null || initialBackoff.isNegative()) {
            initialBackoff = Duration.ofMillis(200);
        }
        if (pollTimeout == null || pollTimeout.isNegative() || pollTimeout.isZero()) {
            pollTimeout = Duration.ofSeconds(1);
        }
    }

    public static DispatchSettings defaults() {
        return new DispatchSettings(4, 3, Duration.ofMillis(200), Duration.ofSeconds(1));
    }

    /** Backoff before the given attempt (2 for the first retry). */
    public Duration backoffBefore(int attempt) {
        int doublings = Math.max(0, Math.min(attempt - 2, 16));
        return initialBackoff.multipliedBy(1L << doublings);
    }
}
