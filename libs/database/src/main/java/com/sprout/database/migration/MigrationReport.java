package com.sprout.database.migration;

import com.sprout.database.MigrationFatalException;
import java.time.Duration;

/**
 * Result of one {@link MigrationGate#run()}.
 *
 * <p>A successful report is also the proof the session manager demands before it hands out any
 * connection: no report, no pool.
 *
 * @param succeeded whether the store is now at the latest known revision
 * @param startingVersion schema version found at the start (null for an empty store)
 * @param finalVersion schema version at the end (null if nothing is applied)
 * @param revisionsApplied revisions executed by this run
 * @param failure failure reason, null when succeeded
 * @param detail human-readable explanation of the failure, null when succeeded
 * @param elapsed wall-clock time spent in the gate
 */
public record MigrationReport(
        boolean succeeded,
        String startingVersion,
        String finalVersion,
        int revisionsApplied,
        MigrationFailure failure,
        String detail,
        Duration elapsed) {

    public MigrationReport {
        if (succeeded && failure != null) {
            throw new IllegalArgumentException("a successful report cannot carry a failure");
        }
        if (!succeeded && failure == null) {
            throw new IllegalArgumentException("a failed report must carry a failure reason");
        }
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
    }

    public static MigrationReport success(
            String startingVersion, String finalVersion, int revisionsApplied, Duration elapsed) {
        return new MigrationReport(true, startingVersion, finalVersion, revisionsApplied, null, null, elapsed);
    }

    public static MigrationReport failed(
            String startingVersion, MigrationFailure failure, String detail, Duration elapsed) {
        return new MigrationReport(false, startingVersion, startingVersion, 0, failure, detail, elapsed);
    }

    /**
     * Returns this report if it succeeded.
     *
     * @throws MigrationFatalException if the gate failed
     */
    public MigrationReport orThrow() {
        if (!succeeded) {
            throw new MigrationFatalException(failure, detail);
        }
        return this;
    }
}
