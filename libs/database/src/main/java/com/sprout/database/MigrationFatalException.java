package com.sprout.database;

import com.sprout.database.migration.MigrationFailure;

/**
 * The schema could not be brought to the latest known revision. Never retried inside the process:
 * it surfaces to process exit and an operator or orchestrator re-invokes.
 */
public class MigrationFatalException extends DatabaseException {

    private final MigrationFailure failure;

    public MigrationFatalException(MigrationFailure failure, String detail) {
        super(ErrorKind.MIGRATION_FATAL,
                "Schema migration failed (%s): %s".formatted(failure, detail), null);
        this.failure = failure;
    }

    public MigrationFailure failure() {
        return failure;
    }
}
