package com.sprout.database.migration;

/**
 * A {@link MigrationTool} call failed. Carries the tool's own classification of the failure.
 */
public class MigrationToolException extends RuntimeException {

    private final MigrationFailure failure;

    public MigrationToolException(MigrationFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public MigrationFailure failure() {
        return failure;
    }
}
