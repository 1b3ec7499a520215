package com.sprout.database.migration;

/**
 * Why the migration gate refused to let the application start.
 */
public enum MigrationFailure {

    /** The store could not be reached with the configured settings. */
    STORE_UNREACHABLE(true),

    /** A revision is recorded as failed: an earlier run died half way through it. */
    PARTIALLY_APPLIED(false),

    /**
     * The recorded history does not match the revisions this build knows: an unknown revision is
     * applied, or an applied revision's checksum changed.
     */
    SCHEMA_INCONSISTENT(false),

    /** Another instance held the migration lock past the retry budget. */
    MIGRATION_IN_PROGRESS(true),

    /** A revision's script failed while being applied. */
    REVISION_FAILED(false),

    /** Misconfiguration or an unexpected error inside the migration tool. */
    TOOL_FAILURE(false);

    private final boolean retryOnRestart;

    MigrationFailure(boolean retryOnRestart) {
        this.retryOnRestart = retryOnRestart;
    }

    /**
     * Whether simply re-invoking the process later may succeed. The other reasons need an operator.
     */
    public boolean retryOnRestart() {
        return retryOnRestart;
    }
}
