package com.sprout.database.migration;

/**
 * Outcome of one successful {@link MigrationTool#migrate()} call.
 *
 * @param initialVersion schema version before the call (null for an empty store)
 * @param targetVersion schema version after the call (null if nothing was ever applied)
 * @param revisionsApplied number of revisions executed by this call
 */
public record MigrationRun(String initialVersion, String targetVersion, int revisionsApplied) {}
