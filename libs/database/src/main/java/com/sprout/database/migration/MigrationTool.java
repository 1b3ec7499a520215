package com.sprout.database.migration;

/**
 * Invocation contract of the external migration tool.
 *
 * <p>Both calls block until the tool is done. Implementations report failures as
 * {@link MigrationToolException} with a {@link MigrationFailure} reason; any other runtime
 * exception is treated by the gate as {@link MigrationFailure#TOOL_FAILURE}.
 */
public interface MigrationTool {

    /** Reads the store's schema history and compares it with the known revisions. */
    SchemaState inspect();

    /** Applies every pending revision in order, each inside its own atomic unit. */
    MigrationRun migrate();

    /** Human-readable target description for logs. Must not contain credentials. */
    String describe();
}
