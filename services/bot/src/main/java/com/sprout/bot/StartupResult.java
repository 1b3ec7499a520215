package com.sprout.bot;

import com.sprout.database.migration.MigrationReport;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * How far {@link BotLauncher} got and what the process should exit with.
 *
 * @param phase the phase reached; {@link Phase#RUNNING} only when everything started
 * @param exitCode process exit code for this outcome
 * @param migration the migration gate's report; null if configuration was rejected
 * @param context the running application context; null unless running
 * @param detail failure explanation; null when running
 */
public record StartupResult(
        Phase phase, int exitCode, MigrationReport migration, ConfigurableApplicationContext context, String detail) {

    public static final int EXIT_OK = 0;
    public static final int EXIT_APPLICATION_FAILURE = 1;
    public static final int EXIT_CONFIGURATION_REJECTED = 2;
    public static final int EXIT_MIGRATION_FAILED = 3;

    public enum Phase {
        /** Environment could not be captured. */
        CONFIGURATION,
        /** The migration gate refused; the application was never started. */
        MIGRATION,
        /** The gate passed but the application context failed to start. */
        APPLICATION,
        RUNNING
    }

    static StartupResult configurationRejected(String detail) {
        return new StartupResult(Phase.CONFIGURATION, EXIT_CONFIGURATION_REJECTED, null, null, detail);
    }

    static StartupResult migrationFailed(MigrationReport report) {
        return new StartupResult(Phase.MIGRATION, EXIT_MIGRATION_FAILED, report, null,
                report.failure() + ": " + report.detail());
    }

    static StartupResult applicationFailed(MigrationReport report, Throwable cause) {
        return new StartupResult(Phase.APPLICATION, EXIT_APPLICATION_FAILURE, report, null, String.valueOf(cause));
    }

    static StartupResult running(MigrationReport report, ConfigurableApplicationContext context) {
        return new StartupResult(Phase.RUNNING, EXIT_OK, report, context, null);
    }

    public boolean running() {
        return phase == Phase.RUNNING;
    }
}
