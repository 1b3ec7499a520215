package com.sprout.database.migration;

import com.sprout.database.DatabaseSettings;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.MigrationState;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.flywaydb.core.api.output.MigrateResult;
import org.flywaydb.core.api.output.ValidateOutput;
import org.flywaydb.core.api.output.ValidateResult;

/**
 * {@link MigrationTool} backed by Flyway.
 *
 * <p>Revisions are versioned SQL files named {@code V{n}__{description}.sql}. Flyway records each
 * applied revision in its schema history table inside the same transaction as the revision's
 * statements wherever the store supports transactional DDL (PostgreSQL does), so a revision and its
 * recorded version commit or roll back together. Concurrent instances serialize on the history
 * table lock (a PostgreSQL advisory lock); the loser waits, then finds the revision applied.
 *
 * <h2>Settings applied to every instance</h2>
 *
 * <ul>
 *   <li>{@code cleanDisabled=true}: the gate may only move the schema forward
 *   <li>{@code validateOnMigrate=true}: checksum drift and failed revisions stop the run
 *   <li>{@code outOfOrder=false}: revisions apply strictly in version order
 *   <li>{@code failOnMissingLocations=true}: a wrong location is an error, not an empty history
 *   <li>{@code ignoreMigrationPatterns=*:future,*:pending}: validation reports only revisions that
 *       were applied and have changed since; unknown and pending ones are judged by the gate
 * </ul>
 */
public class FlywayMigrationTool implements MigrationTool {

    private final Flyway flyway;
    private final String description;

    public FlywayMigrationTool(DatabaseSettings database, MigrationSettings migration) {
        this.flyway = Flyway.configure()
                .dataSource(database.url(), database.username(), database.password())
                .locations(migration.locations().toArray(String[]::new))
                .baselineOnMigrate(migration.baselineOnMigrate())
                .lockRetryCount(migration.lockRetryCount())
                .connectRetries(migration.connectRetries())
                .cleanDisabled(true)
                .validateOnMigrate(true)
                .outOfOrder(false)
                .failOnMissingLocations(true)
                .ignoreMigrationPatterns("*:future", "*:pending")
                .load();
        this.description = "flyway %s @ %s".formatted(migration.locations(), database.url());
    }

    @Override
    public SchemaState inspect() {
        MigrationInfoService info;
        try {
            info = flyway.info();
        } catch (FlywayException e) {
            throw toToolException("Reading schema history", e);
        }

        List<String> applied = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (MigrationInfo migration : info.all()) {
            MigrationState state = migration.getState();
            if (state.isFailed()) {
                failed.add(label(migration));
            } else if (state == MigrationState.FUTURE_SUCCESS || state == MigrationState.MISSING_SUCCESS) {
                unknown.add(label(migration));
            } else if (state.isApplied()) {
                applied.add(label(migration));
            }
        }
        List<String> pending = new ArrayList<>();
        for (MigrationInfo migration : info.pending()) {
            pending.add(label(migration));
        }

        List<String> drifted = failed.isEmpty() && unknown.isEmpty() ? validate() : List.of();
        return new SchemaState(versionOf(info.current()), applied, pending, failed, unknown, drifted);
    }

    /**
     * Compares every applied revision with the build's copy. {@code info()} alone does not look at
     * checksums, so an edited revision would otherwise pass unnoticed once nothing is pending.
     */
    private List<String> validate() {
        ValidateResult result;
        try {
            result = flyway.validateWithResult();
        } catch (FlywayException e) {
            throw toToolException("Validating schema history", e);
        }
        if (result.validationSuccessful) {
            return List.of();
        }
        List<String> drifted = new ArrayList<>();
        if (result.invalidMigrations != null) {
            for (ValidateOutput invalid : result.invalidMigrations) {
                drifted.add(invalid.version == null || invalid.version.isEmpty()
                        ? "R:" + invalid.description
                        : invalid.version);
            }
        }
        if (drifted.isEmpty()) {
            drifted.add(result.getAllErrorMessages());
        }
        return drifted;
    }

    @Override
    public MigrationRun migrate() {
        MigrateResult result;
        try {
            result = flyway.migrate();
        } catch (FlywayException e) {
            throw toToolException("Applying revisions", e);
        }
        if (!result.success) {
            throw new MigrationToolException(MigrationFailure.REVISION_FAILED,
                    "Flyway reported an unsuccessful migration of schema " + result.schemaName, null);
        }
        // Flyway leaves the target empty when it executed nothing, as the instance that waited on
        // another's lock does.
        String target = result.targetSchemaVersion;
        if (target == null) {
            try {
                target = versionOf(flyway.info().current());
            } catch (FlywayException e) {
                throw toToolException("Reading schema version after migrating", e);
            }
        }
        return new MigrationRun(result.initialSchemaVersion, target, result.migrationsExecuted);
    }

    @Override
    public String describe() {
        return description;
    }

    // ── Failure classification ──

    private static MigrationToolException toToolException(String operation, FlywayException e) {
        MigrationFailure failure = classify(e);
        return new MigrationToolException(failure, operation + " failed: " + e.getMessage(), e);
    }

    /**
     * Maps a Flyway failure to a gate failure reason. Flyway reports most conditions through plain
     * {@link FlywayException}s, so the message is consulted after the exception type and cause.
     */
    static MigrationFailure classify(FlywayException e) {
        if (causedByUnreachableStore(e)) {
            return MigrationFailure.STORE_UNREACHABLE;
        }
        String message = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
        if (e instanceof FlywayValidateException) {
            return message.contains("failed migration")
                    ? MigrationFailure.PARTIALLY_APPLIED
                    : MigrationFailure.SCHEMA_INCONSISTENT;
        }
        if (message.contains("lock") && message.contains("retries exceeded")) {
            return MigrationFailure.MIGRATION_IN_PROGRESS;
        }
        if (message.contains("unable to obtain connection")) {
            return MigrationFailure.STORE_UNREACHABLE;
        }
        if (message.contains("migration") && message.contains("failed")) {
            return MigrationFailure.REVISION_FAILED;
        }
        return MigrationFailure.TOOL_FAILURE;
    }

    private static boolean causedByUnreachableStore(Throwable e) {
        Throwable current = e;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof ConnectException || current instanceof UnknownHostException) {
                return true;
            }
            if (current instanceof SQLException sql
                    && sql.getSQLState() != null
                    && sql.getSQLState().startsWith("08")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String versionOf(MigrationInfo migration) {
        return migration != null && migration.getVersion() != null
                ? migration.getVersion().getVersion()
                : null;
    }

    private static String label(MigrationInfo migration) {
        return migration.getVersion() != null
                ? migration.getVersion().getVersion()
                : "R:" + migration.getDescription();
    }
}
