package com.sprout.database.migration;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;

/**
 * How the migration gate drives the migration tool.
 *
 * <pre>{@code
 * MIGRATION_LOCATIONS=classpath:db/migration/sprout
 * MIGRATION_BASELINE_ON_MIGRATE=true
 * MIGRATION_LOCK_RETRY_COUNT=50
 * MIGRATION_CONNECT_RETRIES=0
 * }</pre>
 *
 * @param locations revision history locations, scanned in order (e.g., {@code classpath:db/migration/sprout})
 * @param baselineOnMigrate baseline a non-empty schema that has no history table yet
 * @param lockRetryCount how often to retry the schema-history lock held by another instance
 * @param connectRetries how often to retry an unreachable store before giving up
 */
public record MigrationSettings(
        @NotEmpty List<String> locations,
        boolean baselineOnMigrate,
        @PositiveOrZero int lockRetryCount,
        @PositiveOrZero int connectRetries) {

    /** Location of the revisions shipped with this module. */
    public static final String DEFAULT_LOCATION = "classpath:db/migration/sprout";

    public static final int DEFAULT_LOCK_RETRY_COUNT = 50;

    public MigrationSettings {
        locations = locations == null || locations.isEmpty()
                ? List.of(DEFAULT_LOCATION)
                : List.copyOf(locations);
        if (lockRetryCount < 0) {
            throw new IllegalArgumentException("lockRetryCount must not be negative");
        }
        if (connectRetries < 0) {
            throw new IllegalArgumentException("connectRetries must not be negative");
        }
    }

    /** Shipped revisions, baseline on migrate, fail fast on an unreachable store. */
    public static MigrationSettings defaults() {
        return new MigrationSettings(List.of(DEFAULT_LOCATION), true, DEFAULT_LOCK_RETRY_COUNT, 0);
    }

    /** Same tuning, different revision locations. */
    public MigrationSettings withLocations(String... newLocations) {
        return new MigrationSettings(List.of(newLocations), baselineOnMigrate, lockRetryCount, connectRetries);
    }
}
