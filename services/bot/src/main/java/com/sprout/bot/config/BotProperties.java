package com.sprout.bot.config;

import com.sprout.database.DatabaseSettings;
import com.sprout.database.migration.MigrationSettings;
import com.sprout.database.session.PoolSettings;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Valid;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Configuration of one bot process, captured once from the environment before anything starts.
 *
 * <p>The same instance feeds the migration gate and, through the application context, the session
 * manager and the dispatch loop; nothing else reads the environment. Capture fails with an
 * {@link IllegalArgumentException} listing every problem at once.
 *
 * <pre>
 * DATABASE_URL=postgresql+asyncpg://bot:secret@db:5432/watering
 * MIGRATION_LOCATIONS=classpath:db/migration/sprout
 * DB_POOL_MAX_SIZE=10
 * DISPATCH_WORKERS=4
 * TIMEZONE_DEFAULT=Europe/Amsterdam
 * </pre>
 *
 * @param database store connection settings
 * @param migration how the migration gate drives Flyway
 * @param pool connection pool sizing and timeouts
 * @param dispatch dispatch loop tuning
 * @param botToken credential handed to the transport adapter; may be null for the in-memory transport
 * @param defaultTimezone timezone assigned to newly registered users
 * @param logLevel root log level
 */
public record BotProperties(
        @NotNull @Valid DatabaseSettings database,
        @NotNull @Valid MigrationSettings migration,
        @NotNull @Valid PoolSettings pool,
        @NotNull @Valid DispatchSettings dispatch,
        String botToken,
        @NotNull ZoneId defaultTimezone,
        @NotBlank String logLevel) {

    public static final String DEFAULT_TIMEZONE = "Europe/Amsterdam";

    private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    public BotProperties {
        if (logLevel == null || logLevel.isBlank()) {
            logLevel = "INFO";
        }
    }

    /**
     * Captures the configuration from environment variables.
     *
     * @param env the process environment, usually {@link System#getenv()}
     * @throws IllegalArgumentException listing every missing or malformed value
     */
    public static BotProperties fromEnvironment(Map<String, String> env) {
        var reader = new EnvReader(env);

        DatabaseSettings database = reader.build("DATABASE_URL", () -> DatabaseUrl.parse(
                env.get("DATABASE_URL"), env.get("DATABASE_USER"), env.get("DATABASE_PASSWORD")));

        List<String> locations = reader.list("MIGRATION_LOCATIONS", MigrationSettings.DEFAULT_LOCATION);
        boolean baseline = reader.bool("MIGRATION_BASELINE_ON_MIGRATE", true);
        int lockRetries = reader.integer("MIGRATION_LOCK_RETRY_COUNT", MigrationSettings.DEFAULT_LOCK_RETRY_COUNT);
        int connectRetries = reader.integer("MIGRATION_CONNECT_RETRIES", 0);
        MigrationSettings migration = reader.build("MIGRATION_*",
                () -> new MigrationSettings(locations, baseline, lockRetries, connectRetries));

        int maxSize = reader.integer("DB_POOL_MAX_SIZE", 10);
        int minIdle = reader.integer("DB_POOL_MIN_IDLE", Math.min(2, Math.max(maxSize, 0)));
        Duration acquire = reader.millis("DB_POOL_ACQUIRE_TIMEOUT_MS", 5_000);
        Duration validation = reader.millis("DB_POOL_VALIDATION_TIMEOUT_MS", 2_000);
        Duration lifetime = reader.millis("DB_POOL_MAX_LIFETIME_MS", 1_800_000);
        PoolSettings pool = reader.build("DB_POOL_*",
                () -> new PoolSettings(maxSize, minIdle, acquire, validation, lifetime, "sprout-db"));

        DispatchSettings dispatch = new DispatchSettings(
                reader.integer("DISPATCH_WORKERS", 4),
                reader.integer("DISPATCH_MAX_ATTEMPTS", 3),
                reader.millis("DISPATCH_INITIAL_BACKOFF_MS", 200),
                reader.millis("DISPATCH_POLL_TIMEOUT_MS", 1_000));

        ZoneId timezone = reader.build("TIMEZONE_DEFAULT",
                () -> ZoneId.of(reader.string("TIMEZONE_DEFAULT", DEFAULT_TIMEZONE)));

        String logLevel = reader.string("LOG_LEVEL", "INFO").toUpperCase(Locale.ROOT);
        if (!LOG_LEVELS.contains(logLevel)) {
            reader.errors.add("LOG_LEVEL: '%s' is not one of %s".formatted(logLevel, LOG_LEVELS));
        }

        reader.failIfInvalid();
        BotProperties properties = new BotProperties(database, migration, pool, dispatch,
                reader.string("BOT_TOKEN", null), timezone, logLevel);
        validate(properties);
        return properties;
    }

    /** Never prints the bot token or the database password. */
    @Override
    public String toString() {
        return "BotProperties[database=%s, migration=%s, pool=%s, dispatch=%s, botToken=%s, defaultTimezone=%s, logLevel=%s]"
                .formatted(database, migration, pool, dispatch, botToken == null ? "<none>" : "****",
                        defaultTimezone, logLevel);
    }

    private static void validate(BotProperties properties) {
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            Set<ConstraintViolation<BotProperties>> violations = validator.validate(properties);
            if (!violations.isEmpty()) {
                List<String> messages = violations.stream()
                        .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                        .sorted()
                        .toList();
                throw new IllegalArgumentException("Invalid configuration: " + String.join("; ", messages));
            }
        }
    }

    /** Reads typed values and collects every problem instead of stopping at the first. */
    private static final class EnvReader {

        private final Map<String, String> env;
        private final List<String> errors = new ArrayList<>();

        EnvReader(Map<String, String> env) {
            this.env = env;
        }

        String string(String name, String defaultValue) {
            String value = env.get(name);
            return value == null || value.isBlank() ? defaultValue : value.trim();
        }

        int integer(String name, int defaultValue) {
            String value = string(name, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                errors.add("%s: '%s' is not an integer".formatted(name, value));
                return defaultValue;
            }
        }

        Duration millis(String name, long defaultValue) {
            String value = string(name, null);
            if (value == null) {
                return Duration.ofMillis(defaultValue);
            }
            try {
                return Duration.ofMillis(Long.parseLong(value));
            } catch (NumberFormatException e) {
                errors.add("%s: '%s' is not a number of milliseconds".formatted(name, value));
                return Duration.ofMillis(defaultValue);
            }
        }

        boolean bool(String name, boolean defaultValue) {
            String value = string(name, null);
            if (value == null) {
                return defaultValue;
            }
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "true", "1", "yes", "on" -> true;
                case "false", "0", "no", "off" -> false;
                default -> {
                    errors.add("%s: '%s' is not a boolean".formatted(name, value));
                    yield defaultValue;
                }
            };
        }

        List<String> list(String name, String defaultValue) {
            return Arrays.stream(string(name, defaultValue).split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }

        <T> T build(String name, Supplier<T> factory) {
            try {
                return factory.get();
            } catch (IllegalArgumentException | DateTimeException e) {
                errors.add(name + ": " + e.getMessage());
                return null;
            }
        }

        void failIfInvalid() {
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("Invalid configuration: " + String.join("; ", errors));
            }
        }
    }
}
