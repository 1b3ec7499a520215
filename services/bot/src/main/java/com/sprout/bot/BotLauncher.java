package com.sprout.bot;

import com.sprout.bot.config.BotProperties;
import com.sprout.database.migration.FlywayMigrationTool;
import com.sprout.database.migration.MigrationFailure;
import com.sprout.database.migration.MigrationGate;
import com.sprout.database.migration.MigrationReport;
import com.sprout.database.migration.MigrationTool;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * The process's startup sequence, as a strict barrier:
 *
 * <ol>
 *   <li>capture configuration from the environment (exit 2 if rejected)
 *   <li>run the migration gate to completion (exit 3 if it refuses)
 *   <li>start the application context: session manager, then dispatch loop (exit 1 if it fails)
 * </ol>
 *
 * <p>Nothing of step 3 exists before step 2 succeeded: the gate's report is handed to the context
 * as a bean and the session manager will not open without it.
 */
public final class BotLauncher {

    private static final Logger log = LoggerFactory.getLogger(BotLauncher.class);

    private BotLauncher() {
        // Utility class
    }

    /** Launches against the configured store with the Flyway-backed migration tool. */
    public static StartupResult launch(Map<String, String> env, String... args) {
        return launch(env, properties -> new FlywayMigrationTool(properties.database(), properties.migration()), args);
    }

    /**
     * Launches with a custom migration tool.
     *
     * @param env environment variables to capture the configuration from
     * @param migrationTool builds the migration tool from the captured configuration
     * @param args command-line arguments passed on to Spring Boot
     */
    public static StartupResult launch(
            Map<String, String> env, Function<BotProperties, MigrationTool> migrationTool, String... args) {
        BotProperties properties;
        try {
            properties = BotProperties.fromEnvironment(env);
        } catch (IllegalArgumentException e) {
            log.error("Configuration rejected: {}", e.getMessage());
            return StartupResult.configurationRejected(e.getMessage());
        }
        log.info("Configuration captured: {}", properties);

        MigrationReport report = migrate(properties, migrationTool);
        if (!report.succeeded()) {
            log.error("Not starting the bot: schema migration failed ({})", report.failure());
            return StartupResult.migrationFailed(report);
        }

        try {
            ConfigurableApplicationContext context = new SpringApplicationBuilder(BotApplication.class)
                    .properties("logging.level.root=" + properties.logLevel())
                    .initializers(applicationContext -> {
                        ConfigurableListableBeanFactory beans = applicationContext.getBeanFactory();
                        beans.registerSingleton("botProperties", properties);
                        beans.registerSingleton("migrationReport", report);
                    })
                    .run(args);
            return StartupResult.running(report, context);
        } catch (RuntimeException e) {
            log.error("Application failed to start after migrating to schema version {}", report.finalVersion(), e);
            return StartupResult.applicationFailed(report, e);
        }
    }

    private static MigrationReport migrate(BotProperties properties, Function<BotProperties, MigrationTool> factory) {
        MigrationTool tool;
        try {
            tool = factory.apply(properties);
        } catch (RuntimeException e) {
            log.error("Could not set up the migration tool", e);
            return MigrationReport.failed(null, MigrationFailure.TOOL_FAILURE, e.toString(), Duration.ZERO);
        }
        // No application registry exists yet; MigrationMetrics publishes the report once it does.
        return new MigrationGate(tool).run();
    }
}
