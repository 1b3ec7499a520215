package com.sprout.bot;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;

/**
 * Sprout plant-care bot.
 *
 * <p>Always started through {@link BotLauncher}: the context expects the {@code botProperties} and
 * {@code migrationReport} beans the launcher registers after the migration gate passed. Flyway
 * auto-configuration is off because the gate owns schema migration.
 */
@SpringBootApplication(exclude = FlywayAutoConfiguration.class)
public class BotApplication {

    public static void main(String[] args) {
        StartupResult result = BotLauncher.launch(System.getenv(), args);
        if (!result.running()) {
            System.exit(result.exitCode());
        }
    }
}
