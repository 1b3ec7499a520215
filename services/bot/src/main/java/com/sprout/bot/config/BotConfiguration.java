package com.sprout.bot.config;

import com.sprout.bot.dispatch.EventDispatcher;
import com.sprout.bot.dispatch.EventHandler;
import com.sprout.bot.dispatch.PlantsCommandHandler;
import com.sprout.bot.dispatch.StartCommandHandler;
import com.sprout.bot.dispatch.TimezoneCommandHandler;
import com.sprout.bot.infrastructure.DatabaseHealthIndicator;
import com.sprout.bot.infrastructure.MigrationMetrics;
import com.sprout.bot.persistence.UnitOfWorkRunner;
import com.sprout.bot.transport.BotTransport;
import com.sprout.bot.transport.InMemoryTransport;
import com.sprout.database.migration.MigrationReport;
import com.sprout.database.session.SessionManager;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

/**
 * Application wiring. {@link BotProperties} and the {@link MigrationReport} come from the launcher.
 */
@Configuration(proxyBeanMethods = false)
public class BotConfiguration {

    @Bean(destroyMethod = "close")
    SessionManager sessionManager(BotProperties properties, MigrationReport migrationReport, MeterRegistry registry) {
        return SessionManager.open(properties.database(), properties.pool(), migrationReport, registry);
    }

    @Bean
    UnitOfWorkRunner unitOfWorkRunner(SessionManager sessions, BotProperties properties, MeterRegistry registry) {
        return new UnitOfWorkRunner(sessions, properties.dispatch(), registry);
    }

    @Bean
    @ConditionalOnMissingBean(BotTransport.class)
    InMemoryTransport botTransport() {
        return new InMemoryTransport();
    }

    @Bean
    @Order(1)
    StartCommandHandler startCommandHandler(BotProperties properties) {
        return new StartCommandHandler(properties.defaultTimezone());
    }

    @Bean
    @Order(2)
    TimezoneCommandHandler timezoneCommandHandler(BotProperties properties) {
        return new TimezoneCommandHandler(properties.defaultTimezone());
    }

    @Bean
    @Order(3)
    PlantsCommandHandler plantsCommandHandler() {
        return new PlantsCommandHandler();
    }

    @Bean
    EventDispatcher eventDispatcher(BotTransport transport, List<EventHandler> handlers, UnitOfWorkRunner runner,
            BotProperties properties, MeterRegistry registry) {
        return new EventDispatcher(transport, handlers, runner, properties.dispatch(), registry);
    }

    @Bean
    MigrationMetrics migrationMetrics(MigrationReport migrationReport) {
        return new MigrationMetrics(migrationReport);
    }

    @Bean
    DatabaseHealthIndicator databaseHealthIndicator(SessionManager sessions) {
        return new DatabaseHealthIndicator(sessions);
    }
}
