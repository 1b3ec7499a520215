package com.sprout.bot.infrastructure;

import com.sprout.database.DatabaseException;
import com.sprout.database.session.PoolSnapshot;
import com.sprout.database.session.SessionManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports whether the store answers, with pool occupancy and the schema version the migration gate
 * left it at.
 */
public class DatabaseHealthIndicator implements HealthIndicator {

    private final SessionManager sessions;

    public DatabaseHealthIndicator(SessionManager sessions) {
        this.sessions = sessions;
    }

    @Override
    public Health health() {
        if (sessions.isClosed()) {
            return Health.outOfService().withDetail("reason", "session manager closed").build();
        }
        Health.Builder builder;
        try {
            builder = sessions.ping() ? Health.up() : Health.down().withDetail("reason", "validation failed");
        } catch (DatabaseException e) {
            builder = Health.down(e).withDetail("kind", e.kind());
        }
        PoolSnapshot pool = sessions.snapshot();
        return builder
                .withDetail("schemaVersion", String.valueOf(sessions.schemaVersion()))
                .withDetail("active", pool.active())
                .withDetail("idle", pool.idle())
                .withDetail("total", pool.total())
                .withDetail("awaiting", pool.awaiting())
                .withDetail("maxSize", sessions.poolSettings().maxSize())
                .build();
    }
}
