package com.sprout.bot.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.sprout.bot.persistence.TestSessions;
import com.sprout.database.ConnectionLostException;
import com.sprout.database.ErrorKind;
import com.sprout.database.session.PoolSettings;
import com.sprout.database.session.PoolSnapshot;
import com.sprout.database.session.SessionManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@DisplayName("DatabaseHealthIndicator")
class DatabaseHealthIndicatorTest {

    @Test
    @DisplayName("is UP with schema version and pool details while the store answers")
    void upWhenReachable() {
        try (SessionManager sessions = TestSessions.open("health", new SimpleMeterRegistry())) {
            Health health = new DatabaseHealthIndicator(sessions).health();

            assertThat(health.getStatus()).isEqualTo(Status.UP);
            assertThat(health.getDetails())
                    .containsEntry("schemaVersion", "3")
                    .containsKeys("active", "idle", "total", "awaiting", "maxSize");
        }
    }

    @Test
    @DisplayName("is OUT_OF_SERVICE once the session manager closed")
    void outOfServiceWhenClosed() {
        SessionManager sessions = TestSessions.open("health_closed", new SimpleMeterRegistry());
        sessions.close();

        assertThat(new DatabaseHealthIndicator(sessions).health().getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
    }

    @Test
    @DisplayName("is DOWN with the failure kind when the store cannot be reached")
    void downWhenUnreachable() {
        SessionManager sessions = mock(SessionManager.class);
        when(sessions.isClosed()).thenReturn(false);
        when(sessions.ping()).thenThrow(new ConnectionLostException("store unreachable", null));
        when(sessions.snapshot()).thenReturn(new PoolSnapshot(0, 0, 0, 0, 0));
        when(sessions.poolSettings()).thenReturn(PoolSettings.defaults());
        when(sessions.schemaVersion()).thenReturn("3");

        Health health = new DatabaseHealthIndicator(sessions).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("kind", ErrorKind.CONNECTION_LOST);
    }
}
