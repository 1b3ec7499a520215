package com.sprout.database.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PoolSettings")
class PoolSettingsTest {

    @Test
    @DisplayName("defaults match the documented environment defaults")
    void defaults() {
        PoolSettings settings = PoolSettings.defaults();

        assertThat(settings.maxSize()).isEqualTo(10);
        assertThat(settings.minIdle()).isEqualTo(2);
        assertThat(settings.acquireTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.validationTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(settings.maxLifetime()).isEqualTo(Duration.ofMinutes(30));
        assertThat(settings.poolName()).isEqualTo("sprout-db");
    }

    @Test
    @DisplayName("rejects an acquisition timeout below 250 ms")
    void rejectsShortAcquireTimeout() {
        assertThatThrownBy(() -> new PoolSettings(2, 0, Duration.ofMillis(100), null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rejects minIdle above maxSize")
    void rejectsMinIdleAboveMax() {
        assertThatThrownBy(() -> new PoolSettings(2, 3, Duration.ofSeconds(1), null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("caps the validation timeout at the acquisition timeout")
    void capsValidationTimeout() {
        var settings = new PoolSettings(2, 0, Duration.ofSeconds(1), Duration.ofSeconds(10), null, null);

        assertThat(settings.validationTimeout()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("replaces a lifetime below 30 s with the default")
    void replacesShortLifetime() {
        var settings = new PoolSettings(2, 0, Duration.ofSeconds(1), null, Duration.ofSeconds(5), "p");

        assertThat(settings.maxLifetime()).isEqualTo(Duration.ofMinutes(30));
        assertThat(settings.validationTimeout()).isEqualTo(PoolSettings.MIN_ACQUIRE_TIMEOUT);
    }
}
