package com.sprout.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DatabaseSettings")
class DatabaseSettingsTest {

    @Test
    @DisplayName("rejects a blank URL")
    void rejectsBlankUrl() {
        assertThatThrownBy(() -> new DatabaseSettings(" ", "u", "p")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rejects a URL that is not JDBC")
    void rejectsNonJdbcUrl() {
        assertThatThrownBy(() -> new DatabaseSettings("postgresql://db/watering", "u", "p"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JDBC");
    }

    @Test
    @DisplayName("never prints the password")
    void redactsPassword() {
        var settings = new DatabaseSettings("jdbc:postgresql://db:5432/watering", "bot", "s3cret");

        assertThat(settings.toString()).contains("bot", "****").doesNotContain("s3cret");
        assertThat(new DatabaseSettings("jdbc:h2:mem:x", null, null).toString()).contains("<none>");
    }
}
