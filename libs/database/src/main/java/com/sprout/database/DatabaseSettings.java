package com.sprout.database;

import jakarta.validation.constraints.NotBlank;

/**
 * Connection settings for the bot's relational store, shared by the migration gate and the
 * session manager.
 *
 * <p>Captured once at startup from the environment and passed explicitly; nothing in this module
 * reads the environment on its own.
 *
 * @param url JDBC connection URL (e.g., {@code jdbc:postgresql://db:5432/watering})
 * @param username database user; may be null when the URL carries the credentials
 * @param password database password; may be null
 */
public record DatabaseSettings(@NotBlank String url, String username, String password) {

    public DatabaseSettings {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null or blank");
        }
        if (!url.startsWith("jdbc:")) {
            throw new IllegalArgumentException("url must be a JDBC URL, got '%s'".formatted(url));
        }
    }

    /** Never prints the password. */
    @Override
    public String toString() {
        return "DatabaseSettings[url=%s, username=%s, password=%s]"
                .formatted(url, username, password == null ? "<none>" : "****");
    }
}
