package com.sprout.bot.config;

import com.sprout.database.DatabaseSettings;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Turns the deployment's {@code DATABASE_URL} into {@link DatabaseSettings}.
 *
 * <p>Accepts a JDBC URL as is, or a libpq-style URL ({@code postgresql://}, {@code postgres://},
 * {@code postgresql+asyncpg://}) whose user info becomes the credentials:
 *
 * <pre>
 * postgresql+asyncpg://bot:secret@db:5432/watering  →  jdbc:postgresql://db:5432/watering, bot / secret
 * </pre>
 *
 * Explicit {@code DATABASE_USER} / {@code DATABASE_PASSWORD} values win over the URL's.
 */
public final class DatabaseUrl {

    private static final Set<String> POSTGRES_SCHEMES = Set.of("postgresql", "postgres", "postgresql+asyncpg",
            "postgresql+psycopg", "postgresql+psycopg2");

    private DatabaseUrl() {
        // Utility class
    }

    /**
     * @throws IllegalArgumentException if the URL is blank or of an unsupported scheme
     */
    public static DatabaseSettings parse(String url, String userOverride, String passwordOverride) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("DATABASE_URL is required");
        }
        String trimmed = url.trim();
        if (trimmed.startsWith("jdbc:")) {
            return new DatabaseSettings(trimmed, blankToNull(userOverride), blankToNull(passwordOverride));
        }

        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("DATABASE_URL is not a valid URL: " + e.getMessage(), e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!POSTGRES_SCHEMES.contains(scheme)) {
            throw new IllegalArgumentException("DATABASE_URL scheme '%s' is not supported".formatted(scheme));
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("DATABASE_URL has no host");
        }

        String user = null;
        String password = null;
        if (uri.getRawUserInfo() != null) {
            String[] parts = uri.getRawUserInfo().split(":", 2);
            user = decode(parts[0]);
            password = parts.length > 1 ? decode(parts[1]) : null;
        }

        StringBuilder jdbc = new StringBuilder("jdbc:postgresql://").append(uri.getHost());
        if (uri.getPort() > 0) {
            jdbc.append(':').append(uri.getPort());
        }
        jdbc.append(uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath());
        if (uri.getRawQuery() != null) {
            jdbc.append('?').append(uri.getRawQuery());
        }

        return new DatabaseSettings(jdbc.toString(),
                userOverride != null && !userOverride.isBlank() ? userOverride : user,
                passwordOverride != null && !passwordOverride.isBlank() ? passwordOverride : password);
    }

    /** Percent-decoding only; a literal {@code +} in user info stays a plus. */
    private static String decode(String value) {
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
