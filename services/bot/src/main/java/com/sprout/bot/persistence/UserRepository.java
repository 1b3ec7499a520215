package com.sprout.bot.persistence;

import com.sprout.database.session.RowMapper;
import com.sprout.database.session.Rows;
import com.sprout.database.session.TransactionScope;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

public class UserRepository {

    private static final RowMapper<User> MAPPER = row -> new User(
            row.getLong("id"),
            row.getString("username"),
            ZoneId.of(row.getString("tz")),
            Rows.instant(row, "created_at"));

    private final TransactionScope tx;

    public UserRepository(TransactionScope tx) {
        this.tx = tx;
    }

    public Optional<User> find(long telegramId) {
        return tx.queryOne("SELECT id, username, tz, created_at FROM users WHERE id = ?", MAPPER, telegramId);
    }

    public User create(long telegramId, String username, ZoneId timezone) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        tx.update("INSERT INTO users (id, username, tz, created_at) VALUES (?, ?, ?, ?)",
                telegramId, username, timezone.getId(), now);
        return new User(telegramId, username, timezone, now);
    }

    /**
     * Returns the user, registering them on first contact. A changed Telegram username is stored.
     */
    public User getOrCreate(long telegramId, String username, ZoneId defaultTimezone) {
        Optional<User> existing = find(telegramId);
        if (existing.isEmpty()) {
            return create(telegramId, username, defaultTimezone);
        }
        User user = existing.get();
        if (username != null && !Objects.equals(username, user.username())) {
            tx.update("UPDATE users SET username = ? WHERE id = ?", username, telegramId);
            return new User(user.id(), username, user.timezone(), user.createdAt());
        }
        return user;
    }

    public boolean setTimezone(long telegramId, ZoneId timezone) {
        return tx.update("UPDATE users SET tz = ? WHERE id = ?", timezone.getId(), telegramId) == 1;
    }

    /** Deletes the user together with their species, plants, schedules and history. */
    public boolean delete(long telegramId) {
        return tx.update("DELETE FROM users WHERE id = ?", telegramId) == 1;
    }
}
