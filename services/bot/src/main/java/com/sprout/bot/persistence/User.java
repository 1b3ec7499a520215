package com.sprout.bot.persistence;

import java.time.Instant;
import java.time.ZoneId;

/**
 * A bot user, keyed by Telegram user id.
 *
 * @param id Telegram user id
 * @param username Telegram username without the {@code @}; may be null
 * @param timezone zone reminders are scheduled in
 * @param createdAt registration time
 */
public record User(long id, String username, ZoneId timezone, Instant createdAt) {}
