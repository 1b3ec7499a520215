package com.sprout.bot.persistence;

import java.time.Instant;

/**
 * One entry of a user's care history. Outlives the plant and schedule it mentions: their ids
 * become null, the plant name stays in {@code plantNameAtTime}.
 */
public record ActionLog(
        long id,
        long userId,
        Long plantId,
        Long scheduleId,
        ActionType actionType,
        ActionStatus status,
        ActionSource source,
        Instant doneAt,
        String plantNameAtTime,
        String note) {}
