package com.sprout.bot.persistence;

import java.time.LocalTime;
import java.util.Objects;

/**
 * A schedule to be created. Creating never overwrites an existing schedule; every call adds an
 * independent timer.
 *
 * <p>Custom title and note are kept only for {@link ActionType#CUSTOM} actions and dropped for the
 * others.
 */
public record NewSchedule(
        long plantId,
        ActionType actionType,
        ScheduleType scheduleType,
        Integer intervalDays,
        Integer weeklyMask,
        LocalTime localTime,
        String customTitle,
        String customNoteTemplate) {

    /** All seven days. */
    public static final int EVERY_DAY_MASK = 0b111_1111;

    public NewSchedule {
        Objects.requireNonNull(actionType, "actionType must not be null");
        Objects.requireNonNull(scheduleType, "scheduleType must not be null");
        Objects.requireNonNull(localTime, "localTime must not be null");
        switch (scheduleType) {
            case INTERVAL -> {
                if (intervalDays == null || intervalDays <= 0) {
                    throw new IllegalArgumentException("an interval schedule needs intervalDays > 0");
                }
                weeklyMask = null;
            }
            case WEEKLY -> {
                if (weeklyMask == null || weeklyMask < 1 || weeklyMask > EVERY_DAY_MASK) {
                    throw new IllegalArgumentException("a weekly schedule needs a weeklyMask between 1 and 127");
                }
                intervalDays = null;
            }
        }
        if (actionType != ActionType.CUSTOM) {
            customTitle = null;
            customNoteTemplate = null;
        }
    }

    public static NewSchedule interval(long plantId, ActionType action, int days, LocalTime at) {
        return new NewSchedule(plantId, action, ScheduleType.INTERVAL, days, null, at, null, null);
    }

    public static NewSchedule weekly(long plantId, ActionType action, int weeklyMask, LocalTime at) {
        return new NewSchedule(plantId, action, ScheduleType.WEEKLY, null, weeklyMask, at, null, null);
    }
}
