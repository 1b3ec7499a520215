package com.sprout.bot.persistence;

import java.time.LocalTime;

/**
 * A stored reminder schedule for one plant.
 *
 * @param intervalDays days between reminders; set only for {@link ScheduleType#INTERVAL}
 * @param weeklyMask weekday bit set, bit 0 = Monday; set only for {@link ScheduleType#WEEKLY}
 * @param localTime reminder time in the owner's timezone
 * @param customTitle title of a {@link ActionType#CUSTOM} action, null otherwise
 * @param customNoteTemplate note prefilled into history entries of a custom action
 */
public record Schedule(
        long id,
        long plantId,
        ActionType actionType,
        ScheduleType scheduleType,
        Integer intervalDays,
        Integer weeklyMask,
        LocalTime localTime,
        boolean active,
        String customTitle,
        String customNoteTemplate) {}
