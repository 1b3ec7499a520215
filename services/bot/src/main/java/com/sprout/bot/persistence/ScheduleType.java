package com.sprout.bot.persistence;

public enum ScheduleType {
    /** Every {@code interval_days} days. */
    INTERVAL,
    /** On the weekdays set in {@code weekly_mask} (bit 0 = Monday). */
    WEEKLY
}
