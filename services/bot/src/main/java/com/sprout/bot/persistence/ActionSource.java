package com.sprout.bot.persistence;

/** Whether a history entry answers a reminder or was logged by hand. */
public enum ActionSource {
    SCHEDULE,
    MANUAL
}
