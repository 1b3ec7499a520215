package com.sprout.bot.persistence;

/** What a schedule reminds about and what a history entry records. */
public enum ActionType {
    WATERING,
    FERTILIZING,
    REPOTTING,
    CUSTOM
}
