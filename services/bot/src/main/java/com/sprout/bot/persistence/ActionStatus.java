package com.sprout.bot.persistence;

public enum ActionStatus {
    DONE,
    SKIPPED
}
