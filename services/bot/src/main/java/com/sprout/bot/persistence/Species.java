package com.sprout.bot.persistence;

/** A user's own plant species label; names are unique per user. */
public record Species(long id, long userId, String name) {}
