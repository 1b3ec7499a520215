package com.sprout.bot.persistence;

/**
 * @param speciesId null when the plant has no species or its species was deleted
 */
public record Plant(long id, long userId, String name, Long speciesId) {}
