package com.sprout.bot.transport;

/** A text message to send to a chat. */
public record OutboundReply(long chatId, String text) {}
