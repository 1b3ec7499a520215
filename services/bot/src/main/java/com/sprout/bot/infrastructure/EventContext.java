package com.sprout.bot.infrastructure;

import com.sprout.bot.transport.InboundEvent;

/**
 * Identity of the inbound event a thread is working on, mirrored into the SLF4J MDC so every log
 * line of a unit of work carries it.
 */
public record EventContext(String eventId, long chatId, long userId) {

    public static final String MDC_EVENT_ID = "eventId";
    public static final String MDC_CHAT_ID = "chatId";
    public static final String MDC_USER_ID = "userId";

    public static EventContext of(InboundEvent event) {
        return new EventContext(event.eventId(), event.chatId(), event.userId());
    }
}
