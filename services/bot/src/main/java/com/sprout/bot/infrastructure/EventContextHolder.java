package com.sprout.bot.infrastructure;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link EventContext} with SLF4J MDC bridge.
 *
 * <p>Worker threads are pooled, so the dispatch loop wraps every unit of work in
 * {@link #runWithContext(EventContext, Runnable)}, which restores the previous state afterwards.
 */
public final class EventContextHolder {

    private static final ThreadLocal<EventContext> CONTEXT = new ThreadLocal<>();

    private EventContextHolder() {
        // Utility class
    }

    /**
     * @throws IllegalArgumentException if context is null
     */
    public static void set(EventContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        MDC.put(EventContext.MDC_EVENT_ID, context.eventId());
        MDC.put(EventContext.MDC_CHAT_ID, Long.toString(context.chatId()));
        MDC.put(EventContext.MDC_USER_ID, Long.toString(context.userId()));
    }

    public static Optional<EventContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(EventContext.MDC_EVENT_ID);
        MDC.remove(EventContext.MDC_CHAT_ID);
        MDC.remove(EventContext.MDC_USER_ID);
    }

    /**
     * Runs the work with the context set, then restores the previous context or clears it.
     */
    public static void runWithContext(EventContext context, Runnable runnable) {
        EventContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }
}
