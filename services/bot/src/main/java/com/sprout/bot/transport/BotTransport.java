package com.sprout.bot.transport;

import java.time.Duration;
import java.util.List;

/**
 * Seam to the messaging platform. The dispatch loop is its only caller.
 *
 * <p>Implementations must be safe for one polling thread and many sending threads at once.
 */
public interface BotTransport {

    /**
     * Waits up to {@code timeout} for inbound events.
     *
     * @return the events received, possibly empty; never null
     * @throws InterruptedException if the polling thread is interrupted while waiting
     */
    List<InboundEvent> poll(Duration timeout) throws InterruptedException;

    /** Sends a reply. Failures surface as unchecked exceptions. */
    void send(OutboundReply reply);

    /** Name for logs. */
    String name();
}
