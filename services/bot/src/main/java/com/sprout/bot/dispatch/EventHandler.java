package com.sprout.bot.dispatch;

import com.sprout.bot.persistence.UnitOfWork;
import com.sprout.bot.transport.InboundEvent;
import java.util.Optional;

/**
 * Handles one kind of inbound event inside a unit of work.
 *
 * <p>{@link #handle} may run more than once for the same event when a retriable database failure
 * rolled the previous attempt back, so it must not have effects outside the unit of work. The reply
 * is sent only after the unit of work committed.
 */
public interface EventHandler {

    /** Name for logs and metrics. */
    String name();

    boolean supports(InboundEvent event);

    /**
     * @return the reply text, or empty to stay silent
     */
    Optional<String> handle(InboundEvent event, UnitOfWork uow);
}
