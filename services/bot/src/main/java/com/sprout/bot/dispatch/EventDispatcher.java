package com.sprout.bot.dispatch;

import com.sprout.bot.config.DispatchSettings;
import com.sprout.bot.infrastructure.EventContext;
import com.sprout.bot.infrastructure.EventContextHolder;
import com.sprout.bot.persistence.UnitOfWorkRunner;
import com.sprout.bot.transport.BotTransport;
import com.sprout.bot.transport.InboundEvent;
import com.sprout.bot.transport.OutboundReply;
import com.sprout.database.DatabaseException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * The bot's main loop: one poller thread takes events from the transport and hands each to a fixed
 * worker pool, where it runs as one unit of work.
 *
 * <p>The pool's queue holds at most {@value #QUEUE_PER_WORKER} events per worker. When it is full
 * the poller runs the next event itself, so polling slows down to the pace of the workers instead
 * of buffering a backlog in memory.
 *
 * <p>Started by the application context after every bean, and therefore after the session manager
 * and the migration gate, is ready. Stopped first on shutdown: the poller stops, queued events
 * drain, then the pool closes.
 *
 * <p>A failing event never stops the loop. Its unit of work was rolled back and, where the failure
 * was retriable, retried by {@link UnitOfWorkRunner}; the dispatcher logs the final outcome, counts
 * it in {@code sprout.dispatch.events{outcome}} and tells the user something went wrong.
 */
public class EventDispatcher implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    static final String FAILURE_REPLY = "Something went wrong, please try again in a moment.";

    static final int QUEUE_PER_WORKER = 16;

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final BotTransport transport;
    private final List<EventHandler> handlers;
    private final UnitOfWorkRunner runner;
    private final DispatchSettings settings;
    private final MeterRegistry registry;

    private volatile boolean running;
    private ThreadPoolExecutor workers;
    private Thread poller;

    public EventDispatcher(BotTransport transport, List<EventHandler> handlers, UnitOfWorkRunner runner,
            DispatchSettings settings, MeterRegistry registry) {
        this.transport = transport;
        this.handlers = List.copyOf(handlers);
        this.runner = runner;
        this.settings = settings;
        this.registry = registry;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        workers = new ThreadPoolExecutor(settings.workers(), settings.workers(), 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(settings.workers() * QUEUE_PER_WORKER),
                namedThreads("sprout-worker-"), new ThreadPoolExecutor.CallerRunsPolicy());
        running = true;
        poller = new Thread(this::pollLoop, "sprout-poller");
        poller.start();
        log.info("Dispatch loop started on transport '{}' with {} worker(s) and handlers {}",
                transport.name(), settings.workers(), handlers.stream().map(EventHandler::name).toList());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        poller.interrupt();
        try {
            poller.join(SHUTDOWN_GRACE.toMillis());
            workers.shutdown();
            if (!workers.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not finish within {} s, interrupting", SHUTDOWN_GRACE.toSeconds());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Dispatch loop stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Runs one event to completion on the calling thread: context, handler, unit of work, reply.
     */
    void dispatch(InboundEvent event) {
        EventContextHolder.runWithContext(EventContext.of(event), () -> process(event));
    }

    /** Events waiting for a free worker. */
    int backlog() {
        ThreadPoolExecutor pool = workers;
        return pool == null ? 0 : pool.getQueue().size();
    }

    // ── Private Helpers ──

    private void pollLoop() {
        while (running) {
            List<InboundEvent> events;
            try {
                events = transport.poll(settings.pollTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Polling transport '{}' failed; retrying in {} ms",
                        transport.name(), settings.pollTimeout().toMillis(), e);
                if (!pause(settings.pollTimeout())) {
                    break;
                }
                continue;
            }
            for (InboundEvent event : events) {
                workers.execute(() -> dispatch(event));
            }
        }
    }

    private void process(InboundEvent event) {
        Optional<EventHandler> handler = handlers.stream().filter(h -> h.supports(event)).findFirst();
        if (handler.isEmpty()) {
            log.debug("No handler for event {} ('{}')", event.eventId(), event.command());
            count("unhandled");
            return;
        }

        EventHandler chosen = handler.get();
        Optional<String> reply;
        try {
            reply = runner.run(chosen.name(), uow -> chosen.handle(event, uow));
        } catch (DatabaseException e) {
            log.error("Event {} failed in handler '{}' with {} (retriable={})",
                    event.eventId(), chosen.name(), e.kind(), e.retriable(), e);
            count("failed");
            reply(event, FAILURE_REPLY);
            return;
        } catch (RuntimeException e) {
            log.error("Event {} failed in handler '{}'", event.eventId(), chosen.name(), e);
            count("failed");
            reply(event, FAILURE_REPLY);
            return;
        }

        reply.ifPresent(text -> reply(event, text));
        count("handled");
        log.debug("Event {} handled by '{}'", event.eventId(), chosen.name());
    }

    private void reply(InboundEvent event, String text) {
        try {
            transport.send(new OutboundReply(event.chatId(), text));
        } catch (RuntimeException e) {
            log.error("Sending reply for event {} to chat {} failed", event.eventId(), event.chatId(), e);
            count("reply_failed");
        }
    }

    private void count(String outcome) {
        registry.counter("sprout.dispatch.events", "outcome", outcome).increment();
    }

    private boolean pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }
}
