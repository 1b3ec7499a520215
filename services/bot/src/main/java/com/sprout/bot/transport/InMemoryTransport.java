package com.sprout.bot.transport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A {@link BotTransport} backed by in-process queues.
 *
 * <p>The default transport when no platform adapter is configured, and the test double for the
 * dispatch loop: tests {@linkplain #publish publish} events and inspect what was {@linkplain #sent()
 * sent}.
 */
public class InMemoryTransport implements BotTransport {

    private final BlockingQueue<InboundEvent> inbound = new LinkedBlockingQueue<>();
    private final List<OutboundReply> outbound = new CopyOnWriteArrayList<>();

    public void publish(InboundEvent event) {
        inbound.add(event);
    }

    @Override
    public List<InboundEvent> poll(Duration timeout) throws InterruptedException {
        InboundEvent first = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (first == null) {
            return List.of();
        }
        List<InboundEvent> batch = new ArrayList<>();
        batch.add(first);
        inbound.drainTo(batch);
        return batch;
    }

    @Override
    public void send(OutboundReply reply) {
        outbound.add(reply);
    }

    @Override
    public String name() {
        return "in-memory";
    }

    /** Replies sent so far, in send order. */
    public List<OutboundReply> sent() {
        return List.copyOf(outbound);
    }

    /**
     * Blocks until at least {@code count} replies were sent or the timeout passed.
     *
     * @return the replies sent so far
     */
    public List<OutboundReply> awaitReplies(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (outbound.size() < count && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        return sent();
    }

    public int pending() {
        return inbound.size();
    }
}
