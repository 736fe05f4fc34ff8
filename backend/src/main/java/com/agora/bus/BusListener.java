package com.agora.bus;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;

/**
 * Subscription handle on the {@link BroadcastBus}. Events are buffered in a bounded inbox
 * until the consumer subscribes to {@link #events()} and requests them.
 * <p>
 * Emission methods are only called by the bus while it holds its publish lock.
 */
public class BusListener {

    private final String id = UUID.randomUUID().toString().substring(0, 8);
    private final Sinks.Many<BusEvent> inbox;
    private final Sinks.Empty<Void> closed = Sinks.empty();
    private volatile boolean open = true;

    BusListener(int capacity) {
        this.inbox = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(capacity));
    }

    public String getId() {
        return id;
    }

    /**
     * The live event stream. Completes once the listener is unsubscribed or dropped.
     * Can be subscribed to only once.
     */
    public Flux<BusEvent> events() {
        return inbox.asFlux();
    }

    /**
     * Completes when the listener leaves the bus, for whatever reason.
     */
    public Mono<Void> onClose() {
        return closed.asMono();
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * @return false when the inbox is full or the listener is already closed
     */
    boolean offer(BusEvent event) {
        if (!open) {
            return false;
        }
        return inbox.tryEmitNext(event).isSuccess();
    }

    void close() {
        if (!open) {
            return;
        }
        open = false;
        inbox.tryEmitComplete();
        closed.tryEmitEmpty();
    }
}
