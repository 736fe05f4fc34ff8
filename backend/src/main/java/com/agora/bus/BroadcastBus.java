package com.agora.bus;

import com.agora.model.event.StreamEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered fan-out of events to any number of listeners.
 * <p>
 * Each event is serialized once and offered to every listener without blocking. A listener
 * whose inbox is full is closed and removed once the publish pass completes; the event it
 * missed is not redelivered. Publishing holds a short lock so that all listeners observe
 * the same global order, but never waits on a consumer.
 */
@Slf4j
public class BroadcastBus {

    private final ObjectMapper objectMapper;
    private final int inboxCapacity;
    private final Set<BusListener> listeners = new LinkedHashSet<>();
    private final Object lock = new Object();

    public BroadcastBus(ObjectMapper objectMapper, int inboxCapacity) {
        this.objectMapper = objectMapper;
        this.inboxCapacity = inboxCapacity;
    }

    public BusListener subscribe() {
        BusListener listener = new BusListener(inboxCapacity);
        synchronized (lock) {
            listeners.add(listener);
        }
        log.debug("Listener {} subscribed", listener.getId());
        return listener;
    }

    /**
     * Idempotent; unknown or already removed handles are ignored.
     */
    public void unsubscribe(BusListener listener) {
        if (listener == null) {
            return;
        }
        boolean removed;
        synchronized (lock) {
            removed = listeners.remove(listener);
            listener.close();
        }
        if (removed) {
            log.debug("Listener {} unsubscribed", listener.getId());
        }
    }

    public void publish(StreamEvent type, Object payload) {
        String data;
        try {
            data = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event", type.wireName(), e);
            return;
        }
        publish(new BusEvent(type.wireName(), data));
    }

    public void publish(BusEvent event) {
        List<BusListener> dead = new ArrayList<>();
        synchronized (lock) {
            for (BusListener listener : listeners) {
                if (!listener.offer(event)) {
                    dead.add(listener);
                }
            }
            for (BusListener listener : dead) {
                listeners.remove(listener);
                listener.close();
            }
        }
        for (BusListener listener : dead) {
            log.warn("Listener {} dropped: inbox full or consumer gone", listener.getId());
        }
    }

    public int listenerCount() {
        synchronized (lock) {
            return listeners.size();
        }
    }
}
