package com.agora.engine;

import com.agora.model.Message;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Human messages waiting for the engine. Any thread may offer; only the engine polls.
 */
public class InboundQueue {

    private final BlockingQueue<Message> queue = new LinkedBlockingQueue<>();

    public void offer(Message message) {
        queue.offer(message);
    }

    public Message poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Empties the queue, returning only the most recent message.
     */
    public Optional<Message> drainLatest() {
        Message latest = null;
        Message next;
        while ((next = queue.poll()) != null) {
            latest = next;
        }
        return Optional.ofNullable(latest);
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }
}
