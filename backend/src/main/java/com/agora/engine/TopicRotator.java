package com.agora.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Draws discussion subjects so that every topic of the pool is used once before any repeats.
 * Once the pool is exhausted the used set is cleared and a new cycle begins.
 */
@Slf4j
public class TopicRotator {

    private final List<String> pool;
    private final Random random;
    private final Set<String> used = new HashSet<>();

    public TopicRotator(List<String> pool, Random random) {
        if (pool == null || pool.isEmpty()) {
            throw new IllegalArgumentException("Topic pool must not be empty");
        }
        this.pool = List.copyOf(new LinkedHashSet<>(pool));
        this.random = random;
    }

    public synchronized String pick() {
        List<String> eligible = new ArrayList<>(pool.size());
        for (String topic : pool) {
            if (!used.contains(topic)) {
                eligible.add(topic);
            }
        }
        if (eligible.isEmpty()) {
            log.info("All {} topics used, starting a new cycle", pool.size());
            used.clear();
            eligible.addAll(pool);
        }
        String topic = eligible.get(random.nextInt(eligible.size()));
        used.add(topic);
        return topic;
    }

    public int poolSize() {
        return pool.size();
    }
}
