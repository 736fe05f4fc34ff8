package com.agora.bus;

import com.agora.model.event.StreamEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BroadcastBus")
class BroadcastBusTest {

    private static final int CAPACITY = 5;

    private BroadcastBus bus;

    @BeforeEach
    void setUp() {
        bus = new BroadcastBus(new ObjectMapper(), CAPACITY);
    }

    @Test
    @DisplayName("every listener sees events in publish order")
    void deliversInPublishOrder() {
        List<BusEvent> first = collect(bus.subscribe());
        List<BusEvent> second = collect(bus.subscribe());

        for (int i = 0; i < 20; i++) {
            bus.publish(StreamEvent.WORD, Map.of("i", i));
        }

        assertThat(first).hasSize(20);
        assertThat(first).extracting(BusEvent::getData)
                .containsExactlyElementsOf(second.stream().map(BusEvent::getData).toList());
        assertThat(first.get(0).getData()).isEqualTo("{\"i\":0}");
        assertThat(first.get(19).getData()).isEqualTo("{\"i\":19}");
        assertThat(first).allMatch(e -> e.getName().equals("word"));
    }

    @Test
    @DisplayName("a full inbox drops only that listener")
    void dropsListenerWithFullInbox() {
        BusListener stalled = bus.subscribe();
        List<BusEvent> healthy = collect(bus.subscribe());

        for (int i = 0; i < CAPACITY; i++) {
            bus.publish(StreamEvent.WORD, Map.of("i", i));
        }
        assertThat(bus.listenerCount()).isEqualTo(2);
        assertThat(stalled.isOpen()).isTrue();

        bus.publish(StreamEvent.WORD, Map.of("i", CAPACITY));

        assertThat(stalled.isOpen()).isFalse();
        assertThat(bus.listenerCount()).isEqualTo(1);

        bus.publish(StreamEvent.WORD, Map.of("i", CAPACITY + 1));
        assertThat(healthy).hasSize(CAPACITY + 2);

        List<BusEvent> drained = new ArrayList<>();
        stalled.events().subscribe(drained::add);
        assertThat(drained).hasSize(CAPACITY);
        assertThat(drained.get(CAPACITY - 1).getData()).isEqualTo("{\"i\":" + (CAPACITY - 1) + "}");
    }

    @Test
    @DisplayName("unsubscribe is idempotent and completes the listener")
    void unsubscribeIsIdempotent() {
        BusListener listener = bus.subscribe();
        assertThat(bus.listenerCount()).isEqualTo(1);

        bus.unsubscribe(listener);
        bus.unsubscribe(listener);
        bus.unsubscribe(null);

        assertThat(bus.listenerCount()).isZero();
        assertThat(listener.isOpen()).isFalse();
        assertThat(listener.onClose().block()).isNull();

        bus.publish(StreamEvent.PING, Map.of());
        List<BusEvent> received = new ArrayList<>();
        listener.events().subscribe(received::add);
        assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("concurrent publishers never interleave differently across listeners")
    void concurrentPublishersKeepOneGlobalOrder() throws Exception {
        bus = new BroadcastBus(new ObjectMapper(), 1000);
        List<BusEvent> first = collect(bus.subscribe());
        List<BusEvent> second = collect(bus.subscribe());

        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < 4; t++) {
            int thread = t;
            executor.submit(() -> {
                start.await();
                for (int i = 0; i < 100; i++) {
                    bus.publish(StreamEvent.SYSTEM, Map.of("t", thread, "i", i));
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(first).hasSize(400);
        assertThat(first).extracting(BusEvent::getData)
                .containsExactlyElementsOf(second.stream().map(BusEvent::getData).toList());
    }

    private static List<BusEvent> collect(BusListener listener) {
        List<BusEvent> events = Collections.synchronizedList(new ArrayList<>());
        listener.events().subscribe(events::add);
        return events;
    }
}
