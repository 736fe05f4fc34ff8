package com.agora.service;

import com.agora.bus.BroadcastBus;
import com.agora.bus.BusListener;
import com.agora.config.DebateSettings;
import com.agora.model.event.StreamEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Per-observer event stream: a {@code fullstate} snapshot followed by live bus events,
 * interleaved with keep-alive pings. The bus subscription lives exactly as long as the stream.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StreamService {

    private final DebateSettings settings;
    private final BroadcastBus bus;
    private final SessionViewService sessionViewService;
    private final ObjectMapper objectMapper;

    public Flux<ServerSentEvent<String>> openStream() {
        return Flux.defer(() -> {
            BusListener listener = bus.subscribe();
            bus.publish(StreamEvent.PRESENCE, sessionViewService.presence());

            Mono<ServerSentEvent<String>> fullState = Mono.fromCallable(() ->
                    toEvent(StreamEvent.FULL_STATE.wireName(), sessionViewService.snapshot()));

            Flux<ServerSentEvent<String>> live = listener.events()
                    .map(e -> ServerSentEvent.builder(e.getData()).event(e.getName()).build());

            Flux<ServerSentEvent<String>> pings = Flux.interval(settings.getPingInterval())
                    .map(tick -> toEvent(StreamEvent.PING.wireName(), sessionViewService.ping()))
                    .takeUntilOther(listener.onClose());

            // prefetch 1 keeps pending events in the listener inbox, where its capacity applies
            return Flux.concat(fullState, Flux.merge(1, live, pings))
                    .doFinally(signal -> {
                        bus.unsubscribe(listener);
                        bus.publish(StreamEvent.PRESENCE, sessionViewService.presence());
                        log.debug("Stream {} closed ({})", listener.getId(), signal);
                    });
        });
    }

    private ServerSentEvent<String> toEvent(String name, Object payload) {
        try {
            return ServerSentEvent.builder(objectMapper.writeValueAsString(payload)).event(name).build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + name, e);
        }
    }
}
