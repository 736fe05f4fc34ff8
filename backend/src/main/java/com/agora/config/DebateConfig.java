package com.agora.config;

import com.agora.bus.BroadcastBus;
import com.agora.content.ContentSource;
import com.agora.engine.DebateEngine;
import com.agora.engine.InboundQueue;
import com.agora.engine.PersonaCatalog;
import com.agora.engine.PromptComposer;
import com.agora.engine.Sleeper;
import com.agora.engine.TopicRotator;
import com.agora.engine.WordPacer;
import com.agora.model.Persona;
import com.agora.session.SessionClock;
import com.agora.session.SessionState;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;

@Configuration
@Slf4j
public class DebateConfig {

    @Value("${app.session.max-uptime-seconds:21300}")
    private long maxUptimeSeconds;

    @Value("${app.session.shutdown-threshold-seconds:60}")
    private long shutdownThresholdSeconds;

    @Value("${app.debate.auto-turn-gap-seconds:25}")
    private long autoTurnGapSeconds;

    @Value("${app.debate.first-turn-delay-seconds:6}")
    private long firstTurnDelaySeconds;

    @Value("${app.debate.topic-change-delay-seconds:5}")
    private long topicChangeDelaySeconds;

    @Value("${app.debate.human-cooldown-seconds:15}")
    private long humanCooldownSeconds;

    @Value("${app.debate.settle-min-millis:3000}")
    private long settleMinMillis;

    @Value("${app.debate.settle-max-millis:6000}")
    private long settleMaxMillis;

    @Value("${app.debate.poll-timeout-millis:500}")
    private long pollTimeoutMillis;

    @Value("${app.debate.failure-backoff-seconds:5}")
    private long failureBackoffSeconds;

    @Value("${app.debate.min-turns-per-topic:20}")
    private int minTurnsPerTopic;

    @Value("${app.debate.max-turns-per-topic:30}")
    private int maxTurnsPerTopic;

    @Value("${app.debate.history-window:16}")
    private int historyWindow;

    @Value("${app.debate.history-kept-on-rotation:6}")
    private int historyKeptOnRotation;

    @Value("${app.stream.display-budget-seconds:18}")
    private long displayBudgetSeconds;

    @Value("${app.stream.min-display-budget-seconds:6}")
    private long minDisplayBudgetSeconds;

    @Value("${app.stream.min-word-delay-millis:60}")
    private long minWordDelayMillis;

    @Value("${app.stream.max-word-delay-millis:500}")
    private long maxWordDelayMillis;

    @Value("${app.content.max-words:80}")
    private int maxWords;

    @Value("${app.ingress.name-max-length:20}")
    private int nameMaxLength;

    @Value("${app.ingress.text-max-length:500}")
    private int textMaxLength;

    @Value("${app.ingress.palette:#ff9800,#e91e63,#9c27b0,#03a9f4,#4caf50,#ff5722,#00bcd4,#cddc39,#f44336,#3f51b5,#8bc34a,#795548}")
    private String[] palette;

    @Value("${app.stream.snapshot-window:120}")
    private int snapshotWindow;

    @Value("${app.stream.inbox-capacity:400}")
    private int inboxCapacity;

    @Value("${app.stream.ping-interval-seconds:25}")
    private long pingIntervalSeconds;

    @Value("${app.debate.random-seed:#{null}}")
    private Long randomSeed;

    @Value("${app.debate.personas-resource:debate/personas.json}")
    private String personasResource;

    @Value("${app.debate.topics-resource:debate/topics.json}")
    private String topicsResource;

    @Bean
    public DebateSettings debateSettings() {
        return DebateSettings.builder()
                .maxUptime(Duration.ofSeconds(maxUptimeSeconds))
                .shutdownThreshold(Duration.ofSeconds(shutdownThresholdSeconds))
                .autoTurnGap(Duration.ofSeconds(autoTurnGapSeconds))
                .firstTurnDelay(Duration.ofSeconds(firstTurnDelaySeconds))
                .topicChangeDelay(Duration.ofSeconds(topicChangeDelaySeconds))
                .humanCooldown(Duration.ofSeconds(humanCooldownSeconds))
                .settleMin(Duration.ofMillis(settleMinMillis))
                .settleMax(Duration.ofMillis(settleMaxMillis))
                .pollTimeout(Duration.ofMillis(pollTimeoutMillis))
                .failureBackoff(Duration.ofSeconds(failureBackoffSeconds))
                .minTurnsPerTopic(minTurnsPerTopic)
                .maxTurnsPerTopic(maxTurnsPerTopic)
                .historyWindow(historyWindow)
                .historyKeptOnRotation(historyKeptOnRotation)
                .displayBudget(Duration.ofSeconds(displayBudgetSeconds))
                .minDisplayBudget(Duration.ofSeconds(minDisplayBudgetSeconds))
                .minWordDelay(Duration.ofMillis(minWordDelayMillis))
                .maxWordDelay(Duration.ofMillis(maxWordDelayMillis))
                .maxWords(maxWords)
                .nameMaxLength(nameMaxLength)
                .textMaxLength(textMaxLength)
                .palette(List.of(palette))
                .snapshotWindow(snapshotWindow)
                .inboxCapacity(inboxCapacity)
                .pingInterval(Duration.ofSeconds(pingIntervalSeconds))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random sessionRandom() {
        if (randomSeed != null) {
            log.info("Using seeded random source ({})", randomSeed);
            return new Random(randomSeed);
        }
        return new Random();
    }

    @Bean
    public SessionClock sessionClock(Clock clock, DebateSettings settings) {
        return new SessionClock(clock, settings.getMaxUptime());
    }

    @Bean
    public SessionState sessionState() {
        return new SessionState();
    }

    @Bean
    public InboundQueue inboundQueue() {
        return new InboundQueue();
    }

    @Bean
    public BroadcastBus broadcastBus(ObjectMapper objectMapper, DebateSettings settings) {
        return new BroadcastBus(objectMapper, settings.getInboxCapacity());
    }

    @Bean
    public PersonaCatalog personaCatalog(ObjectMapper objectMapper) throws IOException {
        List<Persona> personas = readJson(objectMapper, personasResource, new TypeReference<List<Persona>>() {
        });
        log.info("Loaded {} personas from {}", personas.size(), personasResource);
        return new PersonaCatalog(personas);
    }

    @Bean
    public TopicRotator topicRotator(ObjectMapper objectMapper, Random sessionRandom) throws IOException {
        List<String> topics = readJson(objectMapper, topicsResource, new TypeReference<List<String>>() {
        });
        log.info("Loaded {} topics from {}", topics.size(), topicsResource);
        return new TopicRotator(topics, sessionRandom);
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }

    @Bean
    public DebateEngine debateEngine(DebateSettings settings, SessionClock sessionClock, SessionState sessionState,
                                     PersonaCatalog personaCatalog, TopicRotator topicRotator,
                                     InboundQueue inboundQueue, ContentSource contentSource, BroadcastBus broadcastBus,
                                     Sleeper sleeper, Random sessionRandom) {
        return new DebateEngine(settings, sessionClock, sessionState, personaCatalog, topicRotator, inboundQueue,
                contentSource, broadcastBus, new PromptComposer(settings.getMaxWords()), new WordPacer(settings),
                sleeper, sessionRandom);
    }

    private static <T> T readJson(ObjectMapper objectMapper, String resource, TypeReference<T> type) throws IOException {
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            return objectMapper.readValue(in, type);
        }
    }
}
