package com.agora.engine;

import com.agora.bus.BroadcastBus;
import com.agora.config.DebateSettings;
import com.agora.content.ContentRequest;
import com.agora.content.ContentSource;
import com.agora.exception.TransientContentException;
import com.agora.model.Message;
import com.agora.model.MessageType;
import com.agora.model.Persona;
import com.agora.model.Topic;
import com.agora.model.event.InitEvent;
import com.agora.model.event.ShutdownEvent;
import com.agora.model.event.SpeakerEvent;
import com.agora.model.event.StreamEvent;
import com.agora.model.event.WaitingEvent;
import com.agora.model.event.WordEvent;
import com.agora.session.ConversationHistory;
import com.agora.session.SessionClock;
import com.agora.session.SessionState;
import com.agora.session.TurnCounter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

/**
 * The single turn-taking loop of a session.
 * <p>
 * Each iteration checks the uptime budget, rotates the topic when the per-topic budget is spent,
 * then waits briefly for human input. A pending human message gets a reply from the persona that
 * did not speak last; otherwise, once the scheduled deadline has passed, the personas take
 * alternating automatic turns. Every produced utterance is streamed word by word before the next
 * one may start.
 * <p>
 * This is the only writer of AI and topic messages and the only consumer of the
 * {@link InboundQueue}. Content failures never end the loop: the turn is skipped and retried
 * after the failure backoff.
 */
@Slf4j
public class DebateEngine {

    private static final int CONTEXT_MESSAGES = 8;
    private static final int HUMAN_MENTION_WINDOW = 6;
    private static final double HUMAN_MENTION_CHANCE = 0.3;

    private final DebateSettings settings;
    private final SessionClock sessionClock;
    private final SessionState sessionState;
    private final PersonaCatalog personaCatalog;
    private final TopicRotator topicRotator;
    private final InboundQueue inboundQueue;
    private final ContentSource contentSource;
    private final BroadcastBus bus;
    private final PromptComposer promptComposer;
    private final WordPacer wordPacer;
    private final Sleeper sleeper;
    private final Random random;

    private final TurnCounter turnCounter;
    private final ConversationHistory history;

    private List<Persona> personas;
    private int turnIndex;
    private int lastSpeaker = -1;
    private Instant nextAutoTurn;
    private Message pendingHuman;

    public DebateEngine(DebateSettings settings, SessionClock sessionClock, SessionState sessionState,
                        PersonaCatalog personaCatalog, TopicRotator topicRotator, InboundQueue inboundQueue,
                        ContentSource contentSource, BroadcastBus bus, PromptComposer promptComposer,
                        WordPacer wordPacer, Sleeper sleeper, Random random) {
        this.settings = settings;
        this.sessionClock = sessionClock;
        this.sessionState = sessionState;
        this.personaCatalog = personaCatalog;
        this.topicRotator = topicRotator;
        this.inboundQueue = inboundQueue;
        this.contentSource = contentSource;
        this.bus = bus;
        this.promptComposer = promptComposer;
        this.wordPacer = wordPacer;
        this.sleeper = sleeper;
        this.random = random;
        this.turnCounter = new TurnCounter(settings.getMinTurnsPerTopic(), settings.getMaxTurnsPerTopic(), random);
        this.history = new ConversationHistory(settings.getHistoryWindow());
    }

    /**
     * Runs the session to completion. Returns after the shutdown event, or early if interrupted.
     */
    public void run() {
        try {
            open();
            while (!sessionClock.isExpiring(settings.getShutdownThreshold())) {
                try {
                    iterate();
                } catch (RuntimeException e) {
                    log.error("Engine iteration failed", e);
                    sessionState.setTyping(null);
                    sleeper.sleep(settings.getFailureBackoff());
                }
            }
            shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Engine interrupted, leaving the loop");
        }
    }

    void open() {
        personas = personaCatalog.pickPair(random);
        Persona a = personas.get(0);
        Persona b = personas.get(1);
        sessionState.startSession(a, b);
        log.info("Session pairing: {} {} vs {} {}", a.getAvatar(), a.getName(), b.getAvatar(), b.getName());

        Topic first = new Topic(topicRotator.pick(), 1);
        sessionState.setTopic(first);
        turnCounter.reset();

        bus.publish(StreamEvent.INIT, InitEvent.builder()
                .personaA(a)
                .personaB(b)
                .topic(first.getText())
                .topicNumber(first.getNumber())
                .boot(sessionClock.getBoot().toEpochMilli())
                .maxUptime(sessionClock.getMaxUptime().getSeconds())
                .build());
        announceTopic(first);
        nextAutoTurn = sessionClock.now().plus(settings.getFirstTurnDelay());
    }

    void iterate() throws InterruptedException {
        if (turnCounter.budgetReached()) {
            rotateTopic();
            return;
        }

        Message human = pendingHuman != null ? pendingHuman : inboundQueue.poll(settings.getPollTimeout());
        if (human != null) {
            respondToHuman(human);
            return;
        }

        if (!sessionClock.now().isBefore(nextAutoTurn)) {
            autoTurn();
        }
    }

    private void rotateTopic() {
        Topic next = new Topic(topicRotator.pick(), sessionState.getTopic().getNumber() + 1);
        log.info("Topic #{} after {} turns: \"{}\"", next.getNumber(), turnCounter.getCount(), next.getText());
        sessionState.setTopic(next);
        turnCounter.reset();
        history.truncate(settings.getHistoryKeptOnRotation());
        announceTopic(next);
        nextAutoTurn = sessionClock.now().plus(settings.getTopicChangeDelay());
    }

    private void announceTopic(Topic topic) {
        sessionState.append(Message.builder()
                        .type(MessageType.TOPIC)
                        .text(topic.getText())
                        .topicNumber(topic.getNumber())
                        .time(sessionClock.displayTime())
                        .timestamp(sessionClock.now().toEpochMilli()),
                m -> bus.publish(StreamEvent.NEW_TOPIC, m));
    }

    private void respondToHuman(Message first) throws InterruptedException {
        boolean retry = pendingHuman != null;
        pendingHuman = null;
        if (!retry) {
            sleeper.sleep(settleDelay());
        }
        // Burst coalescing: only the latest message is addressed, the rest reach the prompt as chat lines.
        Message addressed = inboundQueue.drainLatest().orElse(first);

        int idx = lastSpeaker >= 0 ? 1 - lastSpeaker : random.nextInt(2);
        Persona speaker = personas.get(idx);
        Persona opponent = personas.get(1 - idx);
        ContentRequest request = promptComposer.humanReply(speaker, opponent, sessionState.getTopic(),
                history.viewFor(speaker.getId()), sessionState.recentMessages(CONTEXT_MESSAGES), addressed);

        Generated generated = requestContent(speaker, request);
        if (generated == null) {
            pendingHuman = addressed;
            nextAutoTurn = sessionClock.now().plus(settings.getHumanCooldown());
            log.debug("Reply to {} deferred, retrying in {}", addressed.getSpeakerName(), settings.getFailureBackoff());
            sleeper.sleep(settings.getFailureBackoff());
            return;
        }

        stream(idx, generated);
        turnCounter.advance();
        nextAutoTurn = sessionClock.now().plus(settings.getHumanCooldown());
    }

    private void autoTurn() throws InterruptedException {
        int idx = turnIndex % 2;
        Persona speaker = personas.get(idx);
        Persona opponent = personas.get(1 - idx);
        int onTopic = turnCounter.getCount();

        RhetoricalDirective directive = null;
        String lastOpponent = null;
        Message humanMention = null;
        if (onTopic > 0) {
            RhetoricalDirective[] directives = RhetoricalDirective.values();
            directive = directives[random.nextInt(directives.length)];
            lastOpponent = lastUtteranceOf(opponent);
            Message recentHuman = latestHumanMessage();
            if (recentHuman != null && random.nextDouble() < HUMAN_MENTION_CHANCE) {
                humanMention = recentHuman;
            }
        }

        ContentRequest request = promptComposer.autoTurn(speaker, opponent, sessionState.getTopic(), onTopic,
                sessionState.participantCount() > 0, history.viewFor(speaker.getId()),
                lastOpponent, directive, humanMention);

        Generated generated = requestContent(speaker, request);
        if (generated == null) {
            log.debug("Turn {} of {} skipped, retrying in {}", turnIndex, speaker.getName(), settings.getFailureBackoff());
            sleeper.sleep(settings.getFailureBackoff());
            return;
        }

        stream(idx, generated);
        turnCounter.advance();
        turnIndex++;

        Persona next = personas.get(turnIndex % 2);
        Duration gap = settings.getAutoTurnGap();
        bus.publish(StreamEvent.WAITING, WaitingEvent.builder()
                .name(next.getName())
                .avatar(next.getAvatar())
                .color(next.getColor())
                .gap(gap.getSeconds())
                .timeLeft(sessionClock.secondsRemaining())
                .build());
        nextAutoTurn = sessionClock.now().plus(gap);
    }

    /**
     * @return null when both content sources failed
     */
    private Generated requestContent(Persona speaker, ContentRequest request) {
        sessionState.setTyping(speaker.getName());
        bus.publish(StreamEvent.TYPING, SpeakerEvent.of(speaker, sessionClock.displayTime()));
        Instant started = sessionClock.now();
        try {
            String text = contentSource.generate(request);
            return new Generated(text, Duration.between(started, sessionClock.now()));
        } catch (TransientContentException e) {
            log.warn("No utterance for {}: {}", speaker.getName(), e.getMessage());
            sessionState.setTyping(null);
            return null;
        }
    }

    private void stream(int idx, Generated generated) throws InterruptedException {
        Persona speaker = personas.get(idx);
        List<String> words = WordPacer.tokenize(generated.text);
        String text = String.join(" ", words);
        Duration delay = wordPacer.delayPerWord(words.size(), generated.generationTime);

        bus.publish(StreamEvent.MSG_START, SpeakerEvent.of(speaker, sessionClock.displayTime()));
        for (int i = 0; i < words.size(); i++) {
            bus.publish(StreamEvent.WORD, new WordEvent(words.get(i), i, words.size()));
            sleeper.sleep(delay);
        }

        sessionState.append(Message.builder()
                        .type(MessageType.AI)
                        .speakerId(speaker.getId())
                        .speakerName(speaker.getName())
                        .avatar(speaker.getAvatar())
                        .color(speaker.getColor())
                        .role(speaker.getRole())
                        .text(text)
                        .topicNumber(sessionState.getTopic().getNumber())
                        .time(sessionClock.displayTime())
                        .timestamp(sessionClock.now().toEpochMilli()),
                m -> bus.publish(StreamEvent.MSG_DONE, m));
        sessionState.setTyping(null);
        history.record(speaker.getId(), text);
        lastSpeaker = idx;

        log.info("  {} {}: {}", speaker.getAvatar(), speaker.getName(),
                text.length() > 65 ? text.substring(0, 65) + "..." : text);
    }

    private void shutdown() {
        sessionClock.markShutdown();
        long aiMessages = sessionState.count(MessageType.AI);
        long humanMessages = sessionState.count(MessageType.HUMAN);
        int topics = sessionState.getTopic() != null ? sessionState.getTopic().getNumber() : 0;
        bus.publish(StreamEvent.SHUTDOWN, ShutdownEvent.builder()
                .totalMessages(aiMessages)
                .totalTopics(topics)
                .userMessages(humanMessages)
                .users(sessionState.participantCount())
                .build());
        log.info("Session over: {} AI messages, {} human messages, {} topics", aiMessages, humanMessages, topics);
    }

    private Duration settleDelay() {
        long min = settings.getSettleMin().toMillis();
        long span = settings.getSettleMax().toMillis() - min;
        return Duration.ofMillis(min + (span > 0 ? (long) (random.nextDouble() * span) : 0));
    }

    private String lastUtteranceOf(Persona persona) {
        List<Message> recent = sessionState.recentMessages(settings.getSnapshotWindow());
        for (int i = recent.size() - 1; i >= 0; i--) {
            Message m = recent.get(i);
            if (m.getType() == MessageType.AI && persona.getId().equals(m.getSpeakerId())) {
                return m.getText();
            }
        }
        return null;
    }

    private Message latestHumanMessage() {
        List<Message> recent = sessionState.recentMessages(HUMAN_MENTION_WINDOW);
        for (int i = recent.size() - 1; i >= 0; i--) {
            if (recent.get(i).getType() == MessageType.HUMAN) {
                return recent.get(i);
            }
        }
        return null;
    }

    TurnCounter turnCounter() {
        return turnCounter;
    }

    ConversationHistory history() {
        return history;
    }

    List<Persona> personas() {
        return personas;
    }

    int turnIndex() {
        return turnIndex;
    }

    Message pendingHuman() {
        return pendingHuman;
    }

    private static final class Generated {
        private final String text;
        private final Duration generationTime;

        private Generated(String text, Duration generationTime) {
            this.text = text;
            this.generationTime = generationTime;
        }
    }
}
