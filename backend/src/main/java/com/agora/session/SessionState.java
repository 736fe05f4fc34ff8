package com.agora.session;

import com.agora.model.HumanParticipant;
import com.agora.model.Message;
import com.agora.model.MessageType;
import com.agora.model.Persona;
import com.agora.model.Topic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Roster, current topic and the append-only message log of the running session.
 * <p>
 * Writers serialize on a single monitor; readers never take it and always see the last
 * completed write. A message that is still streaming word by word is not part of the log.
 * <p>
 * The engine owns topics, AI messages and the typing indicator. Ingress is the one other writer:
 * request threads add participants and append join notices and human messages, so they reach
 * viewers immediately. Both go through {@link #append}, which orders them with the engine's writes.
 */
public class SessionState {

    private final Object writeLock = new Object();

    private volatile Persona personaA;
    private volatile Persona personaB;
    private volatile Topic topic;
    private volatile String typing;

    private final Map<String, HumanParticipant> roster = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<Message> log = new ConcurrentLinkedDeque<>();
    private final Map<MessageType, AtomicLong> counts = new EnumMap<>(MessageType.class);
    private long lastSeq;

    public SessionState() {
        for (MessageType type : MessageType.values()) {
            counts.put(type, new AtomicLong());
        }
    }

    public void startSession(Persona a, Persona b) {
        if (a.getId().equals(b.getId())) {
            throw new IllegalArgumentException("Personas must be distinct: " + a.getId());
        }
        synchronized (writeLock) {
            this.personaA = a;
            this.personaB = b;
        }
    }

    public Persona getPersonaA() {
        return personaA;
    }

    public Persona getPersonaB() {
        return personaB;
    }

    public Topic getTopic() {
        return topic;
    }

    public void setTopic(Topic next) {
        synchronized (writeLock) {
            Topic current = this.topic;
            if (current != null && next.getNumber() <= current.getNumber()) {
                throw new IllegalStateException("Topic number must increase: "
                        + current.getNumber() + " -> " + next.getNumber());
            }
            this.topic = next;
        }
    }

    public String getTyping() {
        return typing;
    }

    public void setTyping(String speakerName) {
        this.typing = speakerName;
    }

    public void addParticipant(HumanParticipant participant) {
        roster.put(participant.getId(), participant);
    }

    public Optional<HumanParticipant> findParticipant(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(roster.get(id));
    }

    public List<HumanParticipant> participants() {
        List<HumanParticipant> list = new ArrayList<>(roster.values());
        list.sort(Comparator.comparingLong(HumanParticipant::getJoinedAt));
        return Collections.unmodifiableList(list);
    }

    public int participantCount() {
        return roster.size();
    }

    /**
     * Appends a message, assigning its sequence number. The announcer runs before the write
     * lock is released, so announcements follow log order.
     *
     * @throws IllegalStateException if the speaker is not in the roster
     */
    public Message append(Message.MessageBuilder draft, Consumer<Message> announcer) {
        synchronized (writeLock) {
            Message message = draft.seq(lastSeq + 1).build();
            if (message.getSpeakerId() != null && !isKnownSpeaker(message.getSpeakerId())) {
                throw new IllegalStateException("Unknown speaker: " + message.getSpeakerId());
            }
            lastSeq = message.getSeq();
            log.addLast(message);
            counts.get(message.getType()).incrementAndGet();
            announcer.accept(message);
            return message;
        }
    }

    /**
     * Up to {@code limit} most recent messages, oldest first.
     */
    public List<Message> recentMessages(int limit) {
        List<Message> recent = new ArrayList<>(Math.min(limit, 128));
        Iterator<Message> it = log.descendingIterator();
        while (it.hasNext() && recent.size() < limit) {
            recent.add(it.next());
        }
        Collections.reverse(recent);
        return recent;
    }

    public long count(MessageType type) {
        return counts.get(type).get();
    }

    private boolean isKnownSpeaker(String speakerId) {
        Persona a = personaA;
        Persona b = personaB;
        return (a != null && a.getId().equals(speakerId))
                || (b != null && b.getId().equals(speakerId))
                || roster.containsKey(speakerId);
    }
}
