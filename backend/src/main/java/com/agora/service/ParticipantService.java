package com.agora.service;

import com.agora.bus.BroadcastBus;
import com.agora.config.DebateSettings;
import com.agora.engine.InboundQueue;
import com.agora.exception.ForbiddenException;
import com.agora.exception.InvalidInputException;
import com.agora.model.HumanParticipant;
import com.agora.model.Message;
import com.agora.model.MessageType;
import com.agora.model.event.StreamEvent;
import com.agora.session.SessionClock;
import com.agora.session.SessionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Human ingress: joining the debate and posting messages. Input is validated here,
 * synchronously; rejected requests leave no trace in the session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParticipantService {

    private final DebateSettings settings;
    private final SessionState sessionState;
    private final SessionClock sessionClock;
    private final InboundQueue inboundQueue;
    private final BroadcastBus bus;
    private final SessionViewService sessionViewService;

    private final AtomicInteger colorIndex = new AtomicInteger();

    public HumanParticipant join(String rawName) {
        String name = cap(rawName, settings.getNameMaxLength());
        if (name.isEmpty()) {
            throw new InvalidInputException("name required");
        }

        List<String> palette = settings.getPalette();
        HumanParticipant participant = HumanParticipant.builder()
                .id(UUID.randomUUID().toString().substring(0, 8))
                .name(name)
                .color(palette.get(Math.floorMod(colorIndex.getAndIncrement(), palette.size())))
                .joinedAt(sessionClock.now().toEpochMilli())
                .build();
        sessionState.addParticipant(participant);

        sessionState.append(Message.builder()
                        .type(MessageType.SYSTEM)
                        .text("👋 " + name + " joined the debate")
                        .topicNumber(currentTopicNumber())
                        .time(sessionClock.displayTime())
                        .timestamp(sessionClock.now().toEpochMilli()),
                m -> bus.publish(StreamEvent.SYSTEM, m));
        bus.publish(StreamEvent.PRESENCE, sessionViewService.presence());

        log.info("  👋 {} joined ({})", name, participant.getId());
        return participant;
    }

    public Message send(String participantId, String rawText, String clientMsgId) {
        HumanParticipant participant = sessionState.findParticipant(participantId)
                .orElseThrow(() -> new ForbiddenException("not joined"));
        String text = cap(rawText, settings.getTextMaxLength());
        if (text.isEmpty()) {
            throw new InvalidInputException("empty");
        }

        Message message = sessionState.append(Message.builder()
                        .type(MessageType.HUMAN)
                        .speakerId(participant.getId())
                        .speakerName(participant.getName())
                        .color(participant.getColor())
                        .text(text)
                        .topicNumber(currentTopicNumber())
                        .time(sessionClock.displayTime())
                        .timestamp(sessionClock.now().toEpochMilli())
                        .clientMsgId(clientMsgId),
                m -> bus.publish(StreamEvent.USER_MSG, m));
        inboundQueue.offer(message);

        log.info("  💬 {}: {}", participant.getName(), text.length() > 60 ? text.substring(0, 60) : text);
        return message;
    }

    private int currentTopicNumber() {
        return sessionState.getTopic() != null ? sessionState.getTopic().getNumber() : 0;
    }

    private static String cap(String value, int max) {
        if (value == null) {
            return "";
        }
        String trimmed = value.strip();
        return trimmed.length() > max ? trimmed.substring(0, max).strip() : trimmed;
    }
}
