package com.agora.service;

import com.agora.bus.BroadcastBus;
import com.agora.config.DebateSettings;
import com.agora.model.Topic;
import com.agora.model.dto.SessionSnapshot;
import com.agora.model.event.PingEvent;
import com.agora.model.event.PresenceEvent;
import com.agora.session.SessionClock;
import com.agora.session.SessionState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Read-only views of the session for observers. Never blocks on the engine.
 */
@Service
@RequiredArgsConstructor
public class SessionViewService {

    private final DebateSettings settings;
    private final SessionState sessionState;
    private final SessionClock sessionClock;
    private final BroadcastBus bus;

    public SessionSnapshot snapshot() {
        Topic topic = sessionState.getTopic();
        return SessionSnapshot.builder()
                .personaA(sessionState.getPersonaA())
                .personaB(sessionState.getPersonaB())
                .topic(topic != null ? topic.getText() : null)
                .topicNumber(topic != null ? topic.getNumber() : 0)
                .messages(sessionState.recentMessages(settings.getSnapshotWindow()))
                .typing(sessionState.getTyping())
                .boot(sessionClock.getBoot().toEpochMilli())
                .maxUptime(sessionClock.getMaxUptime().getSeconds())
                .timeLeft(sessionClock.secondsRemaining())
                .users(sessionState.participants())
                .viewers(bus.listenerCount())
                .build();
    }

    public PresenceEvent presence() {
        return new PresenceEvent(sessionState.participants(), bus.listenerCount());
    }

    public PingEvent ping() {
        return new PingEvent(sessionClock.secondsRemaining(), bus.listenerCount());
    }
}
