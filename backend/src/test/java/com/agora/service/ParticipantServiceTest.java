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
import com.agora.testsupport.EventCollector;
import com.agora.testsupport.MutableClock;
import com.agora.testsupport.TestSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParticipantServiceTest {

    private final DebateSettings settings = TestSettings.defaults().build();
    private final SessionState state = new SessionState();
    private final InboundQueue queue = new InboundQueue();
    private final BroadcastBus bus = new BroadcastBus(new ObjectMapper(), 100);
    private final EventCollector events = new EventCollector(bus);
    private ParticipantService service;

    @BeforeEach
    void setUp() {
        SessionClock sessionClock = new SessionClock(new MutableClock(Instant.parse("2026-01-01T12:30:00Z")),
                settings.getMaxUptime());
        service = new ParticipantService(settings, state, sessionClock, queue, bus,
                new SessionViewService(settings, state, sessionClock, bus));
    }

    @Test
    @DisplayName("Blank names are rejected without touching the roster")
    void rejectsBlankName() {
        assertThatThrownBy(() -> service.join("   ")).isInstanceOf(InvalidInputException.class).hasMessage("name required");
        assertThatThrownBy(() -> service.join(null)).isInstanceOf(InvalidInputException.class);
        assertThat(state.participantCount()).isZero();
        assertThat(events.names()).isEmpty();
    }

    @Test
    @DisplayName("Joining adds a participant, a system notice and a presence update")
    void joinAnnouncesParticipant() {
        HumanParticipant ana = service.join("  Ana  ");

        assertThat(ana.getName()).isEqualTo("Ana");
        assertThat(ana.getId()).hasSize(8);
        assertThat(state.findParticipant(ana.getId())).contains(ana);
        assertThat(events.names()).containsExactly("system", "presence");

        JsonNode notice = events.payloads(StreamEvent.SYSTEM).get(0);
        assertThat(notice.get("text").asText()).isEqualTo("👋 Ana joined the debate");
        assertThat(notice.get("time").asText()).isEqualTo("12:30");
        JsonNode presence = events.payloads(StreamEvent.PRESENCE).get(0);
        assertThat(presence.get("users")).hasSize(1);
        assertThat(presence.get("viewers").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Names are capped and colors cycle through the palette")
    void capsNameAndCyclesColors() {
        HumanParticipant longName = service.join("Bartholomew Fitzgerald the Third");
        assertThat(longName.getName()).hasSizeLessThanOrEqualTo(20).isEqualTo("Bartholomew Fitzgera");

        List<String> colors = new ArrayList<>();
        colors.add(longName.getColor());
        for (int i = 0; i < 4; i++) {
            colors.add(service.join("user" + i).getColor());
        }
        assertThat(colors.subList(0, 4)).doesNotHaveDuplicates().containsExactlyElementsOf(settings.getPalette());
        assertThat(colors.get(4)).isEqualTo(colors.get(0));
    }

    @Test
    @DisplayName("Only joined participants may send")
    void rejectsUnknownSender() {
        assertThatThrownBy(() -> service.send("nobody", "hello", null))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("not joined");
        assertThat(queue.isEmpty()).isTrue();
        assertThat(state.count(MessageType.HUMAN)).isZero();
    }

    @Test
    @DisplayName("Empty text is rejected")
    void rejectsEmptyText() {
        HumanParticipant ana = service.join("Ana");

        assertThatThrownBy(() -> service.send(ana.getId(), " \n ", null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("empty");
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("A message is logged, broadcast with its client id and queued for the engine")
    void sendQueuesMessage() {
        HumanParticipant ana = service.join("Ana");
        events.clear();

        Message sent = service.send(ana.getId(), "  Should cities ban cars?  ", "m-1");

        assertThat(sent.getText()).isEqualTo("Should cities ban cars?");
        assertThat(sent.getType()).isEqualTo(MessageType.HUMAN);
        assertThat(queue.size()).isEqualTo(1);
        assertThat(state.recentMessages(1)).containsExactly(sent);

        assertThat(events.names()).containsExactly("usermsg");
        JsonNode payload = events.payloads(StreamEvent.USER_MSG).get(0);
        assertThat(payload.get("clientMsgId").asText()).isEqualTo("m-1");
        assertThat(payload.get("speakerName").asText()).isEqualTo("Ana");
        assertThat(payload.get("type").asText()).isEqualTo("user");
    }

    @Test
    @DisplayName("Long messages are capped")
    void capsText() {
        HumanParticipant ana = service.join("Ana");

        Message sent = service.send(ana.getId(), "x".repeat(800), null);

        assertThat(sent.getText()).hasSize(500);
    }
}
