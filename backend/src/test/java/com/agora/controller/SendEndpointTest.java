package com.agora.controller;

import com.agora.bus.BroadcastBus;
import com.agora.config.DebateSettings;
import com.agora.engine.InboundQueue;
import com.agora.exception.GlobalExceptionHandler;
import com.agora.model.HumanParticipant;
import com.agora.service.ParticipantService;
import com.agora.service.SessionViewService;
import com.agora.session.SessionClock;
import com.agora.session.SessionState;
import com.agora.testsupport.MutableClock;
import com.agora.testsupport.TestSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * {@code /api/send} against the real participant service: the sender is checked before the text.
 */
class SendEndpointTest {

    private final DebateSettings settings = TestSettings.defaults().build();
    private final SessionState state = new SessionState();
    private final InboundQueue queue = new InboundQueue();
    private ParticipantService participants;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        BroadcastBus bus = new BroadcastBus(new ObjectMapper(), 100);
        SessionClock sessionClock = new SessionClock(new MutableClock(Instant.parse("2026-01-01T00:00:00Z")),
                settings.getMaxUptime());
        participants = new ParticipantService(settings, state, sessionClock, queue, bus,
                new SessionViewService(settings, state, sessionClock, bus));
        mockMvc = MockMvcBuilders.standaloneSetup(new ParticipantController(participants))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("A send without an id is forbidden")
    void missingIdIsForbidden() throws Exception {
        mockMvc.perform(post("/api/send").contentType(MediaType.APPLICATION_JSON).content("{\"text\":\"hi\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("not joined"));
    }

    @Test
    @DisplayName("An unknown id is forbidden even when the text is empty")
    void unknownIdWinsOverEmptyText() throws Exception {
        mockMvc.perform(post("/api/send").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"ghost\",\"text\":\"\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("not joined"));
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("A joined participant with empty text gets a bad request")
    void emptyTextFromJoinedParticipant() throws Exception {
        HumanParticipant ana = participants.join("Ana");

        mockMvc.perform(post("/api/send").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"" + ana.getId() + "\",\"text\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("empty"));
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("A joined participant's message is queued for the engine")
    void acceptedMessageIsQueued() throws Exception {
        HumanParticipant ana = participants.join("Ana");

        mockMvc.perform(post("/api/send").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"" + ana.getId() + "\",\"text\":\"hello\",\"msgId\":\"m-7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));
        assertThat(queue.size()).isEqualTo(1);
    }
}
