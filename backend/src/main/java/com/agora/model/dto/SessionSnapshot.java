package com.agora.model.dto;

import com.agora.model.HumanParticipant;
import com.agora.model.Message;
import com.agora.model.Persona;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Point-in-time view served as {@code fullstate} to new or reconnecting observers.
 */
@Data
@Builder
@AllArgsConstructor
public class SessionSnapshot {
    private Persona personaA;
    private Persona personaB;
    private String topic;
    private int topicNumber;
    private List<Message> messages;
    private String typing;
    private long boot;
    private long maxUptime;
    private long timeLeft;
    private List<HumanParticipant> users;
    private int viewers;
}
