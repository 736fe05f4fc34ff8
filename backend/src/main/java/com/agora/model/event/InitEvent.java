package com.agora.model.event;

import com.agora.model.Persona;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class InitEvent {
    private Persona personaA;
    private Persona personaB;
    private String topic;
    private int topicNumber;
    private long boot;
    private long maxUptime;
}
