package com.agora.model.event;

import com.agora.model.HumanParticipant;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class PresenceEvent {
    private List<HumanParticipant> users;
    private int viewers;
}
