package com.agora.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HumanParticipant {
    String id;
    String name;
    String color;
    long joinedAt;
}
