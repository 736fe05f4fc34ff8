package com.agora.model.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class WaitingEvent {
    private String name;
    private String avatar;
    private String color;
    private long gap;
    private long timeLeft;
}
