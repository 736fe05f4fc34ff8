package com.agora.model.event;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class PingEvent {
    private long timeLeft;
    private int viewers;
}
