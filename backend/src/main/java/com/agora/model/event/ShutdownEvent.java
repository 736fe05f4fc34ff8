package com.agora.model.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class ShutdownEvent {
    private long totalMessages;
    private int totalTopics;
    private long userMessages;
    private int users;
}
