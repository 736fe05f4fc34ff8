package com.agora.model.dto;

import lombok.Data;

/**
 * Checked by {@code ParticipantService}: the sender id first (403), then the text (400).
 */
@Data
public class SendRequest {
    private String id;
    private String text;
    private String msgId;
}
