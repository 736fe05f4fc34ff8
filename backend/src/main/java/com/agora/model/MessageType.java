package com.agora.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageType {
    TOPIC("topic"),
    AI("message"),
    HUMAN("user"),
    SYSTEM("system");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
