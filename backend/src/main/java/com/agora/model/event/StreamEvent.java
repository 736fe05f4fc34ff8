package com.agora.model.event;

/**
 * Names of the events pushed to observers.
 */
public enum StreamEvent {
    FULL_STATE("fullstate"),
    INIT("init"),
    NEW_TOPIC("newtopic"),
    TYPING("typing"),
    MSG_START("msgstart"),
    WORD("word"),
    MSG_DONE("msgdone"),
    USER_MSG("usermsg"),
    SYSTEM("system"),
    PRESENCE("presence"),
    WAITING("waiting"),
    SHUTDOWN("shutdown"),
    PING("ping");

    private final String wireName;

    StreamEvent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
