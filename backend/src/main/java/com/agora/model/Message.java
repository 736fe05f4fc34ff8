package com.agora.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * One entry of the conversation log. The sequence number is assigned on append and
 * never changes; the log order is the authoritative conversation record.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {
    long seq;
    MessageType type;
    String speakerId;
    String speakerName;
    String avatar;
    String color;
    String role;
    String text;
    String time;
    long timestamp;
    int topicNumber;
    String clientMsgId;
}
