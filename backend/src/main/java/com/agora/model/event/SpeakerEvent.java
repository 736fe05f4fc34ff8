package com.agora.model.event;

import com.agora.model.Persona;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Payload of {@code typing} and {@code msgstart}.
 */
@Data
@Builder
@AllArgsConstructor
public class SpeakerEvent {
    private String id;
    private String name;
    private String avatar;
    private String color;
    private String role;
    private String time;

    public static SpeakerEvent of(Persona persona, String time) {
        return SpeakerEvent.builder()
                .id(persona.getId())
                .name(persona.getName())
                .avatar(persona.getAvatar())
                .color(persona.getColor())
                .role(persona.getRole())
                .time(time)
                .build();
    }
}
