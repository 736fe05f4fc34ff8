package com.agora.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Catalog entry for an AI debate participant. Two of these are drawn at session start
 * and stay fixed until the session ends.
 */
@Value
@Builder
@Jacksonized
public class Persona {
    String id;
    String name;
    String avatar;
    String color;
    String role;
    String personality;
    String style;
}
