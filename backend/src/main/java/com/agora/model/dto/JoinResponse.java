package com.agora.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class JoinResponse {
    private String id;
    private String name;
    private String color;
}
