package com.agora.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class JoinRequest {
    @NotBlank(message = "name required")
    private String name;
}
