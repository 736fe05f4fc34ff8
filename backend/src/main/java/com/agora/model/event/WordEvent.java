package com.agora.model.event;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class WordEvent {
    private String word;
    private int index;
    private int total;
}
