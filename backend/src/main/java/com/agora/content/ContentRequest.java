package com.agora.content;

import com.agora.model.HistoryEntry;
import com.agora.model.Persona;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ContentRequest {
    Persona persona;
    String systemPrompt;
    @Singular("historyEntry")
    List<HistoryEntry> history;
    String instruction;
}
