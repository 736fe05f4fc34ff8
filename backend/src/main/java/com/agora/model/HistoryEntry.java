package com.agora.model;

import lombok.Value;

@Value
public class HistoryEntry {
    HistoryRole role;
    String text;
}
