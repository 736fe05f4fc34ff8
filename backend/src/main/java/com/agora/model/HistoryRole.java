package com.agora.model;

public enum HistoryRole {
    SELF,
    PEER
}
