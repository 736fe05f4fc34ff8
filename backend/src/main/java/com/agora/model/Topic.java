package com.agora.model;

import lombok.Value;

@Value
public class Topic {
    String text;
    int number;
}
