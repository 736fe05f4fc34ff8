package com.agora.bus;

import lombok.Value;

/**
 * An event as it travels through the bus: already serialized, shared by every listener.
 */
@Value
public class BusEvent {
    String name;
    String data;
}
