package com.virtualsol.discovery.modules.stream.event;

import lombok.Value;

import java.time.Instant;

@Value
public class StreamConnectedEvent {
    Instant connectedAt;
}
