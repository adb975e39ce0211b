package com.virtualsol.discovery.modules.stream.event;

import lombok.Value;

@Value
public class StreamDisconnectedEvent {
    int code;
    String reason;
    boolean remote;
}
