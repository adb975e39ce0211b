package com.virtualsol.discovery.modules.stream.event;

import lombok.Value;

/**
 * Reconnect attempts are exhausted; the stream stays down until restarted.
 */
@Value
public class StreamGaveUpEvent {
    int attempts;
}
