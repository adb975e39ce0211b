package com.virtualsol.discovery.modules.stream.event;

import java.time.Instant;

/**
 * A decoded upstream message. Every variant carries the mint it concerns.
 */
public interface StreamEvent {

    String getMint();

    Instant getTimestamp();
}
