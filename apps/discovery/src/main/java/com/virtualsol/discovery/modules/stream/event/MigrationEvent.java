package com.virtualsol.discovery.modules.stream.event;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class MigrationEvent implements StreamEvent {

    public enum Status {
        INITIATED,
        COMPLETED
    }

    String mint;
    String poolAddress;
    String poolType;
    Status status;
    Instant timestamp;
}
