package com.virtualsol.discovery.modules.stream.event;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A liquidity pool seen on chain. Published by the pool detector; either side may be the
 * quote asset.
 */
@Value
@Builder
public class NewPoolEvent {
    String poolAddress;
    String mint1;
    String mint2;
    String program;
    String signature;
    Instant blockTime;
}
