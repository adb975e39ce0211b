package com.virtualsol.discovery.modules.stream.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class NewTokenEvent implements StreamEvent {
    String mint;
    String name;
    String symbol;
    String uri;
    String creator;
    String bondingCurve;
    /**
     * SOL in the bonding curve at creation, when the feed includes it.
     */
    BigDecimal vSolInBondingCurve;
    BigDecimal marketCapSol;
    Instant timestamp;
}
