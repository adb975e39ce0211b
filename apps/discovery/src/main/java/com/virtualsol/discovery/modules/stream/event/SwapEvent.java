package com.virtualsol.discovery.modules.stream.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One bonding-curve trade. Amounts are in SOL and whole tokens.
 */
@Value
@Builder
public class SwapEvent implements StreamEvent {

    public enum Side {
        BUY,
        SELL
    }

    String mint;
    String signature;
    Side side;
    String traderPublicKey;
    BigDecimal solAmount;
    BigDecimal tokenAmount;
    BigDecimal vSolInBondingCurve;
    BigDecimal vTokensInBondingCurve;
    BigDecimal marketCapSol;
    Instant timestamp;
}
