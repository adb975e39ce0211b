package com.virtualsol.discovery.modules.providers;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Authority and liquidity facts for a mint.
 */
@Value
@Builder
public class HealthData {
    Boolean freezeRevoked;
    Boolean mintRenounced;
    BigDecimal priceImpact1Pct;
    BigDecimal liquidityUsd;
}
