package com.virtualsol.discovery.modules.providers;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Secondary metadata and market snapshot from an aggregator.
 */
@Value
@Builder
public class MarketMetadata {
    String description;
    String imageUrl;
    String twitter;
    String telegram;
    String website;
    BigDecimal marketCapUsd;
    BigDecimal volume24h;
    BigDecimal priceUsd;
    Integer txCount24h;
}
