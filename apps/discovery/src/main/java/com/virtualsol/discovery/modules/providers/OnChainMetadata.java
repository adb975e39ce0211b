package com.virtualsol.discovery.modules.providers;

import lombok.Builder;
import lombok.Value;

/**
 * Canonical metadata read from the chain (metadata account plus its off-chain JSON).
 */
@Value
@Builder
public class OnChainMetadata {
    String name;
    String symbol;
    String description;
    String imageUrl;
    Integer decimals;
    String totalSupply;
}
