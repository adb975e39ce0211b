package com.virtualsol.discovery.modules.providers;

import java.util.Optional;

public interface MarketMetadataProvider {

    /**
     * @param logoUri the currently stored logo, used by aggregators to resolve IPFS metadata
     */
    Optional<MarketMetadata> getEnrichedMetadata(String mint, String logoUri);
}
