package com.virtualsol.discovery.modules.providers;

import java.util.Optional;

public interface OnChainMetadataProvider {

    Optional<OnChainMetadata> getMetadata(String mint);
}
