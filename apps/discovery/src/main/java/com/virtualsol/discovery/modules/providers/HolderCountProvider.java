package com.virtualsol.discovery.modules.providers;

import java.util.Optional;

public interface HolderCountProvider {

    /**
     * Number of wallets holding a non-zero balance of the mint.
     */
    Optional<Integer> getHolderCount(String mint);
}
