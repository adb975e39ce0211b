package com.virtualsol.discovery.modules.providers;

import java.math.BigDecimal;
import java.util.Optional;

public interface SolPriceProvider {

    Optional<BigDecimal> getSolPriceUsd();
}
