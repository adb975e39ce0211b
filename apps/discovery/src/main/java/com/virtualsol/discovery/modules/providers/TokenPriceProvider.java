package com.virtualsol.discovery.modules.providers;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * One source in the per-token USD price fallback chain. Implementations are tried in
 * {@link org.springframework.core.annotation.Order} order until one answers.
 */
public interface TokenPriceProvider {

    Optional<BigDecimal> getPriceUsd(String mint);
}
