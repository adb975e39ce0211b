package com.virtualsol.discovery.modules.tokens.handler;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.providers.SolPriceProvider;
import com.virtualsol.discovery.modules.tokens.cache.TokenCacheManager;
import com.virtualsol.discovery.modules.tokens.enrich.TokenHealthEnricher;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.util.MintValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Steps shared by the stream event handlers.
 */
@Slf4j
@Component
public class TokenEventSupport {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TokenDiscoveryRepository tokenRepository;
    private final TokenCacheManager cacheManager;
    private final TokenHealthEnricher healthEnricher;
    private final SolPriceProvider solPriceProvider;
    private final DiscoveryProperties.Scoring scoring;

    public TokenEventSupport(TokenDiscoveryRepository tokenRepository,
                             TokenCacheManager cacheManager,
                             TokenHealthEnricher healthEnricher,
                             SolPriceProvider solPriceProvider,
                             DiscoveryProperties properties) {
        this.tokenRepository = tokenRepository;
        this.cacheManager = cacheManager;
        this.healthEnricher = healthEnricher;
        this.solPriceProvider = solPriceProvider;
        this.scoring = properties.getScoring();
    }

    public Optional<TokenDiscovery> find(String mint) {
        return tokenRepository.findById(mint);
    }

    /**
     * First persistence of a token. The mint must already be validated.
     */
    public void create(TokenDiscovery token) {
        tokenRepository.save(token);
        log.info("Discovered token {} ({}) as {}", MintValidator.abbreviate(token.getMint()),
                token.getSymbol() == null ? "?" : token.getSymbol(), token.getState());
    }

    /**
     * Refreshes the cached row, then starts enrichment without waiting for it.
     */
    public void cacheAndEnrich(String mint) {
        cacheManager.cacheTokenRow(mint);
        healthEnricher.enrichHealthData(mint);
    }

    public void cache(String mint) {
        cacheManager.cacheTokenRow(mint);
    }

    /**
     * Percent of the graduation target held in the curve, capped at 100.
     */
    public BigDecimal bondingCurveProgress(BigDecimal vSolInBondingCurve) {
        if (vSolInBondingCurve == null || vSolInBondingCurve.signum() <= 0) {
            return null;
        }
        BigDecimal progress = vSolInBondingCurve.multiply(HUNDRED)
                .divide(scoring.getBondingCurveTargetSol(), 4, RoundingMode.HALF_UP);
        return progress.min(HUNDRED);
    }

    public BigDecimal toUsd(BigDecimal sol) {
        if (sol == null) {
            return null;
        }
        return solPriceProvider.getSolPriceUsd()
                .map(sol::multiply)
                .orElse(null);
    }

    public BigDecimal initialHotScore() {
        return BigDecimal.valueOf(scoring.getInitialHotScore());
    }

    public BigDecimal directListingHotScore() {
        return BigDecimal.valueOf(scoring.getDirectListingHotScore());
    }
}
