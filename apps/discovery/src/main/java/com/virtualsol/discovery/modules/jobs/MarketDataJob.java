package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.providers.MarketMetadata;
import com.virtualsol.discovery.modules.providers.MarketMetadataProvider;
import com.virtualsol.discovery.modules.providers.SolPriceProvider;
import com.virtualsol.discovery.modules.providers.TokenPriceProvider;
import com.virtualsol.discovery.modules.tokens.buffer.BufferedTokenData;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.modules.tokens.state.TokenStateManager;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.util.MintValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Refreshes price, market cap and 24h volume for recently launched and recently bonded
 * tokens, then re-classifies them against the new volume.
 *
 * <p>Price resolution order: the aggregator's own price, then each {@link TokenPriceProvider}
 * in order, then market cap divided by the fixed pump.fun supply. SOL volume is the USD
 * volume divided by the current SOL price and is skipped when no SOL price is known.
 */
@Slf4j
@Component
public class MarketDataJob implements ScheduledJob {

    private static final int SOL_VOLUME_SCALE = 9;
    private static final int PRICE_SCALE = 18;

    private final TokenDiscoveryRepository tokenRepository;
    private final TokenBufferManager bufferManager;
    private final TokenStateManager stateManager;
    private final MarketMetadataProvider marketProvider;
    private final List<TokenPriceProvider> priceProviders;
    private final SolPriceProvider solPriceProvider;
    private final DiscoveryProperties.Market market;
    private final BigDecimal pumpTotalSupply;
    private final int batchSize;
    private final Duration interval;
    private final Clock clock;

    public MarketDataJob(TokenDiscoveryRepository tokenRepository,
                         TokenBufferManager bufferManager,
                         TokenStateManager stateManager,
                         MarketMetadataProvider marketProvider,
                         List<TokenPriceProvider> priceProviders,
                         SolPriceProvider solPriceProvider,
                         DiscoveryProperties properties,
                         Clock clock) {
        this.tokenRepository = tokenRepository;
        this.bufferManager = bufferManager;
        this.stateManager = stateManager;
        this.marketProvider = marketProvider;
        this.priceProviders = priceProviders;
        this.solPriceProvider = solPriceProvider;
        this.market = properties.getMarket();
        this.pumpTotalSupply = properties.getScoring().getPumpTotalSupply();
        this.batchSize = properties.getLimits().getMaxTokensPerBatch();
        this.interval = properties.getIntervals().getMarketDataUpdate();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "market-data";
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public void run() {
        Instant since = clock.instant().minus(market.getLookback());
        List<TokenDiscovery> batch = tokenRepository.findMarketRefreshCandidates(
                TokenState.BONDED, TokenState.ABOUT_TO_BOND,
                EnumSet.of(TokenState.LAUNCHING, TokenState.ACTIVE), since, PageRequest.of(0, batchSize));
        if (batch.isEmpty()) {
            log.debug("Market data: nothing to refresh");
            return;
        }

        BigDecimal solPrice = solPriceProvider.getSolPriceUsd()
                .filter(price -> price.signum() > 0)
                .orElse(null);
        if (solPrice == null) {
            log.warn("No SOL price available, SOL volume will not be refreshed this cycle");
        }

        int refreshed = 0;
        int transitions = 0;
        for (int i = 0; i < batch.size(); i++) {
            if (i > 0 && !pause()) {
                break;
            }
            TokenDiscovery token = batch.get(i);
            try {
                Optional<BufferedTokenData> update = refresh(token, solPrice);
                if (update.isEmpty()) {
                    continue;
                }
                refreshed++;
                if (stateManager.reclassify(token)) {
                    transitions++;
                }
            } catch (RuntimeException e) {
                log.error("Market refresh failed for {}", MintValidator.abbreviate(token.getMint()), e);
            }
        }
        log.info("Market data: refreshed {} of {} tokens, {} transitions", refreshed, batch.size(), transitions);
    }

    /**
     * Stages the refreshed fields and applies them to {@code token}.
     *
     * @return the staged update, or empty when no source had anything for the token
     */
    Optional<BufferedTokenData> refresh(TokenDiscovery token, BigDecimal solPrice) {
        String mint = token.getMint();
        bufferManager.getBuffered(mint).ifPresent(staged -> staged.applyTo(token));

        MarketMetadata snapshot = marketProvider.getEnrichedMetadata(mint, token.getLogoUri()).orElse(null);
        BigDecimal marketCap = snapshot != null && snapshot.getMarketCapUsd() != null
                ? snapshot.getMarketCapUsd()
                : token.getMarketCapUsd();
        BigDecimal volume = snapshot == null ? null : snapshot.getVolume24h();
        BigDecimal price = resolvePrice(mint, snapshot, marketCap);

        BufferedTokenData update = BufferedTokenData.builder()
                .mint(mint)
                .priceUsd(price)
                .marketCapUsd(snapshot == null ? null : snapshot.getMarketCapUsd())
                .volume24h(volume)
                .volume24hSol(volume != null && solPrice != null
                        ? volume.divide(solPrice, SOL_VOLUME_SCALE, RoundingMode.HALF_UP)
                        : null)
                .txCount24h(snapshot == null ? null : snapshot.getTxCount24h())
                .build();
        if (update.toHash().size() == 1) {
            return Optional.empty();
        }
        bufferManager.bufferToken(update);
        update.applyTo(token);
        return Optional.of(update);
    }

    private BigDecimal resolvePrice(String mint, MarketMetadata snapshot, BigDecimal marketCap) {
        if (snapshot != null && snapshot.getPriceUsd() != null && snapshot.getPriceUsd().signum() > 0) {
            return snapshot.getPriceUsd();
        }
        for (TokenPriceProvider provider : priceProviders) {
            Optional<BigDecimal> price = provider.getPriceUsd(mint);
            if (price.isPresent()) {
                return price.get();
            }
        }
        if (marketCap != null && marketCap.signum() > 0) {
            return marketCap.divide(pumpTotalSupply, PRICE_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
        }
        return null;
    }

    private boolean pause() {
        long millis = market.getRateLimitDelay().toMillis();
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Market data refresh interrupted");
            return false;
        }
    }
}
