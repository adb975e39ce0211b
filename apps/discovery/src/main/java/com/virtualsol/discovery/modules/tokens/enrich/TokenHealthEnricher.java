package com.virtualsol.discovery.modules.tokens.enrich;

import com.virtualsol.discovery.config.SchedulerConfig;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.providers.HealthData;
import com.virtualsol.discovery.modules.providers.HealthDataProvider;
import com.virtualsol.discovery.modules.providers.MarketMetadata;
import com.virtualsol.discovery.modules.providers.MarketMetadataProvider;
import com.virtualsol.discovery.modules.providers.OnChainMetadata;
import com.virtualsol.discovery.modules.providers.OnChainMetadataProvider;
import com.virtualsol.discovery.modules.providers.SolPriceProvider;
import com.virtualsol.discovery.modules.tokens.buffer.BufferedTokenData;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.cache.TokenCacheManager;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.util.MintValidator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Pulls health and metadata from the external providers and merges them into the token.
 *
 * <p>The three provider calls run in parallel and are settled independently: a failed or
 * empty call contributes nothing and does not hold back the others. Market volume is also
 * staged in SOL when a SOL price is known.
 */
@Slf4j
@Service
public class TokenHealthEnricher {

    private final TokenDiscoveryRepository tokenRepository;
    private final TokenBufferManager bufferManager;
    private final TokenCacheManager cacheManager;
    private final HealthDataProvider healthDataProvider;
    private final OnChainMetadataProvider onChainMetadataProvider;
    private final MarketMetadataProvider marketMetadataProvider;
    private final SolPriceProvider solPriceProvider;
    private final HotScoreCalculator hotScoreCalculator;
    private final Executor executor;
    private final Tracer tracer;
    private final Clock clock;

    public TokenHealthEnricher(TokenDiscoveryRepository tokenRepository,
                               TokenBufferManager bufferManager,
                               TokenCacheManager cacheManager,
                               HealthDataProvider healthDataProvider,
                               OnChainMetadataProvider onChainMetadataProvider,
                               MarketMetadataProvider marketMetadataProvider,
                               SolPriceProvider solPriceProvider,
                               HotScoreCalculator hotScoreCalculator,
                               @Qualifier(SchedulerConfig.ENRICHMENT_EXECUTOR) Executor executor,
                               Tracer tracer,
                               Clock clock) {
        this.tokenRepository = tokenRepository;
        this.bufferManager = bufferManager;
        this.cacheManager = cacheManager;
        this.healthDataProvider = healthDataProvider;
        this.onChainMetadataProvider = onChainMetadataProvider;
        this.marketMetadataProvider = marketMetadataProvider;
        this.solPriceProvider = solPriceProvider;
        this.hotScoreCalculator = hotScoreCalculator;
        this.executor = executor;
        this.tracer = tracer;
        this.clock = clock;
    }

    /**
     * Enriches a token in the background. The returned future always completes normally.
     */
    public CompletableFuture<Void> enrichHealthData(String mint) {
        Span span = tracer.spanBuilder("TokenHealthEnricher.enrichHealthData").startSpan();
        span.setAttribute("mint", mint);
        try {
            return CompletableFuture.supplyAsync(() -> currentView(mint), executor)
                    .thenCompose(current -> {
                        CompletableFuture<Optional<HealthData>> health =
                                settle("health", mint, () -> healthDataProvider.getHealthData(mint));
                        CompletableFuture<Optional<OnChainMetadata>> onChain =
                                settle("on-chain metadata", mint, () -> onChainMetadataProvider.getMetadata(mint));
                        CompletableFuture<Optional<MarketMetadata>> market =
                                settle("market metadata", mint,
                                        () -> marketMetadataProvider.getEnrichedMetadata(mint, current.getLogoUri()));
                        return CompletableFuture.allOf(health, onChain, market)
                                .thenApply(done -> merge(current, health.join(), onChain.join(), market.join()));
                    })
                    .thenAccept(update -> {
                        bufferManager.bufferToken(update);
                        cacheManager.cacheTokenRow(mint);
                        log.debug("Health data enriched for token {}", MintValidator.abbreviate(mint));
                    })
                    .exceptionally(e -> {
                        span.recordException(e);
                        log.error("Error enriching health data for {}", MintValidator.abbreviate(mint), e);
                        return null;
                    })
                    .whenComplete((v, e) -> span.end());
        } catch (RejectedExecutionException e) {
            log.warn("Enrichment queue full, skipping {}", MintValidator.abbreviate(mint));
            span.end();
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * Hot score of the stored token, or 0 when it is unknown.
     */
    public int calculateHotScore(String mint) {
        try {
            Optional<TokenDiscovery> token = tokenRepository.findById(mint);
            if (token.isEmpty()) {
                return 0;
            }
            return calculateHotScore(token.get());
        } catch (RuntimeException e) {
            log.error("Error calculating hot score for {}", MintValidator.abbreviate(mint), e);
            return 0;
        }
    }

    public int calculateHotScore(TokenDiscovery token) {
        double ageMinutes = token.getFirstSeenAt() == null
                ? 0
                : Duration.between(token.getFirstSeenAt(), clock.instant()).toMillis() / 60_000.0;
        double liquidityUsd = token.getLiquidityUsd() == null ? 0 : token.getLiquidityUsd().doubleValue();
        int watchers = token.getWatcherCount() == null ? 0 : token.getWatcherCount();
        return hotScoreCalculator.score(ageMinutes, liquidityUsd, watchers);
    }

    /**
     * Stored record with staged fields applied, so placeholder checks see the latest values.
     */
    private TokenDiscovery currentView(String mint) {
        TokenDiscovery token = tokenRepository.findById(mint).orElseGet(() -> {
            TokenDiscovery unknown = new TokenDiscovery();
            unknown.setMint(mint);
            return unknown;
        });
        bufferManager.getBuffered(mint).ifPresent(staged -> staged.applyTo(token));
        return token;
    }

    private <T> CompletableFuture<Optional<T>> settle(String source, String mint, Supplier<Optional<T>> call) {
        return CompletableFuture.supplyAsync(call, executor)
                .thenApply(result -> result == null ? Optional.<T>empty() : result)
                .exceptionally(e -> {
                    log.warn("{} provider failed for {}: {}", source, MintValidator.abbreviate(mint), e.getMessage());
                    return Optional.empty();
                });
    }

    /**
     * On-chain metadata wins for name, symbol, description and image where the stored value is
     * missing or a placeholder. Market metadata only fills what is still missing afterwards.
     */
    BufferedTokenData merge(TokenDiscovery current,
                            Optional<HealthData> health,
                            Optional<OnChainMetadata> onChain,
                            Optional<MarketMetadata> market) {
        String mint = current.getMint();
        BufferedTokenData.BufferedTokenDataBuilder update = BufferedTokenData.builder().mint(mint);

        health.ifPresent(h -> update
                .freezeRevoked(h.getFreezeRevoked())
                .mintRenounced(h.getMintRenounced())
                .priceImpact1Pct(h.getPriceImpact1Pct())
                .liquidityUsd(h.getLiquidityUsd()));

        String description = null;
        String imageUrl = null;
        if (onChain.isPresent()) {
            OnChainMetadata data = onChain.get();
            if (hasText(data.getName()) && isPlaceholder(current.getName(), mint)) {
                update.name(data.getName());
            }
            if (hasText(data.getSymbol()) && isPlaceholder(current.getSymbol(), mint)) {
                update.symbol(data.getSymbol());
            }
            if (hasText(data.getDescription())) {
                description = data.getDescription();
            }
            if (hasText(data.getImageUrl()) && (!hasText(current.getImageUrl()) || !hasText(current.getLogoUri()))) {
                imageUrl = data.getImageUrl();
                update.logoUri(imageUrl);
            }
            update.decimals(data.getDecimals()).totalSupply(data.getTotalSupply());
        }

        if (market.isPresent()) {
            MarketMetadata data = market.get();
            if (description == null && !hasText(current.getDescription()) && hasText(data.getDescription())) {
                description = data.getDescription();
            }
            if (imageUrl == null && !hasText(current.getImageUrl()) && hasText(data.getImageUrl())) {
                imageUrl = data.getImageUrl();
                if (!hasText(current.getLogoUri())) {
                    update.logoUri(imageUrl);
                }
            }
            update.twitter(blankToNull(data.getTwitter()))
                    .telegram(blankToNull(data.getTelegram()))
                    .website(blankToNull(data.getWebsite()))
                    .marketCapUsd(data.getMarketCapUsd())
                    .volume24h(data.getVolume24h())
                    .volume24hSol(toSol(data.getVolume24h()))
                    .priceUsd(data.getPriceUsd())
                    .txCount24h(data.getTxCount24h());
        }

        return update.description(description).imageUrl(imageUrl).build();
    }

    private BigDecimal toSol(BigDecimal usd) {
        if (usd == null) {
            return null;
        }
        return solPriceProvider.getSolPriceUsd()
                .filter(price -> price.signum() > 0)
                .map(price -> usd.divide(price, 9, RoundingMode.HALF_UP))
                .orElse(null);
    }

    private static boolean isPlaceholder(String value, String mint) {
        return !hasText(value) || value.equals(MintValidator.abbreviate(mint));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String blankToNull(String value) {
        return hasText(value) ? value : null;
    }
}
