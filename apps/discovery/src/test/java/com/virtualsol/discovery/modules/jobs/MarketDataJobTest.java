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
import com.virtualsol.discovery.support.TestMints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MarketDataJobTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private TokenDiscoveryRepository repository;
    private TokenBufferManager bufferManager;
    private TokenStateManager stateManager;
    private MarketMetadataProvider marketProvider;
    private TokenPriceProvider cachedPrices;
    private TokenPriceProvider jupiter;
    private SolPriceProvider solPriceProvider;
    private MarketDataJob job;

    @BeforeEach
    void setUp() {
        repository = mock(TokenDiscoveryRepository.class);
        bufferManager = mock(TokenBufferManager.class);
        stateManager = mock(TokenStateManager.class);
        marketProvider = mock(MarketMetadataProvider.class);
        cachedPrices = mock(TokenPriceProvider.class);
        jupiter = mock(TokenPriceProvider.class);
        solPriceProvider = mock(SolPriceProvider.class);
        when(bufferManager.getBuffered(anyString())).thenReturn(Optional.empty());
        when(marketProvider.getEnrichedMetadata(anyString(), any())).thenReturn(Optional.empty());
        when(cachedPrices.getPriceUsd(anyString())).thenReturn(Optional.empty());
        when(jupiter.getPriceUsd(anyString())).thenReturn(Optional.empty());
        when(solPriceProvider.getSolPriceUsd()).thenReturn(Optional.of(new BigDecimal("150")));

        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getMarket().setRateLimitDelay(Duration.ZERO);
        job = new MarketDataJob(repository, bufferManager, stateManager, marketProvider,
                List.of(cachedPrices, jupiter), solPriceProvider, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void queriesRecentLaunchesAndBondsWithinTheLookback() {
        when(repository.findMarketRefreshCandidates(any(), any(), any(), any(), any())).thenReturn(List.of());

        job.run();

        verify(repository).findMarketRefreshCandidates(eq(TokenState.BONDED), eq(TokenState.ABOUT_TO_BOND),
                any(), eq(NOW.minus(Duration.ofHours(72))), any());
    }

    @Test
    void convertsUsdVolumeToSolAndReclassifies() {
        TokenDiscovery token = token(TestMints.TOKEN_A);
        when(repository.findMarketRefreshCandidates(any(), any(), any(), any(), any())).thenReturn(List.of(token));
        when(marketProvider.getEnrichedMetadata(eq(TestMints.TOKEN_A), any())).thenReturn(Optional.of(
                MarketMetadata.builder()
                        .priceUsd(new BigDecimal("0.00004"))
                        .marketCapUsd(new BigDecimal("40000"))
                        .volume24h(new BigDecimal("300"))
                        .txCount24h(120)
                        .build()));

        job.run();

        BufferedTokenData staged = captureStaged();
        assertEquals(new BigDecimal("0.00004"), staged.getPriceUsd());
        assertEquals(0, new BigDecimal("2").compareTo(staged.getVolume24hSol()));
        assertEquals(120, staged.getTxCount24h());
        verify(stateManager).reclassify(token);
        assertEquals(0, new BigDecimal("2").compareTo(token.getVolume24hSol()));
        verify(cachedPrices, never()).getPriceUsd(anyString());
    }

    @Test
    void fallsBackToCachedPriceThenJupiter() {
        when(repository.findMarketRefreshCandidates(any(), any(), any(), any(), any()))
                .thenReturn(List.of(token(TestMints.TOKEN_A)));
        when(jupiter.getPriceUsd(TestMints.TOKEN_A)).thenReturn(Optional.of(new BigDecimal("0.0002")));

        job.run();

        assertEquals(new BigDecimal("0.0002"), captureStaged().getPriceUsd());
        verify(cachedPrices).getPriceUsd(TestMints.TOKEN_A);
    }

    @Test
    void derivesPriceFromMarketCapWhenNoSourceHasOne() {
        TokenDiscovery token = token(TestMints.TOKEN_A);
        token.setMarketCapUsd(new BigDecimal("50000"));
        when(repository.findMarketRefreshCandidates(any(), any(), any(), any(), any())).thenReturn(List.of(token));

        job.run();

        assertEquals(0, new BigDecimal("0.00005").compareTo(captureStaged().getPriceUsd()));
    }

    @Test
    void skipsSolVolumeWithoutSolPrice() {
        when(solPriceProvider.getSolPriceUsd()).thenReturn(Optional.empty());
        when(repository.findMarketRefreshCandidates(any(), any(), any(), any(), any()))
                .thenReturn(List.of(token(TestMints.TOKEN_A)));
        when(marketProvider.getEnrichedMetadata(eq(TestMints.TOKEN_A), any())).thenReturn(Optional.of(
                MarketMetadata.builder().volume24h(new BigDecimal("300")).build()));

        job.run();

        BufferedTokenData staged = captureStaged();
        assertEquals(new BigDecimal("300"), staged.getVolume24h());
        assertNull(staged.getVolume24hSol());
    }

    @Test
    void tokenWithNoMarketDataIsLeftAlone() {
        when(repository.findMarketRefreshCandidates(any(), any(), any(), any(), any()))
                .thenReturn(List.of(token(TestMints.TOKEN_A)));

        job.run();

        verify(bufferManager, never()).bufferToken(any());
        verify(stateManager, never()).reclassify(any());
    }

    @Test
    void oneFailingTokenDoesNotAbortTheBatch() {
        when(repository.findMarketRefreshCandidates(any(), any(), any(), any(), any()))
                .thenReturn(List.of(token(TestMints.TOKEN_A), token(TestMints.TOKEN_B)));
        when(marketProvider.getEnrichedMetadata(eq(TestMints.TOKEN_A), any()))
                .thenThrow(new IllegalStateException("aggregator down"));
        when(marketProvider.getEnrichedMetadata(eq(TestMints.TOKEN_B), any())).thenReturn(Optional.of(
                MarketMetadata.builder().priceUsd(new BigDecimal("0.01")).build()));

        job.run();

        assertEquals(TestMints.TOKEN_B, captureStaged().getMint());
    }

    private BufferedTokenData captureStaged() {
        ArgumentCaptor<BufferedTokenData> captor = ArgumentCaptor.forClass(BufferedTokenData.class);
        verify(bufferManager).bufferToken(captor.capture());
        return captor.getValue();
    }

    private static TokenDiscovery token(String mint) {
        TokenDiscovery token = new TokenDiscovery();
        token.setMint(mint);
        token.setState(TokenState.LAUNCHING);
        token.setFirstSeenAt(NOW.minus(Duration.ofHours(1)));
        return token;
    }
}
