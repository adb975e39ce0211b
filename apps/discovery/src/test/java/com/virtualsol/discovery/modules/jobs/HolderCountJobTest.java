package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.providers.HolderCountProvider;
import com.virtualsol.discovery.modules.tokens.buffer.BufferedTokenData;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.support.TestMints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HolderCountJobTest {

    private TokenDiscoveryRepository repository;
    private TokenBufferManager bufferManager;
    private HolderCountProvider holderCountProvider;
    private HolderCountJob job;

    @BeforeEach
    void setUp() {
        repository = mock(TokenDiscoveryRepository.class);
        bufferManager = mock(TokenBufferManager.class);
        holderCountProvider = mock(HolderCountProvider.class);
        when(holderCountProvider.getHolderCount(anyString())).thenReturn(Optional.empty());
        job = new HolderCountJob(repository, bufferManager, holderCountProvider, new DiscoveryProperties());
    }

    @Test
    void stagesChangedCountsForTradedTokens() {
        when(repository.findByStateNotOrderByLastUpdatedAtAsc(eq(TokenState.DEAD),
                argThat((Pageable page) -> page.getPageSize() == 100))).thenReturn(List.of(
                token(TestMints.TOKEN_A, 4),
                token(TestMints.TOKEN_B, 12)));
        when(holderCountProvider.getHolderCount(TestMints.TOKEN_A)).thenReturn(Optional.of(27));
        when(holderCountProvider.getHolderCount(TestMints.TOKEN_B)).thenReturn(Optional.of(12));

        job.run();

        ArgumentCaptor<BufferedTokenData> captor = ArgumentCaptor.forClass(BufferedTokenData.class);
        verify(bufferManager).bufferToken(captor.capture());
        assertEquals(TestMints.TOKEN_A, captor.getValue().getMint());
        assertEquals(27, captor.getValue().getHolderCount());
    }

    @Test
    void untradedTokensAreNotLookedUp() {
        TokenDiscovery untraded = token(TestMints.TOKEN_A, null);
        untraded.setLastTradeTs(null);
        when(repository.findByStateNotOrderByLastUpdatedAtAsc(eq(TokenState.DEAD), any())).thenReturn(List.of(untraded));

        job.run();

        verify(holderCountProvider, never()).getHolderCount(anyString());
    }

    @Test
    void lookupFailureMovesOnToTheNextToken() {
        when(repository.findByStateNotOrderByLastUpdatedAtAsc(eq(TokenState.DEAD), any())).thenReturn(List.of(
                token(TestMints.TOKEN_A, null),
                token(TestMints.TOKEN_B, null)));
        when(holderCountProvider.getHolderCount(TestMints.TOKEN_A)).thenThrow(new IllegalStateException("rpc timeout"));
        when(holderCountProvider.getHolderCount(TestMints.TOKEN_B)).thenReturn(Optional.of(15));

        job.run();

        ArgumentCaptor<BufferedTokenData> captor = ArgumentCaptor.forClass(BufferedTokenData.class);
        verify(bufferManager).bufferToken(captor.capture());
        assertEquals(TestMints.TOKEN_B, captor.getValue().getMint());
    }

    private static TokenDiscovery token(String mint, Integer holders) {
        TokenDiscovery token = new TokenDiscovery();
        token.setMint(mint);
        token.setState(TokenState.LAUNCHING);
        token.setHolderCount(holders);
        token.setLastTradeTs(Instant.parse("2024-05-01T11:00:00Z"));
        return token;
    }
}
