package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.cache.TokenCacheManager;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.support.TestMints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CleanupJobTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private TokenDiscoveryRepository repository;
    private TokenCacheManager cacheManager;
    private TokenBufferManager bufferManager;
    private CleanupJob job;

    @BeforeEach
    void setUp() {
        repository = mock(TokenDiscoveryRepository.class);
        cacheManager = mock(TokenCacheManager.class);
        bufferManager = mock(TokenBufferManager.class);
        job = new CleanupJob(repository, cacheManager, bufferManager, new DiscoveryProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void deletesExpiredTokensEverywhere() {
        List<String> expired = List.of(TestMints.TOKEN_A, TestMints.TOKEN_B);
        when(repository.findExpiredMints(TokenState.DEAD, NOW.minus(Duration.ofHours(24)),
                TokenState.LAUNCHING, NOW.minus(Duration.ofHours(48)))).thenReturn(expired);
        when(repository.deleteByMintIn(expired)).thenReturn(2);

        job.run();

        InOrder order = inOrder(bufferManager, repository, cacheManager);
        order.verify(bufferManager).discard(expired);
        order.verify(repository).deleteByMintIn(expired);
        order.verify(cacheManager).removeFromIndexes(expired);
    }

    @Test
    void nothingExpiredDeletesNothing() {
        when(repository.findExpiredMints(any(), any(), any(), any())).thenReturn(List.of());

        job.run();

        verify(repository, never()).deleteByMintIn(any());
    }
}
