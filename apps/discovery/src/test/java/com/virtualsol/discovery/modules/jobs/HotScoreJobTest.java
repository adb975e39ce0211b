package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.tokens.buffer.BufferedTokenData;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.cache.TokenCacheManager;
import com.virtualsol.discovery.modules.tokens.enrich.TokenHealthEnricher;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.support.TestMints;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HotScoreJobTest {

    @Test
    void restagesOnlyChangedScores() {
        TokenDiscoveryRepository repository = mock(TokenDiscoveryRepository.class);
        TokenHealthEnricher enricher = mock(TokenHealthEnricher.class);
        TokenBufferManager bufferManager = mock(TokenBufferManager.class);
        TokenCacheManager cacheManager = mock(TokenCacheManager.class);

        TokenDiscovery steady = token(TestMints.TOKEN_A, "60");
        TokenDiscovery moved = token(TestMints.TOKEN_B, "90");
        when(repository.findByStateIn(any(), any())).thenReturn(List.of(steady, moved));
        when(enricher.calculateHotScore(steady)).thenReturn(60);
        when(enricher.calculateHotScore(moved)).thenReturn(45);

        new HotScoreJob(repository, enricher, bufferManager, cacheManager, new DiscoveryProperties()).run();

        ArgumentCaptor<BufferedTokenData> captor = ArgumentCaptor.forClass(BufferedTokenData.class);
        verify(bufferManager).bufferToken(captor.capture());
        assertEquals(TestMints.TOKEN_B, captor.getValue().getMint());
        assertEquals(new BigDecimal("45"), captor.getValue().getHotScore());
        verify(cacheManager).cacheTokenRow(TestMints.TOKEN_B);
    }

    private static TokenDiscovery token(String mint, String hotScore) {
        TokenDiscovery token = new TokenDiscovery();
        token.setMint(mint);
        token.setHotScore(new BigDecimal(hotScore));
        return token;
    }
}
