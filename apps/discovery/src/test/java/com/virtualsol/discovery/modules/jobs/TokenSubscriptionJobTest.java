package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.modules.stream.PumpPortalStreamService;
import com.virtualsol.discovery.modules.stream.event.StreamConnectedEvent;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.support.TestMints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.domain.PageRequest;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TokenSubscriptionJobTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private TokenDiscoveryRepository repository;
    private PumpPortalStreamService streamService;
    private TokenSubscriptionJob job;

    @BeforeEach
    void setUp() {
        repository = mock(TokenDiscoveryRepository.class);
        streamService = mock(PumpPortalStreamService.class);
        job = new TokenSubscriptionJob(repository, streamService, new DiscoveryProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void alignsSubscriptionsWithActiveTokens() {
        when(repository.findActiveMints(new BigDecimal("1000"), new BigDecimal("5000"),
                NOW.minus(Duration.ofHours(24)), TokenState.ABOUT_TO_BOND, PageRequest.of(0, 500)))
                .thenReturn(List.of(TestMints.TOKEN_A, TestMints.TOKEN_B));
        when(streamService.getSubscribedMints()).thenReturn(Set.of(TestMints.TOKEN_B, TestMints.TOKEN_C));

        job.run();

        verify(streamService).unsubscribeTokens(Set.of(TestMints.TOKEN_C));
        verify(streamService).subscribeTokens(List.of(TestMints.TOKEN_A, TestMints.TOKEN_B));
    }

    @Test
    void resubscribesWhenTheStreamConnects() {
        when(repository.findActiveMints(any(), any(), any(), any(), any())).thenReturn(List.of(TestMints.TOKEN_A));
        when(streamService.getSubscribedMints()).thenReturn(Set.of());

        job.onStreamConnected(new StreamConnectedEvent(NOW));

        verify(streamService).subscribeTokens(List.of(TestMints.TOKEN_A));
    }

    @Test
    void connectHookSwallowsQueryFailures() {
        when(repository.findActiveMints(any(), any(), any(), any(), any()))
                .thenThrow(new QueryTimeoutException("slow query"));

        job.onStreamConnected(new StreamConnectedEvent(NOW));

        verify(streamService, never()).subscribeTokens(any());
    }
}
