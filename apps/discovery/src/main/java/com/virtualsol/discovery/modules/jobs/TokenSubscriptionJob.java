package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.modules.stream.PumpPortalStreamService;
import com.virtualsol.discovery.modules.stream.event.StreamConnectedEvent;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps trade subscriptions aligned with the currently active tokens.
 */
@Slf4j
@Component
public class TokenSubscriptionJob implements ScheduledJob {

    private final TokenDiscoveryRepository tokenRepository;
    private final PumpPortalStreamService streamService;
    private final DiscoveryProperties.Limits limits;
    private final Duration interval;
    private final Clock clock;

    public TokenSubscriptionJob(TokenDiscoveryRepository tokenRepository,
                                PumpPortalStreamService streamService,
                                DiscoveryProperties properties,
                                Clock clock) {
        this.tokenRepository = tokenRepository;
        this.streamService = streamService;
        this.limits = properties.getLimits();
        this.interval = properties.getIntervals().getTokenSubscription();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "token-subscription";
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public void run() {
        List<String> active = tokenRepository.findActiveMints(
                limits.getSubscriptionMinVolumeUsd(),
                limits.getSubscriptionMinMarketCapUsd(),
                clock.instant().minus(limits.getSubscriptionTradeWindow()),
                TokenState.ABOUT_TO_BOND,
                PageRequest.of(0, limits.getMaxActiveTokensSubscription()));

        Set<String> stale = new HashSet<>(streamService.getSubscribedMints());
        stale.removeAll(active);

        int removed = streamService.unsubscribeTokens(stale);
        int added = streamService.subscribeTokens(active);
        log.debug("Trade subscriptions: +{} -{} ({} active)", added, removed, active.size());
    }

    @EventListener
    public void onStreamConnected(StreamConnectedEvent event) {
        log.info("PumpPortal connected, refreshing active token subscriptions");
        try {
            run();
        } catch (RuntimeException e) {
            log.error("Failed to resubscribe on reconnection", e);
        }
    }
}
