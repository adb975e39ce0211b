package com.virtualsol.discovery.modules.tokens.state;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.entity.TokenWatch;
import com.virtualsol.discovery.modules.notify.NotificationPublisher;
import com.virtualsol.discovery.modules.notify.TokenTransitionNotification;
import com.virtualsol.discovery.modules.tokens.cache.TokenCacheManager;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.repository.TokenWatchRepository;
import com.virtualsol.discovery.util.MintValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Lifecycle classification and the single write path for {@code state}.
 */
@Slf4j
@Service
public class TokenStateManager {

    private final TokenDiscoveryRepository tokenRepository;
    private final TokenWatchRepository watchRepository;
    private final TokenCacheManager cacheManager;
    private final NotificationPublisher notificationPublisher;
    private final DiscoveryProperties.StateThresholds thresholds;
    private final DiscoveryProperties.Limits limits;
    private final Clock clock;

    public TokenStateManager(TokenDiscoveryRepository tokenRepository,
                             TokenWatchRepository watchRepository,
                             TokenCacheManager cacheManager,
                             NotificationPublisher notificationPublisher,
                             DiscoveryProperties properties,
                             Clock clock) {
        this.tokenRepository = tokenRepository;
        this.watchRepository = watchRepository;
        this.cacheManager = cacheManager;
        this.notificationPublisher = notificationPublisher;
        this.thresholds = properties.getStateThresholds();
        this.limits = properties.getLimits();
        this.clock = clock;
    }

    /**
     * Classifies a token. First matching rule wins:
     * <ol>
     *     <li>curve complete or pool exists: {@link TokenState#BONDED}</li>
     *     <li>never traded: {@link TokenState#LAUNCHING}</li>
     *     <li>high progress and traded within the about-to-bond window: {@link TokenState#ABOUT_TO_BOND}</li>
     *     <li>last trade older than the dead window, or 24h volume below the dead floor: {@link TokenState#DEAD}</li>
     *     <li>recent trade with enough volume and holders: {@link TokenState#ACTIVE}, else {@link TokenState#LAUNCHING}</li>
     * </ol>
     */
    public TokenState classifyTokenState(TokenSnapshot token) {
        BigDecimal progress = orZero(token.getBondingCurveProgress());

        if (progress.compareTo(thresholds.getGraduatingMaxProgress()) >= 0 || token.isGraduated()) {
            return TokenState.BONDED;
        }

        Instant lastTrade = token.getLastTradeTs();
        if (lastTrade == null) {
            return TokenState.LAUNCHING;
        }

        Duration sinceLastTrade = Duration.between(lastTrade, clock.instant());
        BigDecimal volume = orZero(token.getVolume24hSol());
        int holders = token.getHolderCount() == null ? 0 : token.getHolderCount();

        if (progress.compareTo(thresholds.getAboutToBondProgress()) >= 0
                && sinceLastTrade.compareTo(Duration.ofMinutes(thresholds.getAboutToBondMinutes())) < 0) {
            return TokenState.ABOUT_TO_BOND;
        }

        if (sinceLastTrade.compareTo(Duration.ofHours(thresholds.getDeadTokenHours())) > 0
                || volume.compareTo(thresholds.getMinDeadVolumeSol()) < 0) {
            return TokenState.DEAD;
        }

        boolean recent = sinceLastTrade.compareTo(Duration.ofHours(thresholds.getActiveTokenHours())) < 0;
        boolean enoughVolume = volume.compareTo(limits.getMinActiveVolumeSol()) >= 0;
        boolean enoughHolders = holders >= limits.getMinHoldersCount();
        return recent && enoughVolume && enoughHolders ? TokenState.ACTIVE : TokenState.LAUNCHING;
    }

    /**
     * Persists a transition and drops the cached row. Callers re-cache afterwards.
     *
     * @return false when no row exists for the mint
     */
    public boolean updateState(String mint, TokenState newState, TokenState oldState) {
        int updated = tokenRepository.updateState(mint, newState, oldState, clock.instant());
        cacheManager.invalidateCache(mint);
        if (updated == 0) {
            log.warn("State update for unknown token {}", MintValidator.abbreviate(mint));
            return false;
        }
        log.debug("Token {} state {} -> {}", MintValidator.abbreviate(mint), oldState, newState);
        return true;
    }

    /**
     * Classifies the token as given and, when the state changed, persists the transition,
     * notifies watchers and re-caches the row.
     *
     * @return true when a transition was written
     */
    public boolean reclassify(TokenDiscovery token) {
        String mint = token.getMint();
        TokenState oldState = token.getState();
        TokenState newState = classifyTokenState(TokenSnapshot.of(token));
        if (newState == oldState || !updateState(mint, newState, oldState)) {
            return false;
        }
        notifyWatchers(mint, oldState, newState);
        cacheManager.cacheTokenRow(mint);
        return true;
    }

    /**
     * Queues a notification for every user watching this token's graduation or migration.
     * Never throws.
     */
    public void notifyWatchers(String mint, TokenState oldState, TokenState newState) {
        try {
            List<TokenWatch> watches = watchRepository.findNotifiableByMint(mint);
            int sent = 0;
            for (TokenWatch watch : watches) {
                boolean graduation = watch.isNotifyOnGraduation() && newState == TokenState.BONDED;
                if (!graduation && !watch.isNotifyOnMigration()) {
                    continue;
                }
                try {
                    notificationPublisher.publish(buildNotification(watch.getUserId(), mint, oldState, newState));
                    sent++;
                } catch (RuntimeException e) {
                    log.error("Failed to notify user {} about {}", watch.getUserId(), MintValidator.abbreviate(mint), e);
                }
            }
            if (sent > 0) {
                log.debug("Notified {} watchers of {} ({} -> {})", sent, MintValidator.abbreviate(mint), oldState, newState);
            }
        } catch (RuntimeException e) {
            log.error("Error notifying watchers for {}", MintValidator.abbreviate(mint), e);
        }
    }

    private TokenTransitionNotification buildNotification(String userId, String mint,
                                                          TokenState oldState, TokenState newState) {
        String from = oldState == null ? "unknown" : oldState.getValue();
        return TokenTransitionNotification.builder()
                .userId(userId)
                .mint(mint)
                .oldState(from)
                .newState(newState.getValue())
                .title(from + " -> " + newState.getValue())
                .message("Your watched token " + mint + " has transitioned to " + newState.getValue())
                .actionUrl("/room/" + mint)
                .createdAt(clock.millis())
                .build();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
