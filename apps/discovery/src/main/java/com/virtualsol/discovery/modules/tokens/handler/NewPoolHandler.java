package com.virtualsol.discovery.modules.tokens.handler;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.stream.event.NewPoolEvent;
import com.virtualsol.discovery.modules.tokens.buffer.BufferedTokenData;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.modules.tokens.state.TokenStateManager;
import com.virtualsol.discovery.util.MintValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Pools created outside the bonding curve. A pool is enough to call the token bonded,
 * whether or not its creation was ever seen.
 */
@Slf4j
@Component
public class NewPoolHandler {

    private static final BigDecimal COMPLETE = BigDecimal.valueOf(100);

    private final TokenEventSupport support;
    private final TokenBufferManager bufferManager;
    private final TokenStateManager stateManager;
    private final DiscoveryProperties.KnownMints knownMints;
    private final Clock clock;

    public NewPoolHandler(TokenEventSupport support,
                          TokenBufferManager bufferManager,
                          TokenStateManager stateManager,
                          DiscoveryProperties properties,
                          Clock clock) {
        this.support = support;
        this.bufferManager = bufferManager;
        this.stateManager = stateManager;
        this.knownMints = properties.getKnownMints();
        this.clock = clock;
    }

    @EventListener
    public void handle(NewPoolEvent event) {
        Optional<String> resolved = trackedMint(event);
        if (resolved.isEmpty()) {
            log.debug("No tracked side in pool {}", event.getPoolAddress());
            return;
        }
        String mint = resolved.get();
        if (!MintValidator.isValid(mint)) {
            log.debug("Dropping pool {} with invalid mint {}", event.getPoolAddress(), mint);
            return;
        }

        try {
            Instant poolCreatedAt = event.getBlockTime() != null ? event.getBlockTime() : clock.instant();
            Optional<TokenDiscovery> existing = support.find(mint);

            if (existing.isPresent()) {
                TokenState oldState = existing.get().getState();
                bufferManager.bufferToken(BufferedTokenData.builder()
                        .mint(mint)
                        .bondingCurveProgress(COMPLETE)
                        .poolAddress(event.getPoolAddress())
                        .poolType(event.getProgram())
                        .poolCreatedAt(poolCreatedAt)
                        .build());
                if (oldState != TokenState.BONDED && stateManager.updateState(mint, TokenState.BONDED, oldState)) {
                    stateManager.notifyWatchers(mint, oldState, TokenState.BONDED);
                }
            } else {
                TokenDiscovery token = new TokenDiscovery();
                token.setMint(mint);
                token.setState(TokenState.BONDED);
                token.setBondingCurveProgress(COMPLETE);
                token.setPoolAddress(event.getPoolAddress());
                token.setPoolType(event.getProgram());
                token.setPoolCreatedAt(poolCreatedAt);
                token.setHotScore(support.directListingHotScore());
                support.create(token);
            }

            support.cacheAndEnrich(mint);
        } catch (RuntimeException e) {
            log.error("Error handling new pool {} for {}", event.getPoolAddress(), MintValidator.abbreviate(mint), e);
        }
    }

    /**
     * The side that is not a quote asset. Empty when both or neither side is a quote asset.
     */
    Optional<String> trackedMint(NewPoolEvent event) {
        boolean firstQuote = knownMints.isQuoteMint(event.getMint1());
        boolean secondQuote = knownMints.isQuoteMint(event.getMint2());
        if (firstQuote == secondQuote) {
            return Optional.empty();
        }
        return Optional.ofNullable(firstQuote ? event.getMint2() : event.getMint1());
    }
}
