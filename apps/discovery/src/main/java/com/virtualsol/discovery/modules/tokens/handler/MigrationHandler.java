package com.virtualsol.discovery.modules.tokens.handler;

import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.stream.event.MigrationEvent;
import com.virtualsol.discovery.modules.tokens.buffer.BufferedTokenData;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.modules.tokens.state.TokenStateManager;
import com.virtualsol.discovery.util.MintValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Graduation from the bonding curve into a pool.
 *
 * <p>Only completed migrations change state. An initiated migration only touches the row.
 */
@Slf4j
@Component
public class MigrationHandler {

    private static final BigDecimal COMPLETE = BigDecimal.valueOf(100);

    private final TokenEventSupport support;
    private final TokenBufferManager bufferManager;
    private final TokenStateManager stateManager;

    public MigrationHandler(TokenEventSupport support,
                            TokenBufferManager bufferManager,
                            TokenStateManager stateManager) {
        this.support = support;
        this.bufferManager = bufferManager;
        this.stateManager = stateManager;
    }

    @EventListener
    public void handle(MigrationEvent event) {
        String mint = event.getMint();
        if (!MintValidator.isValid(mint)) {
            log.debug("Dropping migration with invalid mint {}", mint);
            return;
        }

        try {
            Optional<TokenDiscovery> existing = support.find(mint);

            if (event.getStatus() == MigrationEvent.Status.INITIATED) {
                if (existing.isPresent()) {
                    bufferManager.bufferToken(BufferedTokenData.builder().mint(mint).build());
                }
                log.info("Migration initiated for {}", MintValidator.abbreviate(mint));
                return;
            }

            Instant poolCreatedAt = event.getTimestamp();
            if (existing.isEmpty()) {
                TokenDiscovery token = new TokenDiscovery();
                token.setMint(mint);
                token.setState(TokenState.BONDED);
                token.setBondingCurveProgress(COMPLETE);
                token.setPoolAddress(event.getPoolAddress());
                token.setPoolType(event.getPoolType());
                token.setPoolCreatedAt(event.getPoolAddress() == null ? null : poolCreatedAt);
                token.setHotScore(support.initialHotScore());
                support.create(token);
            } else {
                TokenState oldState = existing.get().getState();
                bufferManager.bufferToken(BufferedTokenData.builder()
                        .mint(mint)
                        .bondingCurveProgress(COMPLETE)
                        .poolAddress(event.getPoolAddress())
                        .poolType(event.getPoolType())
                        .poolCreatedAt(event.getPoolAddress() == null ? null : poolCreatedAt)
                        .build());
                if (oldState != TokenState.BONDED && stateManager.updateState(mint, TokenState.BONDED, oldState)) {
                    stateManager.notifyWatchers(mint, oldState, TokenState.BONDED);
                }
            }
            log.info("Migration completed for {} (pool {})", MintValidator.abbreviate(mint),
                    MintValidator.abbreviate(event.getPoolAddress()));

            support.cacheAndEnrich(mint);
        } catch (RuntimeException e) {
            log.error("Error handling migration for {}", MintValidator.abbreviate(mint), e);
        }
    }
}
