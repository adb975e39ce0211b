package com.virtualsol.discovery.modules.tokens.handler;

import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.stream.event.NewTokenEvent;
import com.virtualsol.discovery.modules.tokens.buffer.BufferedTokenData;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.modules.txcount.TxCountManager;
import com.virtualsol.discovery.util.IpfsUrls;
import com.virtualsol.discovery.util.MintValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Token creation on the bonding curve.
 *
 * <p>Initial liquidity is the SOL already in the curve at the current SOL price. The metadata
 * link becomes the logo; the image itself, decimals and supply arrive with enrichment.
 */
@Slf4j
@Component
public class NewTokenHandler {

    private final TokenEventSupport support;
    private final TokenBufferManager bufferManager;
    private final TxCountManager txCountManager;
    private final Clock clock;

    public NewTokenHandler(TokenEventSupport support,
                           TokenBufferManager bufferManager,
                           TxCountManager txCountManager,
                           Clock clock) {
        this.support = support;
        this.bufferManager = bufferManager;
        this.txCountManager = txCountManager;
        this.clock = clock;
    }

    @EventListener
    public void handle(NewTokenEvent event) {
        String mint = event.getMint();
        if (!MintValidator.isValid(mint)) {
            log.debug("Dropping newToken with invalid mint {}", mint);
            return;
        }
        if (event.getSymbol() == null && event.getName() == null && event.getUri() == null) {
            log.warn("Rejecting token {} with no metadata", MintValidator.abbreviate(mint));
            return;
        }

        try {
            BigDecimal progress = support.bondingCurveProgress(event.getVSolInBondingCurve());
            BigDecimal marketCapUsd = support.toUsd(event.getMarketCapSol());
            BigDecimal liquidityUsd = support.toUsd(event.getVSolInBondingCurve());
            String logoUri = IpfsUrls.toHttp(event.getUri());
            String imageUrl = IpfsUrls.isLikelyImage(logoUri) ? logoUri : null;
            int txCount = txCountManager.getCount(mint);

            if (support.find(mint).isEmpty()) {
                Instant now = clock.instant();
                TokenDiscovery token = new TokenDiscovery();
                token.setMint(mint);
                token.setSymbol(event.getSymbol());
                token.setName(event.getName());
                token.setCreatorWallet(event.getCreator());
                token.setBondingCurveKey(event.getBondingCurve());
                token.setState(TokenState.LAUNCHING);
                token.setHotScore(support.initialHotScore());
                if (progress != null) {
                    token.setBondingCurveProgress(progress);
                }
                token.setMarketCapUsd(marketCapUsd);
                token.setLiquidityUsd(liquidityUsd);
                token.setLogoUri(logoUri);
                token.setImageUrl(imageUrl);
                token.setTxCount24h(txCount > 0 ? txCount : null);
                token.setFirstSeenAt(now);
                token.setStateChangedAt(now);
                support.create(token);
            } else {
                bufferManager.bufferToken(BufferedTokenData.builder()
                        .mint(mint)
                        .symbol(event.getSymbol())
                        .name(event.getName())
                        .creatorWallet(event.getCreator())
                        .bondingCurveKey(event.getBondingCurve())
                        .bondingCurveProgress(progress)
                        .marketCapUsd(marketCapUsd)
                        .liquidityUsd(liquidityUsd)
                        .logoUri(logoUri)
                        .imageUrl(imageUrl)
                        .txCount24h(txCount > 0 ? txCount : null)
                        .build());
            }

            support.cacheAndEnrich(mint);
        } catch (RuntimeException e) {
            log.error("Error handling newToken event for {}", MintValidator.abbreviate(mint), e);
        }
    }
}
