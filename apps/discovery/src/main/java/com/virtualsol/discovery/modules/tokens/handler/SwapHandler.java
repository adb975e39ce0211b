package com.virtualsol.discovery.modules.tokens.handler;

import com.virtualsol.discovery.modules.stream.event.SwapEvent;
import com.virtualsol.discovery.modules.tokens.buffer.BufferedTokenData;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.txcount.TxCountManager;
import com.virtualsol.discovery.util.MintValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Bonding-curve trades. Everything is staged; the buffer flush creates unknown tokens.
 * State is left to the classification job, which reads the staged fields.
 */
@Slf4j
@Component
public class SwapHandler {

    private final TokenEventSupport support;
    private final TokenBufferManager bufferManager;
    private final TxCountManager txCountManager;

    public SwapHandler(TokenEventSupport support,
                       TokenBufferManager bufferManager,
                       TxCountManager txCountManager) {
        this.support = support;
        this.bufferManager = bufferManager;
        this.txCountManager = txCountManager;
    }

    @EventListener
    public void handle(SwapEvent event) {
        String mint = event.getMint();
        if (!MintValidator.isValid(mint) || event.getSignature() == null) {
            log.debug("Dropping trade with invalid mint {} or missing signature", mint);
            return;
        }

        try {
            txCountManager.addTransaction(mint, event.getSignature(), event.getSolAmount());
            BigDecimal volumeSol = txCountManager.getVolumeSol(mint);

            bufferManager.bufferToken(BufferedTokenData.builder()
                    .mint(mint)
                    .lastTradeTs(event.getTimestamp())
                    .txCount24h(txCountManager.getCount(mint))
                    .volume24hSol(volumeSol.signum() > 0 ? volumeSol : null)
                    .bondingCurveProgress(support.bondingCurveProgress(event.getVSolInBondingCurve()))
                    .marketCapUsd(support.toUsd(event.getMarketCapSol()))
                    .priceUsd(support.toUsd(priceInSol(event)))
                    .build());

            support.cache(mint);
        } catch (RuntimeException e) {
            log.error("Error handling trade {} for {}", event.getSignature(), MintValidator.abbreviate(mint), e);
        }
    }

    private static BigDecimal priceInSol(SwapEvent event) {
        BigDecimal vSol = event.getVSolInBondingCurve();
        BigDecimal vTokens = event.getVTokensInBondingCurve();
        if (vSol == null || vTokens == null || vTokens.signum() <= 0) {
            return null;
        }
        return vSol.divide(vTokens, 18, RoundingMode.HALF_UP);
    }
}
