package com.virtualsol.discovery.modules.tokens.state;

import com.virtualsol.discovery.entity.TokenDiscovery;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The fields lifecycle classification looks at.
 */
@Value
@Builder
public class TokenSnapshot {

    String mint;
    BigDecimal bondingCurveProgress;
    boolean graduated;
    Instant lastTradeTs;
    BigDecimal volume24hSol;
    Integer holderCount;

    public static TokenSnapshot of(TokenDiscovery token) {
        return TokenSnapshot.builder()
                .mint(token.getMint())
                .bondingCurveProgress(token.getBondingCurveProgress())
                .graduated(token.isGraduated())
                .lastTradeTs(token.getLastTradeTs())
                .volume24hSol(token.getVolume24hSol())
                .holderCount(token.getHolderCount())
                .build();
    }
}
