package com.virtualsol.discovery.modules.tokens.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.virtualsol.discovery.entity.TokenDiscovery;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Feed-facing projection stored at {@code token:<mint>}. Timestamps are epoch millis.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CachedTokenRow {

    private String mint;
    private String symbol;
    private String name;
    @JsonProperty("logoURI")
    private String logoUri;
    private String imageUrl;
    private String description;
    private String twitter;
    private String telegram;
    private String website;
    private String creatorWallet;

    private String state;
    private String previousState;
    private BigDecimal bondingCurveProgress;
    private String poolAddress;
    private String poolType;

    private BigDecimal liquidityUsd;
    private BigDecimal marketCapUsd;
    private BigDecimal priceUsd;
    private BigDecimal priceImpact1Pct;
    private BigDecimal volume24h;
    private BigDecimal volume24hSol;
    private Integer holderCount;
    private Integer txCount24h;

    private BigDecimal hotScore;
    private Integer watcherCount;

    private Boolean freezeRevoked;
    private Boolean mintRenounced;
    private Boolean creatorVerified;

    private Long firstSeenAt;
    private Long lastTradeTs;
    private Long stateChangedAt;
    private Long lastUpdatedAt;

    public static CachedTokenRow from(TokenDiscovery token) {
        CachedTokenRow row = new CachedTokenRow();
        row.setMint(token.getMint());
        row.setSymbol(token.getSymbol());
        row.setName(token.getName());
        row.setLogoUri(token.getLogoUri());
        row.setImageUrl(token.getImageUrl());
        row.setDescription(token.getDescription());
        row.setTwitter(token.getTwitter());
        row.setTelegram(token.getTelegram());
        row.setWebsite(token.getWebsite());
        row.setCreatorWallet(token.getCreatorWallet());
        row.setState(token.getState() == null ? null : token.getState().getValue());
        row.setPreviousState(token.getPreviousState() == null ? null : token.getPreviousState().getValue());
        row.setBondingCurveProgress(token.getBondingCurveProgress());
        row.setPoolAddress(token.getPoolAddress());
        row.setPoolType(token.getPoolType());
        row.setLiquidityUsd(token.getLiquidityUsd());
        row.setMarketCapUsd(token.getMarketCapUsd());
        row.setPriceUsd(token.getPriceUsd());
        row.setPriceImpact1Pct(token.getPriceImpact1Pct());
        row.setVolume24h(token.getVolume24h());
        row.setVolume24hSol(token.getVolume24hSol());
        row.setHolderCount(token.getHolderCount());
        row.setTxCount24h(token.getTxCount24h());
        row.setHotScore(token.getHotScore());
        row.setWatcherCount(token.getWatcherCount());
        row.setFreezeRevoked(token.getFreezeRevoked());
        row.setMintRenounced(token.getMintRenounced());
        row.setCreatorVerified(token.getCreatorVerified());
        row.setFirstSeenAt(millis(token.getFirstSeenAt()));
        row.setLastTradeTs(millis(token.getLastTradeTs()));
        row.setStateChangedAt(millis(token.getStateChangedAt()));
        row.setLastUpdatedAt(millis(token.getLastUpdatedAt()));
        return row;
    }

    private static Long millis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }
}
