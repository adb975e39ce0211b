package com.virtualsol.discovery.entity;

import com.virtualsol.discovery.modules.tokens.state.TokenState;
import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row per discovered token, keyed by mint.
 */
@Data
@Entity
@Table(name = "token_discovery", indexes = {
        @Index(name = "idx_token_discovery_state_hot", columnList = "state, hot_score"),
        @Index(name = "idx_token_discovery_last_updated", columnList = "last_updated_at")
})
public class TokenDiscovery {

    @Id
    @Column(nullable = false, updatable = false, length = 64)
    private String mint;

    private String symbol;

    private String name;

    @Column(name = "logo_uri", columnDefinition = "TEXT")
    private String logoUri;

    @Column(name = "image_url", columnDefinition = "TEXT")
    private String imageUrl;

    @Column(columnDefinition = "TEXT")
    private String description;

    private String twitter;

    private String telegram;

    private String website;

    @Column(name = "creator_wallet")
    private String creatorWallet;

    @Column(name = "bonding_curve_key")
    private String bondingCurveKey;

    private Integer decimals;

    @Column(name = "total_supply")
    private String totalSupply;

    // Lifecycle
    @Column(nullable = false, length = 32)
    private TokenState state = TokenState.LAUNCHING;

    @Column(name = "previous_state", length = 32)
    private TokenState previousState;

    @Column(name = "state_changed_at", nullable = false)
    private Instant stateChangedAt;

    @Column(name = "first_seen_at", nullable = false, updatable = false)
    private Instant firstSeenAt;

    @Column(name = "last_trade_ts")
    private Instant lastTradeTs;

    @Column(name = "last_updated_at", nullable = false)
    private Instant lastUpdatedAt;

    @Column(name = "bonding_curve_progress", precision = 10, scale = 4, nullable = false)
    private BigDecimal bondingCurveProgress = BigDecimal.ZERO;

    // Pool (set once liquidity exists)
    @Column(name = "pool_address")
    private String poolAddress;

    @Column(name = "pool_type")
    private String poolType;

    @Column(name = "pool_created_at")
    private Instant poolCreatedAt;

    // Market snapshot
    @Column(name = "liquidity_usd", precision = 30, scale = 8)
    private BigDecimal liquidityUsd;

    @Column(name = "market_cap_usd", precision = 30, scale = 8)
    private BigDecimal marketCapUsd;

    @Column(name = "price_usd", precision = 38, scale = 18)
    private BigDecimal priceUsd;

    @Column(name = "price_impact_1pct", precision = 10, scale = 4)
    private BigDecimal priceImpact1Pct;

    @Column(name = "volume_24h", precision = 30, scale = 8)
    private BigDecimal volume24h;

    @Column(name = "volume_24h_sol", precision = 30, scale = 8)
    private BigDecimal volume24hSol;

    @Column(name = "holder_count")
    private Integer holderCount;

    @Column(name = "tx_count_24h")
    private Integer txCount24h;

    // Ranking
    @Column(name = "hot_score", precision = 10, scale = 2, nullable = false)
    private BigDecimal hotScore = BigDecimal.valueOf(100);

    @Column(name = "watcher_count", nullable = false)
    private Integer watcherCount = 0;

    // Security flags
    @Column(name = "freeze_revoked", nullable = false)
    private Boolean freezeRevoked = false;

    @Column(name = "mint_renounced", nullable = false)
    private Boolean mintRenounced = false;

    @Column(name = "creator_verified", nullable = false)
    private Boolean creatorVerified = false;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (firstSeenAt == null) {
            firstSeenAt = now;
        }
        if (stateChangedAt == null) {
            stateChangedAt = now;
        }
        lastUpdatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        lastUpdatedAt = Instant.now();
    }

    /**
     * A token with a pool has left its bonding curve.
     */
    public boolean isGraduated() {
        return poolAddress != null && !poolAddress.isBlank();
    }
}
