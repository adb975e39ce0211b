package com.virtualsol.discovery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Token discovery worker configuration.
 *
 * <p>Bound from {@code discovery.*} in {@code application.yaml}. Every value has a default so the
 * worker starts with an empty config section; environment variables override through the usual
 * relaxed binding ({@code DISCOVERY_STATE_THRESHOLDS_DEAD_TOKEN_HOURS=6}).
 */
@Component
@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {

    private Stream stream = new Stream();
    private Intervals intervals = new Intervals();
    private Cache cache = new Cache();
    private Buffer buffer = new Buffer();
    private Retention retention = new Retention();
    private KnownMints knownMints = new KnownMints();
    private Limits limits = new Limits();
    private StateThresholds stateThresholds = new StateThresholds();
    private Scoring scoring = new Scoring();
    private Validation validation = new Validation();
    private Notifications notifications = new Notifications();
    private Market market = new Market();

    public Stream getStream() {
        return stream;
    }

    public void setStream(Stream stream) {
        this.stream = stream;
    }

    public Intervals getIntervals() {
        return intervals;
    }

    public void setIntervals(Intervals intervals) {
        this.intervals = intervals;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Buffer getBuffer() {
        return buffer;
    }

    public void setBuffer(Buffer buffer) {
        this.buffer = buffer;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public KnownMints getKnownMints() {
        return knownMints;
    }

    public void setKnownMints(KnownMints knownMints) {
        this.knownMints = knownMints;
    }

    public Limits getLimits() {
        return limits;
    }

    public void setLimits(Limits limits) {
        this.limits = limits;
    }

    public StateThresholds getStateThresholds() {
        return stateThresholds;
    }

    public void setStateThresholds(StateThresholds stateThresholds) {
        this.stateThresholds = stateThresholds;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public void setNotifications(Notifications notifications) {
        this.notifications = notifications;
    }

    public Market getMarket() {
        return market;
    }

    public void setMarket(Market market) {
        this.market = market;
    }

    /**
     * Upstream PumpPortal socket.
     */
    @Data
    public static class Stream {
        private boolean enabled = true;
        private String url = "wss://pumpportal.fun/api/data";
        /**
         * Optional key appended as {@code ?api-key=} for PumpSwap data access.
         */
        private String apiKey;
        private Duration pingInterval = Duration.ofSeconds(30);
        private Duration pongTimeout = Duration.ofSeconds(10);
        private Duration initialReconnectDelay = Duration.ofSeconds(1);
        private Duration maxReconnectDelay = Duration.ofSeconds(60);
        private int maxReconnectAttempts = 10;

        public String resolveUrl() {
            if (apiKey == null || apiKey.isBlank()) {
                return url;
            }
            return url + (url.contains("?") ? "&" : "?") + "api-key=" + apiKey;
        }
    }

    @Data
    public static class Intervals {
        private Duration hotScoreUpdate = Duration.ofMinutes(15);
        private Duration watcherSync = Duration.ofMinutes(5);
        private Duration marketDataUpdate = Duration.ofMinutes(5);
        private Duration holderCountUpdate = Duration.ofMinutes(10);
        private Duration cleanup = Duration.ofHours(24);
        private Duration stateClassification = Duration.ofMinutes(5);
        private Duration redisToDbSync = Duration.ofMinutes(2);
        private Duration tokenSubscription = Duration.ofMinutes(5);
        private Duration healthCheck = Duration.ofSeconds(60);
    }

    @Data
    public static class Cache {
        /**
         * TTL of the {@code token:<mint>} row.
         */
        private Duration tokenTtl = Duration.ofHours(2);
    }

    @Data
    public static class Buffer {
        /**
         * Safety-net TTL of {@code token:buffer:<mint>}; the flush job normally deletes it first.
         */
        private Duration ttl = Duration.ofHours(1);
        private int chunkSize = 100;
        private Duration chunkPause = Duration.ofMillis(100);
    }

    @Data
    public static class Retention {
        private Duration launchingToken = Duration.ofHours(48);
        private Duration deadToken = Duration.ofHours(24);
        private Duration idleThreshold = Duration.ofMinutes(10);
    }

    @Data
    public static class KnownMints {
        private String sol = "So11111111111111111111111111111111111111112";
        private String usdc = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";
        private String usdt = "Es9vMFrzaCERmJfrF4H2FYD4KCoNkY11McCe8BenwNYB";

        public boolean isQuoteMint(String mint) {
            return sol.equals(mint) || usdc.equals(mint) || usdt.equals(mint);
        }
    }

    @Data
    public static class Limits {
        private BigDecimal minActiveVolumeSol = new BigDecimal("0.5");
        private int minHoldersCount = 10;
        private int maxActiveTokensSubscription = 500;
        /**
         * A token qualifies for trade subscription above this 24h USD volume,
         * above the market cap floor, or with a trade inside the window.
         */
        private BigDecimal subscriptionMinVolumeUsd = new BigDecimal("1000");
        private BigDecimal subscriptionMinMarketCapUsd = new BigDecimal("5000");
        private Duration subscriptionTradeWindow = Duration.ofHours(24);
        private int maxTokensPerBatch = 50;
        private int maxHolderCountBatch = 100;
        private int txCountMaxSize = 10_000;
        private Duration txCountMaxAge = Duration.ofHours(24);
    }

    /**
     * Lifecycle classification policy.
     */
    @Data
    public static class StateThresholds {
        private long deadTokenHours = 4;
        private BigDecimal minDeadVolumeSol = new BigDecimal("0.1");
        private long activeTokenHours = 2;
        private BigDecimal aboutToBondProgress = new BigDecimal("70");
        private long aboutToBondMinutes = 30;
        private BigDecimal graduatingMaxProgress = new BigDecimal("100");
    }

    @Data
    public static class Scoring {
        private BigDecimal bondingCurveTargetSol = new BigDecimal("85");
        private double liquidityScoreTargetUsd = 50_000;
        private double watcherScoreMultiplier = 10;
        private double maxWatcherScore = 100;
        private double recencyWeight = 0.5;
        private double liquidityWeight = 0.3;
        private double watcherWeight = 0.2;
        private double recencyWindowMinutes = 1440;
        private int initialHotScore = 100;
        private int directListingHotScore = 80;
        private BigDecimal pumpTotalSupply = new BigDecimal("1000000000");
    }

    @Data
    public static class Validation {
        private int minTimestampYear = 2020;
        private int maxTimestampYear = 2050;
        /**
         * Epoch values above this are read as milliseconds (year 2100 in seconds).
         */
        private long timestampEpochThreshold = 4_102_444_800L;
    }

    @Data
    public static class Notifications {
        private String queueKey = "notifications:outbound";
    }

    /**
     * Market data refresh and the per-token price fallback.
     */
    @Data
    public static class Market {
        /**
         * Tokens first seen, or bonded, within this window get their market data refreshed.
         */
        private Duration lookback = Duration.ofHours(72);
        /**
         * Pause between provider calls inside one refresh batch.
         */
        private Duration rateLimitDelay = Duration.ofMillis(500);
        private boolean jupiterEnabled = true;
        private String jupiterPriceUrl = "https://lite-api.jup.ag/price/v3";
        private Duration requestTimeout = Duration.ofSeconds(8);
    }
}
