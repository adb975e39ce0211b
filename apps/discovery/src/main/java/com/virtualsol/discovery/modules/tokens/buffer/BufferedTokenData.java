package com.virtualsol.discovery.modules.tokens.buffer;

import com.virtualsol.discovery.entity.TokenDiscovery;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Partial token update staged in the fast store. Null fields are not staged and never
 * overwrite durable values.
 *
 * <p>Lifecycle state is deliberately absent: state only changes through
 * {@code TokenStateManager.updateState}.
 */
@Value
@Builder(toBuilder = true)
public class BufferedTokenData {

    static final String MINT = "mint";
    static final String BUFFERED_AT = "bufferedAt";

    String mint;
    String symbol;
    String name;
    String logoUri;
    String imageUrl;
    String description;
    String twitter;
    String telegram;
    String website;
    String creatorWallet;
    String bondingCurveKey;
    Integer decimals;
    String totalSupply;
    Integer holderCount;
    Integer txCount24h;
    BigDecimal bondingCurveProgress;
    BigDecimal liquidityUsd;
    BigDecimal marketCapUsd;
    BigDecimal priceUsd;
    BigDecimal priceImpact1Pct;
    BigDecimal volume24h;
    BigDecimal volume24hSol;
    BigDecimal hotScore;
    Integer watcherCount;
    Boolean freezeRevoked;
    Boolean mintRenounced;
    Boolean creatorVerified;
    String poolAddress;
    String poolType;
    Instant poolCreatedAt;
    Instant firstSeenAt;
    Instant lastTradeTs;

    /**
     * Hash representation; only non-null fields are included.
     */
    public Map<String, String> toHash() {
        Map<String, String> hash = new LinkedHashMap<>();
        hash.put(MINT, mint);
        put(hash, "symbol", symbol);
        put(hash, "name", name);
        put(hash, "logoURI", logoUri);
        put(hash, "imageUrl", imageUrl);
        put(hash, "description", description);
        put(hash, "twitter", twitter);
        put(hash, "telegram", telegram);
        put(hash, "website", website);
        put(hash, "creatorWallet", creatorWallet);
        put(hash, "bondingCurveKey", bondingCurveKey);
        put(hash, "decimals", decimals);
        put(hash, "totalSupply", totalSupply);
        put(hash, "holderCount", holderCount);
        put(hash, "txCount24h", txCount24h);
        put(hash, "bondingCurveProgress", bondingCurveProgress);
        put(hash, "liquidityUsd", liquidityUsd);
        put(hash, "marketCapUsd", marketCapUsd);
        put(hash, "priceUsd", priceUsd);
        put(hash, "priceImpact1Pct", priceImpact1Pct);
        put(hash, "volume24h", volume24h);
        put(hash, "volume24hSol", volume24hSol);
        put(hash, "hotScore", hotScore);
        put(hash, "watcherCount", watcherCount);
        put(hash, "freezeRevoked", freezeRevoked);
        put(hash, "mintRenounced", mintRenounced);
        put(hash, "creatorVerified", creatorVerified);
        put(hash, "poolAddress", poolAddress);
        put(hash, "poolType", poolType);
        put(hash, "poolCreatedAt", poolCreatedAt);
        put(hash, "firstSeenAt", firstSeenAt);
        put(hash, "lastTradeTs", lastTradeTs);
        return hash;
    }

    /**
     * Parses a staged hash. Unknown keys (such as {@code bufferedAt}) are ignored.
     *
     * @throws IllegalArgumentException if the hash has no mint or a field does not parse
     */
    public static BufferedTokenData fromHash(Map<?, ?> raw) {
        Map<String, String> hash = new LinkedHashMap<>();
        raw.forEach((k, v) -> hash.put(String.valueOf(k), v == null ? null : String.valueOf(v)));

        String mint = hash.get(MINT);
        if (mint == null || mint.isBlank()) {
            throw new IllegalArgumentException("Staged hash has no mint");
        }
        try {
            return BufferedTokenData.builder()
                    .mint(mint)
                    .symbol(hash.get("symbol"))
                    .name(hash.get("name"))
                    .logoUri(hash.get("logoURI"))
                    .imageUrl(hash.get("imageUrl"))
                    .description(hash.get("description"))
                    .twitter(hash.get("twitter"))
                    .telegram(hash.get("telegram"))
                    .website(hash.get("website"))
                    .creatorWallet(hash.get("creatorWallet"))
                    .bondingCurveKey(hash.get("bondingCurveKey"))
                    .decimals(parse(hash, "decimals", Integer::valueOf))
                    .totalSupply(hash.get("totalSupply"))
                    .holderCount(parse(hash, "holderCount", Integer::valueOf))
                    .txCount24h(parse(hash, "txCount24h", Integer::valueOf))
                    .bondingCurveProgress(parse(hash, "bondingCurveProgress", BigDecimal::new))
                    .liquidityUsd(parse(hash, "liquidityUsd", BigDecimal::new))
                    .marketCapUsd(parse(hash, "marketCapUsd", BigDecimal::new))
                    .priceUsd(parse(hash, "priceUsd", BigDecimal::new))
                    .priceImpact1Pct(parse(hash, "priceImpact1Pct", BigDecimal::new))
                    .volume24h(parse(hash, "volume24h", BigDecimal::new))
                    .volume24hSol(parse(hash, "volume24hSol", BigDecimal::new))
                    .hotScore(parse(hash, "hotScore", BigDecimal::new))
                    .watcherCount(parse(hash, "watcherCount", Integer::valueOf))
                    .freezeRevoked(parse(hash, "freezeRevoked", Boolean::valueOf))
                    .mintRenounced(parse(hash, "mintRenounced", Boolean::valueOf))
                    .creatorVerified(parse(hash, "creatorVerified", Boolean::valueOf))
                    .poolAddress(hash.get("poolAddress"))
                    .poolType(hash.get("poolType"))
                    .poolCreatedAt(parse(hash, "poolCreatedAt", Instant::parse))
                    .firstSeenAt(parse(hash, "firstSeenAt", Instant::parse))
                    .lastTradeTs(parse(hash, "lastTradeTs", Instant::parse))
                    .build();
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Malformed staged hash for " + mint + ": " + e.getMessage(), e);
        }
    }

    /**
     * Copies every non-null field onto the entity. A new entity keeps its own defaults for
     * the rest; an existing one keeps its current values.
     */
    public void applyTo(TokenDiscovery token) {
        set(symbol, token::setSymbol);
        set(name, token::setName);
        set(logoUri, token::setLogoUri);
        set(imageUrl, token::setImageUrl);
        set(description, token::setDescription);
        set(twitter, token::setTwitter);
        set(telegram, token::setTelegram);
        set(website, token::setWebsite);
        set(creatorWallet, token::setCreatorWallet);
        set(bondingCurveKey, token::setBondingCurveKey);
        set(decimals, token::setDecimals);
        set(totalSupply, token::setTotalSupply);
        set(holderCount, token::setHolderCount);
        set(txCount24h, token::setTxCount24h);
        set(bondingCurveProgress, token::setBondingCurveProgress);
        set(liquidityUsd, token::setLiquidityUsd);
        set(marketCapUsd, token::setMarketCapUsd);
        set(priceUsd, token::setPriceUsd);
        set(priceImpact1Pct, token::setPriceImpact1Pct);
        set(volume24h, token::setVolume24h);
        set(volume24hSol, token::setVolume24hSol);
        set(hotScore, token::setHotScore);
        set(watcherCount, token::setWatcherCount);
        set(freezeRevoked, token::setFreezeRevoked);
        set(mintRenounced, token::setMintRenounced);
        set(creatorVerified, token::setCreatorVerified);
        set(poolAddress, token::setPoolAddress);
        set(poolType, token::setPoolType);
        set(poolCreatedAt, token::setPoolCreatedAt);
        set(lastTradeTs, token::setLastTradeTs);
        if (token.getFirstSeenAt() == null) {
            set(firstSeenAt, token::setFirstSeenAt);
        }
    }

    private static void put(Map<String, String> hash, String key, Object value) {
        if (value == null) {
            return;
        }
        hash.put(key, value instanceof BigDecimal ? ((BigDecimal) value).toPlainString() : value.toString());
    }

    private static <T> T parse(Map<String, String> hash, String key, Function<String, T> parser) {
        String value = hash.get(key);
        if (value == null || value.isEmpty()) {
            return null;
        }
        return parser.apply(value);
    }

    private static <T> void set(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
