package com.virtualsol.discovery.modules.tokens.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.tokens.buffer.BufferedTokenData;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.util.MintValidator;
import com.virtualsol.discovery.util.RedisKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-side cache: one JSON row per token plus a hot-score ranked set per state.
 *
 * <p>Rows are built from the database record with any staged buffer fields laid on top,
 * so the cache may be ahead of the database but never behind the buffer.
 */
@Slf4j
@Component
public class TokenCacheManager {

    private final StringRedisTemplate redisTemplate;
    private final TokenDiscoveryRepository tokenRepository;
    private final TokenBufferManager bufferManager;
    private final ObjectMapper objectMapper;
    private final Duration tokenTtl;

    public TokenCacheManager(StringRedisTemplate redisTemplate,
                             TokenDiscoveryRepository tokenRepository,
                             TokenBufferManager bufferManager,
                             ObjectMapper objectMapper,
                             DiscoveryProperties properties) {
        this.redisTemplate = redisTemplate;
        this.tokenRepository = tokenRepository;
        this.bufferManager = bufferManager;
        this.objectMapper = objectMapper;
        this.tokenTtl = properties.getCache().getTokenTtl();
    }

    /**
     * Writes {@code token:<mint>} and moves the mint into the ranked set of its current state.
     *
     * @return the cached row, or empty when the token is unknown or the write failed
     */
    public Optional<CachedTokenRow> cacheTokenRow(String mint) {
        try {
            Optional<TokenDiscovery> stored = tokenRepository.findById(mint);
            Optional<BufferedTokenData> staged = bufferManager.getBuffered(mint);
            if (stored.isEmpty() && staged.isEmpty()) {
                log.debug("Nothing to cache for {}", MintValidator.abbreviate(mint));
                return Optional.empty();
            }

            TokenDiscovery token = stored.orElseGet(() -> {
                TokenDiscovery pending = new TokenDiscovery();
                pending.setMint(mint);
                return pending;
            });
            staged.ifPresent(s -> s.applyTo(token));

            CachedTokenRow row = CachedTokenRow.from(token);
            write(row, token.getState(), token.getHotScore());
            return Optional.of(row);
        } catch (DataAccessException | JsonProcessingException e) {
            log.error("Failed to cache token {}", MintValidator.abbreviate(mint), e);
            return Optional.empty();
        }
    }

    public void invalidateCache(String mint) {
        try {
            redisTemplate.delete(RedisKeys.token(mint));
        } catch (DataAccessException e) {
            log.warn("Failed to invalidate cache for {}: {}", MintValidator.abbreviate(mint), e.getMessage());
        }
    }

    /**
     * Drops rows and ranked-set membership for tokens deleted from the database.
     */
    public void removeFromIndexes(Collection<String> mints) {
        if (mints.isEmpty()) {
            return;
        }
        List<String> rowKeys = new ArrayList<>(mints.size());
        mints.forEach(m -> rowKeys.add(RedisKeys.token(m)));
        Object[] members = mints.toArray();
        try {
            redisTemplate.executePipelined(new SessionCallback<Object>() {
                @Override
                public <K, V> Object execute(RedisOperations<K, V> operations) {
                    // operations is this template with the pipelined connection bound
                    redisTemplate.delete(rowKeys);
                    for (TokenState state : TokenState.values()) {
                        redisTemplate.opsForZSet().remove(RedisKeys.ranked(state), members);
                    }
                    return null;
                }
            });
        } catch (DataAccessException e) {
            log.warn("Failed to remove {} tokens from cache indexes: {}", mints.size(), e.getMessage());
        }
    }

    private void write(CachedTokenRow row, TokenState state, BigDecimal hotScore) throws JsonProcessingException {
        String json = objectMapper.writeValueAsString(row);
        String mint = row.getMint();
        TokenState current = state == null ? TokenState.LAUNCHING : state;
        double score = hotScore == null ? 0 : hotScore.doubleValue();

        redisTemplate.executePipelined(new SessionCallback<Object>() {
            @Override
            public <K, V> Object execute(RedisOperations<K, V> operations) {
                redisTemplate.opsForValue().set(RedisKeys.token(mint), json, tokenTtl);
                redisTemplate.opsForZSet().add(RedisKeys.ranked(current), mint, score);
                for (TokenState other : TokenState.values()) {
                    if (other != current) {
                        redisTemplate.opsForZSet().remove(RedisKeys.ranked(other), mint);
                    }
                }
                return null;
            }
        });
        log.debug("Cached {} in {} (score {})", MintValidator.abbreviate(mint), current.getValue(), score);
    }
}
