package com.virtualsol.discovery.modules.tokens.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.tokens.buffer.BufferedTokenData;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.support.InMemoryRedis;
import com.virtualsol.discovery.support.RecordingTransactionManager;
import com.virtualsol.discovery.support.TestMints;
import com.virtualsol.discovery.util.RedisKeys;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TokenCacheManagerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private InMemoryRedis redis;
    private TokenDiscoveryRepository repository;
    private TokenBufferManager bufferManager;
    private TokenCacheManager cacheManager;

    @BeforeEach
    void setUp() {
        redis = new InMemoryRedis();
        repository = mock(TokenDiscoveryRepository.class);
        DiscoveryProperties properties = new DiscoveryProperties();
        bufferManager = new TokenBufferManager(redis.template(), repository, new RecordingTransactionManager(),
                OpenTelemetry.noop().getTracer("test"), properties);
        cacheManager = new TokenCacheManager(redis.template(), repository, bufferManager, objectMapper, properties);
    }

    @Test
    void cachesStoredRowWithStagedFieldsOnTop() throws Exception {
        TokenDiscovery token = token(TestMints.TOKEN_A, TokenState.BONDED, "42");
        token.setSymbol("OLD");
        token.setLogoUri("https://img/frog.png");
        when(repository.findById(TestMints.TOKEN_A)).thenReturn(Optional.of(token));
        bufferManager.bufferToken(BufferedTokenData.builder().mint(TestMints.TOKEN_A).symbol("NEW").build());

        CachedTokenRow row = cacheManager.cacheTokenRow(TestMints.TOKEN_A).orElseThrow();

        assertEquals("NEW", row.getSymbol());
        JsonNode json = objectMapper.readTree(redis.value(RedisKeys.token(TestMints.TOKEN_A)));
        assertEquals("NEW", json.get("symbol").asText());
        assertEquals("bonded", json.get("state").asText());
        assertEquals("https://img/frog.png", json.get("logoURI").asText());
        assertEquals(42.0, redis.zset(RedisKeys.ranked(TokenState.BONDED)).get(TestMints.TOKEN_A));
    }

    @Test
    void movesTokenBetweenRankedSets() {
        redis.template().opsForZSet().add(RedisKeys.ranked(TokenState.LAUNCHING), TestMints.TOKEN_A, 100);
        when(repository.findById(TestMints.TOKEN_A)).thenReturn(Optional.of(token(TestMints.TOKEN_A, TokenState.ACTIVE, "60")));

        cacheManager.cacheTokenRow(TestMints.TOKEN_A);

        assertFalse(redis.zset(RedisKeys.ranked(TokenState.LAUNCHING)).containsKey(TestMints.TOKEN_A));
        assertTrue(redis.zset(RedisKeys.ranked(TokenState.ACTIVE)).containsKey(TestMints.TOKEN_A));
    }

    @Test
    void unknownTokenIsNotCached() {
        when(repository.findById(TestMints.TOKEN_B)).thenReturn(Optional.empty());

        assertTrue(cacheManager.cacheTokenRow(TestMints.TOKEN_B).isEmpty());
        assertNull(redis.value(RedisKeys.token(TestMints.TOKEN_B)));
    }

    @Test
    void invalidateAndRemoveFromIndexes() {
        when(repository.findById(TestMints.TOKEN_A)).thenReturn(Optional.of(token(TestMints.TOKEN_A, TokenState.DEAD, "1")));
        cacheManager.cacheTokenRow(TestMints.TOKEN_A);

        cacheManager.invalidateCache(TestMints.TOKEN_A);
        assertNull(redis.value(RedisKeys.token(TestMints.TOKEN_A)));
        assertTrue(redis.zset(RedisKeys.ranked(TokenState.DEAD)).containsKey(TestMints.TOKEN_A));

        cacheManager.removeFromIndexes(List.of(TestMints.TOKEN_A));
        assertTrue(redis.zset(RedisKeys.ranked(TokenState.DEAD)).isEmpty());
    }

    private static TokenDiscovery token(String mint, TokenState state, String hotScore) {
        TokenDiscovery token = new TokenDiscovery();
        token.setMint(mint);
        token.setState(state);
        token.setHotScore(new BigDecimal(hotScore));
        return token;
    }
}
