package com.virtualsol.discovery.modules.tokens.buffer;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.support.InMemoryRedis;
import com.virtualsol.discovery.support.RecordingTransactionManager;
import com.virtualsol.discovery.support.TestMints;
import com.virtualsol.discovery.util.RedisKeys;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TokenBufferManagerTest {

    private final Map<String, TokenDiscovery> db = new HashMap<>();

    private InMemoryRedis redis;
    private TokenDiscoveryRepository repository;
    private DiscoveryProperties properties;
    private RecordingTransactionManager transactionManager;
    private TokenBufferManager bufferManager;

    @BeforeEach
    void setUp() {
        redis = new InMemoryRedis();
        repository = mock(TokenDiscoveryRepository.class);
        when(repository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(db.get(inv.<String>getArgument(0))));
        when(repository.saveAndFlush(any(TokenDiscovery.class))).thenAnswer(inv -> {
            TokenDiscovery token = inv.getArgument(0);
            db.put(token.getMint(), token);
            return token;
        });

        properties = new DiscoveryProperties();
        properties.getBuffer().setChunkPause(Duration.ZERO);
        transactionManager = new RecordingTransactionManager();
        bufferManager = newManager();
    }

    @Test
    void stagedFieldsReachTheDatabase() {
        bufferManager.bufferToken(BufferedTokenData.builder().mint(TestMints.TOKEN_A).symbol("X").build());

        assertEquals(1, bufferManager.getBufferSize());
        assertEquals(1, bufferManager.syncBufferedTokens());

        assertEquals("X", db.get(TestMints.TOKEN_A).getSymbol());
        assertFalse(redis.members(RedisKeys.BUFFER_PENDING).contains(TestMints.TOKEN_A));
        assertTrue(redis.hash(RedisKeys.buffer(TestMints.TOKEN_A)).isEmpty());
        assertEquals(1, transactionManager.getCommits());
    }

    @Test
    void secondSyncWithNothingNewWritesNothing() {
        bufferManager.bufferToken(BufferedTokenData.builder().mint(TestMints.TOKEN_A).symbol("X").build());

        assertEquals(1, bufferManager.syncBufferedTokens());
        assertEquals(0, bufferManager.syncBufferedTokens());
    }

    @Test
    void repeatedStagingMergesFields() {
        bufferManager.bufferToken(BufferedTokenData.builder().mint(TestMints.TOKEN_A).symbol("X").build());
        bufferManager.bufferToken(BufferedTokenData.builder()
                .mint(TestMints.TOKEN_A)
                .marketCapUsd(new BigDecimal("1234.5"))
                .lastTradeTs(Instant.parse("2024-05-01T12:00:00Z"))
                .build());

        BufferedTokenData staged = bufferManager.getBuffered(TestMints.TOKEN_A).orElseThrow();
        assertEquals("X", staged.getSymbol());
        assertEquals(new BigDecimal("1234.5"), staged.getMarketCapUsd());
        assertEquals(Instant.parse("2024-05-01T12:00:00Z"), staged.getLastTradeTs());
    }

    @Test
    void syncKeepsExistingValuesForUnstagedFields() {
        TokenDiscovery existing = new TokenDiscovery();
        existing.setMint(TestMints.TOKEN_A);
        existing.setName("Frog");
        existing.setSymbol("OLD");
        db.put(TestMints.TOKEN_A, existing);

        bufferManager.bufferToken(BufferedTokenData.builder().mint(TestMints.TOKEN_A).symbol("NEW").build());
        bufferManager.syncBufferedTokens();

        assertEquals("NEW", db.get(TestMints.TOKEN_A).getSymbol());
        assertEquals("Frog", db.get(TestMints.TOKEN_A).getName());
    }

    @Test
    void failedWriteDoesNotHoldBackTheRestOfItsChunk() {
        doAnswer(inv -> {
            TokenDiscovery token = inv.getArgument(0);
            if (TestMints.TOKEN_B.equals(token.getMint())) {
                throw new DataIntegrityViolationException("value too long for type character varying(255)");
            }
            db.put(token.getMint(), token);
            return token;
        }).when(repository).saveAndFlush(any(TokenDiscovery.class));

        bufferManager.bufferToken(BufferedTokenData.builder().mint(TestMints.TOKEN_A).symbol("A").build());
        bufferManager.bufferToken(BufferedTokenData.builder().mint(TestMints.TOKEN_B).symbol("B").build());
        bufferManager.bufferToken(BufferedTokenData.builder().mint(TestMints.TOKEN_C).symbol("C").build());

        assertEquals(2, bufferManager.syncBufferedTokens());

        assertEquals(Set.of(TestMints.TOKEN_B), redis.members(RedisKeys.BUFFER_PENDING));
        assertEquals("B", redis.hash(RedisKeys.buffer(TestMints.TOKEN_B)).get("symbol"));
        assertTrue(redis.hash(RedisKeys.buffer(TestMints.TOKEN_A)).isEmpty());
        assertTrue(redis.hash(RedisKeys.buffer(TestMints.TOKEN_C)).isEmpty());
        // chunk rolled back, then one new transaction per token
        assertEquals(3, transactionManager.getRequiresNew());
        assertEquals(2, transactionManager.getCommits());
    }

    @Test
    void commitFailureReplaysTokensOneByOne() {
        transactionManager.failNextCommits(1);
        bufferManager.bufferToken(BufferedTokenData.builder().mint(TestMints.TOKEN_A).symbol("A").build());
        bufferManager.bufferToken(BufferedTokenData.builder().mint(TestMints.TOKEN_B).symbol("B").build());

        assertEquals(2, bufferManager.syncBufferedTokens());

        assertTrue(redis.members(RedisKeys.BUFFER_PENDING).isEmpty());
        assertEquals(2, transactionManager.getRequiresNew());
    }

    @Test
    void nothingIsClearedWhenEveryTransactionFails() {
        transactionManager.failNextCommits(3);
        bufferManager.bufferToken(BufferedTokenData.builder().mint(TestMints.TOKEN_A).symbol("A").build());
        bufferManager.bufferToken(BufferedTokenData.builder().mint(TestMints.TOKEN_B).symbol("B").build());

        assertEquals(0, bufferManager.syncBufferedTokens());

        assertEquals(Set.of(TestMints.TOKEN_A, TestMints.TOKEN_B), redis.members(RedisKeys.BUFFER_PENDING));
        assertEquals(0, transactionManager.getCommits());
    }

    @Test
    void expiredStagingIsDroppedFromPending() {
        redis.template().opsForSet().add(RedisKeys.BUFFER_PENDING, TestMints.TOKEN_C);

        assertEquals(0, bufferManager.syncBufferedTokens());
        assertTrue(redis.members(RedisKeys.BUFFER_PENDING).isEmpty());
    }

    @Test
    void flushesInChunks() {
        properties.getBuffer().setChunkSize(1);
        bufferManager = newManager();
        for (String mint : List.of(TestMints.TOKEN_A, TestMints.TOKEN_B, TestMints.TOKEN_C)) {
            bufferManager.bufferToken(BufferedTokenData.builder().mint(mint).name("n").build());
        }

        assertEquals(3, bufferManager.syncBufferedTokens());
        assertEquals(3, db.size());
    }

    @Test
    void refusesInvalidMints() {
        bufferManager.bufferToken(BufferedTokenData.builder().mint("undefined").symbol("X").build());

        assertEquals(0, bufferManager.getBufferSize());
    }

    @Test
    void discardDropsStagedEntries() {
        bufferManager.bufferToken(BufferedTokenData.builder().mint(TestMints.TOKEN_A).symbol("X").build());

        bufferManager.discard(List.of(TestMints.TOKEN_A));

        assertEquals(0, bufferManager.getBufferSize());
        assertTrue(bufferManager.getBuffered(TestMints.TOKEN_A).isEmpty());
        assertNull(db.get(TestMints.TOKEN_A));
    }

    private TokenBufferManager newManager() {
        return new TokenBufferManager(redis.template(), repository, transactionManager,
                OpenTelemetry.noop().getTracer("test"), properties);
    }
}
