package com.virtualsol.discovery.modules.tokens.buffer;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.util.MintValidator;
import com.virtualsol.discovery.util.RedisKeys;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Write-behind buffer between event handlers and the token table.
 *
 * <p>Handlers stage partial updates in {@code token:buffer:<mint>} and mark the mint in
 * {@code token:buffer:pending}. {@link #syncBufferedTokens()} applies them in chunks, one
 * transaction per chunk. A chunk that fails to commit is replayed one token per transaction.
 * A staged entry is only cleared after the transaction holding its write has committed.
 */
@Slf4j
@Component
public class TokenBufferManager {

    private final StringRedisTemplate redisTemplate;
    private final TokenDiscoveryRepository tokenRepository;
    private final TransactionTemplate chunkTransaction;
    private final TransactionTemplate tokenTransaction;
    private final Tracer tracer;
    private final Duration bufferTtl;
    private final int chunkSize;
    private final Duration chunkPause;

    public TokenBufferManager(StringRedisTemplate redisTemplate,
                              TokenDiscoveryRepository tokenRepository,
                              PlatformTransactionManager transactionManager,
                              Tracer tracer,
                              DiscoveryProperties properties) {
        this.redisTemplate = redisTemplate;
        this.tokenRepository = tokenRepository;
        this.chunkTransaction = new TransactionTemplate(transactionManager);
        this.tokenTransaction = new TransactionTemplate(transactionManager);
        this.tokenTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.tracer = tracer;
        this.bufferTtl = properties.getBuffer().getTtl();
        this.chunkSize = Math.max(1, properties.getBuffer().getChunkSize());
        this.chunkPause = properties.getBuffer().getChunkPause();
    }

    /**
     * Stages the non-null fields of {@code data}. Repeated calls for one mint merge field by field.
     */
    public void bufferToken(BufferedTokenData data) {
        String mint = data.getMint();
        if (!MintValidator.isValid(mint)) {
            log.debug("Refusing to buffer invalid mint {}", mint);
            return;
        }
        String bufferKey = RedisKeys.buffer(mint);
        Map<String, String> hash = data.toHash();
        hash.put(BufferedTokenData.BUFFERED_AT, String.valueOf(System.currentTimeMillis()));

        try {
            redisTemplate.executePipelined(new SessionCallback<Object>() {
                @Override
                public <K, V> Object execute(RedisOperations<K, V> operations) {
                    // operations is this template with the pipelined connection bound
                    redisTemplate.opsForHash().putAll(bufferKey, hash);
                    redisTemplate.opsForSet().add(RedisKeys.BUFFER_PENDING, mint);
                    redisTemplate.expire(bufferKey, bufferTtl);
                    return null;
                }
            });
            log.debug("Buffered {} fields for {}", hash.size(), MintValidator.abbreviate(mint));
        } catch (DataAccessException e) {
            log.error("Failed to buffer token {}", MintValidator.abbreviate(mint), e);
        }
    }

    /**
     * Staged fields for a mint that have not reached the database yet.
     */
    public Optional<BufferedTokenData> getBuffered(String mint) {
        try {
            Map<Object, Object> hash = redisTemplate.opsForHash().entries(RedisKeys.buffer(mint));
            if (hash == null || hash.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(BufferedTokenData.fromHash(hash));
        } catch (DataAccessException | IllegalArgumentException e) {
            log.warn("Unable to read staged fields for {}: {}", MintValidator.abbreviate(mint), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Flushes every pending mint to the database.
     *
     * @return number of tokens written and cleared from the buffer
     */
    public int syncBufferedTokens() {
        Span span = tracer.spanBuilder("TokenBufferManager.syncBufferedTokens").startSpan();
        try {
            Set<String> pending = redisTemplate.opsForSet().members(RedisKeys.BUFFER_PENDING);
            if (pending == null || pending.isEmpty()) {
                log.debug("No buffered tokens to sync");
                return 0;
            }

            List<String> mints = new ArrayList<>(pending);
            log.info("Syncing {} buffered tokens to database", mints.size());

            int synced = 0;
            for (int i = 0; i < mints.size(); i += chunkSize) {
                List<String> chunk = mints.subList(i, Math.min(i + chunkSize, mints.size()));
                synced += syncChunk(chunk);

                if (i + chunkSize < mints.size() && !pauseBetweenChunks()) {
                    log.warn("Buffer sync interrupted after {} tokens", synced);
                    break;
                }
            }

            span.setAttribute("synced", synced);
            log.info("Completed buffered token sync: {}/{}", synced, mints.size());
            return synced;
        } catch (DataAccessException e) {
            span.recordException(e);
            log.error("Error syncing buffered tokens", e);
            return 0;
        } finally {
            span.end();
        }
    }

    /**
     * Drops staged writes for tokens that no longer exist, so a later flush does not recreate them.
     */
    public void discard(Collection<String> mints) {
        if (mints.isEmpty()) {
            return;
        }
        try {
            redisTemplate.opsForSet().remove(RedisKeys.BUFFER_PENDING, mints.toArray());
            List<String> keys = new ArrayList<>(mints.size());
            mints.forEach(m -> keys.add(RedisKeys.buffer(m)));
            redisTemplate.delete(keys);
        } catch (DataAccessException e) {
            log.warn("Failed to discard {} staged entries: {}", mints.size(), e.getMessage());
        }
    }

    public long getBufferSize() {
        try {
            Long size = redisTemplate.opsForSet().size(RedisKeys.BUFFER_PENDING);
            return size == null ? 0 : size;
        } catch (DataAccessException e) {
            log.error("Failed to get buffer size", e);
            return 0;
        }
    }

    private int syncChunk(List<String> chunk) {
        Map<String, BufferedTokenData> staged = loadStaged(chunk);
        if (staged.isEmpty()) {
            return 0;
        }
        try {
            chunkTransaction.executeWithoutResult(status -> staged.values().forEach(this::upsert));
        } catch (TransactionException | DataAccessException e) {
            log.warn("Chunk of {} buffered tokens rolled back ({}), retrying one by one",
                    staged.size(), e.getMessage());
            return syncIndividually(staged);
        }
        List<String> written = new ArrayList<>(staged.keySet());
        acknowledge(written);
        return written.size();
    }

    /**
     * Each token in its own transaction, so one bad row cannot hold back the rest of its chunk.
     */
    private int syncIndividually(Map<String, BufferedTokenData> staged) {
        List<String> written = new ArrayList<>(staged.size());
        staged.forEach((mint, data) -> {
            try {
                tokenTransaction.executeWithoutResult(status -> upsert(data));
                written.add(mint);
            } catch (TransactionException | DataAccessException e) {
                log.error("Failed to upsert buffered token {}", MintValidator.abbreviate(mint), e);
            }
        });
        if (!written.isEmpty()) {
            acknowledge(written);
        }
        return written.size();
    }

    private Map<String, BufferedTokenData> loadStaged(List<String> chunk) {
        Map<String, BufferedTokenData> staged = new LinkedHashMap<>();
        for (String mint : chunk) {
            Map<Object, Object> hash = redisTemplate.opsForHash().entries(RedisKeys.buffer(mint));
            if (hash == null || hash.isEmpty()) {
                // staged hash expired before a flush reached it
                log.warn("No buffer data found for {}", MintValidator.abbreviate(mint));
                redisTemplate.opsForSet().remove(RedisKeys.BUFFER_PENDING, mint);
                continue;
            }
            try {
                staged.put(mint, BufferedTokenData.fromHash(hash));
            } catch (IllegalArgumentException e) {
                log.error("Skipping malformed buffer entry for {}: {}", MintValidator.abbreviate(mint), e.getMessage());
            }
        }
        return staged;
    }

    private void upsert(BufferedTokenData data) {
        TokenDiscovery token = tokenRepository.findById(data.getMint()).orElseGet(() -> {
            TokenDiscovery created = new TokenDiscovery();
            created.setMint(data.getMint());
            return created;
        });
        data.applyTo(token);
        token.setLastUpdatedAt(Instant.now());
        tokenRepository.saveAndFlush(token);
    }

    private void acknowledge(List<String> mints) {
        try {
            redisTemplate.executePipelined(new SessionCallback<Object>() {
                @Override
                public <K, V> Object execute(RedisOperations<K, V> operations) {
                    redisTemplate.opsForSet().remove(RedisKeys.BUFFER_PENDING, mints.toArray());
                    for (String mint : mints) {
                        redisTemplate.delete(RedisKeys.buffer(mint));
                    }
                    return null;
                }
            });
        } catch (DataAccessException e) {
            // rows are committed; a repeated upsert on the next cycle is harmless
            log.warn("Failed to clear {} synced buffer entries: {}", mints.size(), e.getMessage());
        }
    }

    private boolean pauseBetweenChunks() {
        if (chunkPause.isZero() || chunkPause.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(chunkPause.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
