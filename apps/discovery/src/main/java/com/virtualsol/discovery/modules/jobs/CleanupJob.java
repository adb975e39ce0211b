package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.cache.TokenCacheManager;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Deletes tokens that stayed dead past the dead retention, and launches that never traded
 * within the launching retention.
 */
@Slf4j
@Component
public class CleanupJob implements ScheduledJob {

    private static final int DELETE_CHUNK = 500;

    private final TokenDiscoveryRepository tokenRepository;
    private final TokenCacheManager cacheManager;
    private final TokenBufferManager bufferManager;
    private final DiscoveryProperties.Retention retention;
    private final Duration interval;
    private final Clock clock;

    public CleanupJob(TokenDiscoveryRepository tokenRepository,
                      TokenCacheManager cacheManager,
                      TokenBufferManager bufferManager,
                      DiscoveryProperties properties,
                      Clock clock) {
        this.tokenRepository = tokenRepository;
        this.cacheManager = cacheManager;
        this.bufferManager = bufferManager;
        this.retention = properties.getRetention();
        this.interval = properties.getIntervals().getCleanup();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "cleanup";
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public void run() {
        Instant now = clock.instant();
        List<String> expired = tokenRepository.findExpiredMints(
                TokenState.DEAD, now.minus(retention.getDeadToken()),
                TokenState.LAUNCHING, now.minus(retention.getLaunchingToken()));
        if (expired.isEmpty()) {
            log.debug("Cleanup found nothing to delete");
            return;
        }

        int deleted = 0;
        for (int i = 0; i < expired.size(); i += DELETE_CHUNK) {
            List<String> chunk = expired.subList(i, Math.min(i + DELETE_CHUNK, expired.size()));
            bufferManager.discard(chunk);
            deleted += tokenRepository.deleteByMintIn(chunk);
            cacheManager.removeFromIndexes(chunk);
        }
        log.info("Cleanup deleted {} stale tokens", deleted);
    }
}
