package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.modules.tokens.buffer.BufferedTokenData;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.repository.TokenWatchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Copies per-token watch counts onto the token rows.
 */
@Slf4j
@Component
public class WatcherCountJob implements ScheduledJob {

    private final TokenWatchRepository watchRepository;
    private final TokenBufferManager bufferManager;
    private final Duration interval;

    public WatcherCountJob(TokenWatchRepository watchRepository,
                           TokenBufferManager bufferManager,
                           DiscoveryProperties properties) {
        this.watchRepository = watchRepository;
        this.bufferManager = bufferManager;
        this.interval = properties.getIntervals().getWatcherSync();
    }

    @Override
    public String getName() {
        return "watcher-count";
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public void run() {
        List<Object[]> counts = watchRepository.countByMint();
        for (Object[] row : counts) {
            String mint = (String) row[0];
            int count = ((Number) row[1]).intValue();
            bufferManager.bufferToken(BufferedTokenData.builder()
                    .mint(mint)
                    .watcherCount(count)
                    .build());
        }
        log.debug("Staged watcher counts for {} tokens", counts.size());
    }
}
