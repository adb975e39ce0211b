package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Flushes the write-behind buffer to the database.
 */
@Component
public class RedisSyncJob implements ScheduledJob {

    private final TokenBufferManager bufferManager;
    private final Duration interval;

    public RedisSyncJob(TokenBufferManager bufferManager, DiscoveryProperties properties) {
        this.bufferManager = bufferManager;
        this.interval = properties.getIntervals().getRedisToDbSync();
    }

    @Override
    public String getName() {
        return "redis-sync";
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public void run() {
        bufferManager.syncBufferedTokens();
    }
}
