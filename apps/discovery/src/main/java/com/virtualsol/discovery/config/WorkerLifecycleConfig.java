package com.virtualsol.discovery.config;

import com.virtualsol.discovery.modules.jobs.ScheduledJob;
import com.virtualsol.discovery.modules.jobs.ScheduledJobManager;
import com.virtualsol.discovery.modules.stream.PumpPortalStreamService;
import com.virtualsol.discovery.modules.stream.event.StreamDisconnectedEvent;
import com.virtualsol.discovery.modules.stream.event.StreamGaveUpEvent;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.txcount.TxCountManager;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Starts the stream and background jobs once the context is ready, and stops them on shutdown.
 */
@Slf4j
@Configuration
public class WorkerLifecycleConfig {

    private final DiscoveryProperties properties;
    private final PumpPortalStreamService streamService;
    private final ScheduledJobManager jobManager;
    private final List<ScheduledJob> jobs;
    private final TokenBufferManager bufferManager;
    private final TxCountManager txCountManager;
    private final TaskScheduler scheduler;

    private ScheduledFuture<?> healthCheckTask;

    public WorkerLifecycleConfig(DiscoveryProperties properties,
                                 PumpPortalStreamService streamService,
                                 ScheduledJobManager jobManager,
                                 List<ScheduledJob> jobs,
                                 TokenBufferManager bufferManager,
                                 TxCountManager txCountManager,
                                 @Qualifier(SchedulerConfig.JOB_SCHEDULER) TaskScheduler scheduler) {
        this.properties = properties;
        this.streamService = streamService;
        this.jobManager = jobManager;
        this.jobs = jobs;
        this.bufferManager = bufferManager;
        this.txCountManager = txCountManager;
        this.scheduler = scheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("Token discovery worker starting");
        if (properties.getStream().isEnabled()) {
            streamService.start();
        } else {
            log.info("PumpPortal stream disabled by configuration");
        }

        jobManager.registerAll(jobs);

        Duration interval = properties.getIntervals().getHealthCheck();
        healthCheckTask = scheduler.scheduleAtFixedRate(this::healthCheck, Instant.now().plus(interval), interval);
        log.info("Token discovery worker started with {} jobs", jobManager.getJobCount());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Token discovery worker shutting down");
        if (healthCheckTask != null) {
            healthCheckTask.cancel(false);
        }
        jobManager.stopAll();
        streamService.stop();
    }

    @EventListener
    public void onStreamDisconnected(StreamDisconnectedEvent event) {
        log.warn("PumpPortal disconnected: code={} reason={} remote={}",
                event.getCode(), event.getReason(), event.isRemote());
    }

    @EventListener
    public void onStreamGaveUp(StreamGaveUpEvent event) {
        log.error("PumpPortal reconnection abandoned after {} attempts, stream is down until restart",
                event.getAttempts());
    }

    void healthCheck() {
        log.info("Health: connected={} subscribedTokens={} bufferedTokens={} txCountMints={} jobs={}",
                streamService.isConnected(),
                streamService.getSubscribedTokenCount(),
                bufferManager.getBufferSize(),
                txCountManager.size(),
                jobManager.getJobCount());
        txCountManager.cleanup();
    }
}
