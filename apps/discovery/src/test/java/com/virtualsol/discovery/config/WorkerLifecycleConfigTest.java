package com.virtualsol.discovery.config;

import com.virtualsol.discovery.modules.jobs.ScheduledJob;
import com.virtualsol.discovery.modules.jobs.ScheduledJobManager;
import com.virtualsol.discovery.modules.stream.PumpPortalStreamService;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.txcount.TxCountManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class WorkerLifecycleConfigTest {

    private DiscoveryProperties properties;
    private PumpPortalStreamService streamService;
    private ScheduledJobManager jobManager;
    private TxCountManager txCountManager;
    private TaskScheduler scheduler;
    private List<ScheduledJob> jobs;

    @BeforeEach
    void setUp() {
        properties = new DiscoveryProperties();
        streamService = mock(PumpPortalStreamService.class);
        jobManager = mock(ScheduledJobManager.class);
        txCountManager = mock(TxCountManager.class);
        scheduler = mock(TaskScheduler.class);
        jobs = List.of(mock(ScheduledJob.class));
    }

    @Test
    void startsStreamAndJobsWhenReady() {
        newConfig().onApplicationReady();

        verify(streamService).start();
        verify(jobManager).registerAll(jobs);
        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(Duration.ofSeconds(60)));
    }

    @Test
    void disabledStreamIsNotStarted() {
        properties.getStream().setEnabled(false);

        newConfig().onApplicationReady();

        verify(streamService, never()).start();
        verify(jobManager).registerAll(jobs);
    }

    @Test
    void shutdownStopsEverything() {
        newConfig().shutdown();

        verify(jobManager).stopAll();
        verify(streamService).stop();
    }

    @Test
    void healthCheckTrimsTxCounts() {
        newConfig().healthCheck();

        verify(txCountManager).cleanup();
    }

    private WorkerLifecycleConfig newConfig() {
        return new WorkerLifecycleConfig(properties, streamService, jobManager, jobs,
                mock(TokenBufferManager.class), txCountManager, scheduler);
    }
}
