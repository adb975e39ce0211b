package com.virtualsol.discovery.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Thread pools for the worker: one scheduler for background jobs, one executor for
 * fire-and-forget enrichment, and one for the socket heartbeat and reconnect timers.
 */
@Configuration
public class SchedulerConfig {

    public static final String JOB_SCHEDULER = "jobScheduler";
    public static final String STREAM_SCHEDULER = "streamScheduler";
    public static final String ENRICHMENT_EXECUTOR = "enrichmentExecutor";

    @Bean(name = JOB_SCHEDULER)
    public ThreadPoolTaskScheduler jobScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(4);
        s.setThreadNamePrefix("discovery-job-");
        s.setWaitForTasksToCompleteOnShutdown(false);
        s.initialize();
        return s;
    }

    @Bean(name = STREAM_SCHEDULER)
    public ThreadPoolTaskScheduler streamScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("pumpportal-");
        s.initialize();
        return s;
    }

    @Bean(name = ENRICHMENT_EXECUTOR)
    public ThreadPoolTaskExecutor enrichmentExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("enrich-");
        e.initialize();
        return e;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
