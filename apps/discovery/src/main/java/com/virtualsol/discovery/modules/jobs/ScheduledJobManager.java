package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.SchedulerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs registered jobs on fixed-rate timers.
 *
 * <p>A tick is skipped when nobody is using the system, or when the previous tick of the same
 * job is still running. A failing tick is logged and the job keeps its schedule.
 */
@Slf4j
@Component
public class ScheduledJobManager {

    private final TaskScheduler scheduler;
    private final ActivityMonitor activityMonitor;
    private final Map<String, ScheduledFuture<?>> jobs = new ConcurrentHashMap<>();

    public ScheduledJobManager(@Qualifier(SchedulerConfig.JOB_SCHEDULER) TaskScheduler scheduler,
                               ActivityMonitor activityMonitor) {
        this.scheduler = scheduler;
        this.activityMonitor = activityMonitor;
    }

    public void register(ScheduledJob job) {
        if (jobs.containsKey(job.getName())) {
            log.warn("Job {} already registered", job.getName());
            return;
        }
        AtomicBoolean running = new AtomicBoolean(false);
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> tick(job, running),
                Instant.now().plus(job.getInterval()), job.getInterval());
        jobs.put(job.getName(), future);
        log.info("Registered job {} every {}s", job.getName(), job.getInterval().toSeconds());
    }

    public void registerAll(Collection<? extends ScheduledJob> toRegister) {
        toRegister.forEach(this::register);
    }

    public List<String> getJobs() {
        return new ArrayList<>(jobs.keySet());
    }

    public int getJobCount() {
        return jobs.size();
    }

    public void stopAll() {
        jobs.values().forEach(future -> future.cancel(false));
        int stopped = jobs.size();
        jobs.clear();
        log.info("Stopped {} scheduled jobs", stopped);
    }

    void tick(ScheduledJob job, AtomicBoolean running) {
        if (!activityMonitor.isActive()) {
            log.debug("Skipping {}: no active users", job.getName());
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Skipping {}: previous run still in progress", job.getName());
            return;
        }
        long started = System.currentTimeMillis();
        try {
            job.run();
            log.debug("Job {} completed in {}ms", job.getName(), System.currentTimeMillis() - started);
        } catch (Exception e) {
            log.error("Job {} failed: {}", job.getName(), e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }
}
