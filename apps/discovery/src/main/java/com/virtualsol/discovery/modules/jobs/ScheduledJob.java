package com.virtualsol.discovery.modules.jobs;

import java.time.Duration;

/**
 * A periodic background task hosted by {@link ScheduledJobManager}.
 */
public interface ScheduledJob {

    String getName();

    Duration getInterval();

    /**
     * One tick. Exceptions are logged by the manager and do not cancel later ticks.
     */
    void run() throws Exception;
}
