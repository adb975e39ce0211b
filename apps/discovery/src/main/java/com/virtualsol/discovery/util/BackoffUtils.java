package com.virtualsol.discovery.util;

import java.time.Duration;

/**
 * Exponential backoff schedule shared by reconnecting clients
 */
public final class BackoffUtils {

    private static final double BACKOFF_MULTIPLIER = 2.0;

    private BackoffUtils() {
    }

    /**
     * Delay before the given attempt.
     *
     * @param attempt      1-based attempt number
     * @param initialDelay delay before the first attempt
     * @param maxDelay     upper bound for any delay
     * @return initialDelay * 2^(attempt-1), capped at maxDelay
     */
    public static Duration delayForAttempt(int attempt, Duration initialDelay, Duration maxDelay) {
        if (attempt <= 1) {
            return min(initialDelay, maxDelay);
        }
        double factor = Math.pow(BACKOFF_MULTIPLIER, attempt - 1);
        double millis = initialDelay.toMillis() * factor;
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
