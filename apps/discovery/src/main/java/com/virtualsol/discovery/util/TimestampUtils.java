package com.virtualsol.discovery.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Normalizes upstream epoch values that arrive either in seconds or in milliseconds.
 */
public final class TimestampUtils {

    private TimestampUtils() {
    }

    /**
     * @param epoch          raw epoch value
     * @param msThreshold    values above this are read as milliseconds
     * @param minYear        earliest accepted year (inclusive)
     * @param maxYear        latest accepted year (inclusive)
     * @return the instant, or empty when the value is out of range
     */
    public static Optional<Instant> normalize(long epoch, long msThreshold, int minYear, int maxYear) {
        if (epoch <= 0) {
            return Optional.empty();
        }
        Instant instant = epoch > msThreshold
                ? Instant.ofEpochMilli(epoch)
                : Instant.ofEpochSecond(epoch);
        int year = instant.atZone(ZoneOffset.UTC).getYear();
        if (year < minYear || year > maxYear) {
            return Optional.empty();
        }
        return Optional.of(instant);
    }

    public static boolean isValid(long epoch, long msThreshold, int minYear, int maxYear) {
        return normalize(epoch, msThreshold, minYear, maxYear).isPresent();
    }
}
