package com.company.anomaly.util;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public class TimeUtils {

    private TimeUtils() {
    }

    public static Instant truncateToHour(Instant instant) {
        return instant.truncatedTo(ChronoUnit.HOURS);
    }

    /**
     * First whole hour starting at or after the instant
     */
    public static Instant ceilToHour(Instant instant) {
        Instant floor = truncateToHour(instant);
        return floor.equals(instant) ? floor : floor.plus(Duration.ofHours(1));
    }

    public static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    public static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    public static String formatDuration(Double seconds) {
        if (seconds == null) return null;
        return formatDuration(Math.round(seconds * 1000));
    }

    public static String formatDuration(Long durationMs) {
        if (durationMs == null) return null;

        long hours = durationMs / 3600000;
        long minutes = (durationMs % 3600000) / 60000;
        long seconds = (durationMs % 60000) / 1000;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else {
            return String.format("%ds", seconds);
        }
    }
}
