package com.company.anomaly.domain.enums;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

public enum Granularity {
    ONE_MINUTE("1m", Duration.ofMinutes(1)),
    FIVE_MINUTES("5m", Duration.ofMinutes(5)),
    ONE_HOUR("1h", Duration.ofHours(1));

    private final String label;
    private final Duration duration;

    Granularity(String label, Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    public String getLabel() {
        return label;
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * floor(timestamp / granularity) * granularity, on the epoch-millisecond axis
     */
    public Instant bucketStart(Instant timestamp) {
        long size = duration.toMillis();
        long millis = timestamp.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(millis, size) * size);
    }

    public Instant bucketEnd(Instant bucketStart) {
        return bucketStart.plus(duration);
    }

    public static Optional<Granularity> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(g -> g.label.equalsIgnoreCase(normalized) || g.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
