package com.company.anomaly.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Monitored platform components, declared in data-flow order.
 * The declaration order is the causal order used for cascade detection.
 */
public enum Component {
    BROKER("broker", "Message broker"),
    STREAM_PROCESSOR("stream-processor", "Stream processor"),
    ANALYTICS_STORE("analytics-store", "Columnar analytics store");

    private final String wireName;
    private final String description;

    Component(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    public String getWireName() {
        return wireName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Position in the broker → processor → store chain (0-based)
     */
    public int causalIndex() {
        return ordinal();
    }

    public boolean isUpstreamOf(Component other) {
        return this.ordinal() < other.ordinal();
    }

    public Optional<Component> downstream() {
        Component[] values = values();
        return ordinal() + 1 < values.length
                ? Optional.of(values[ordinal() + 1])
                : Optional.empty();
    }

    /**
     * Accepts the wire name ("stream-processor") or the constant name ("STREAM_PROCESSOR").
     */
    public static Optional<Component> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(c -> c.wireName.equalsIgnoreCase(normalized)
                        || c.name().equalsIgnoreCase(normalized.replace('-', '_')))
                .findFirst();
    }
}
