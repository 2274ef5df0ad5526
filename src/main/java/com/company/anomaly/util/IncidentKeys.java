package com.company.anomaly.util;

import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.IncidentPattern;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Deterministic dedupe keys, stable across correlation passes
 */
public class IncidentKeys {

    private IncidentKeys() {
    }

    public static String cascadeKey(List<String> orderedEventIds) {
        return nameUuid(IncidentPattern.CASCADE.name() + ":" + String.join(">", orderedEventIds));
    }

    public static String exhaustionKey(Component component, Instant bucketStart) {
        return nameUuid(IncidentPattern.RESOURCE_EXHAUSTION.name() + ":" + component.name()
                + ":" + bucketStart.toEpochMilli());
    }

    private static String nameUuid(String name) {
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
