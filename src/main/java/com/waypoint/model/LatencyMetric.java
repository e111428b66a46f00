package com.waypoint.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single timestamped duration sample.
 */
public record LatencyMetric(String operation, double durationMs, Instant timestamp, Map<String, Object> metadata) {

    public LatencyMetric {
        // metadata values may be null, so Map.copyOf is not an option here
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
