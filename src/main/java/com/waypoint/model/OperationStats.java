package com.waypoint.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate latency statistics for one operation name.
 */
public record OperationStats(
        @JsonProperty("count") int count,
        @JsonProperty("avg_ms") double avgMs,
        @JsonProperty("min_ms") double minMs,
        @JsonProperty("max_ms") double maxMs,
        @JsonProperty("total_ms") double totalMs) {
}
