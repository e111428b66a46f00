package com.waypoint.service.impl;

import com.waypoint.model.LatencyMetric;
import com.waypoint.model.OperationStats;
import com.waypoint.service.api.LatencyMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lock-free implementation of {@link LatencyMetricsService}.
 * <p>
 * Samples are appended to a global log and to a per-operation queue; both structures tolerate
 * concurrent appends. Statistics are computed from the queues each time {@link #summary()} is called.
 * </p>
 */
@Service
public class LatencyMetricsServiceImpl implements LatencyMetricsService {

    private static final Logger log = LoggerFactory.getLogger(LatencyMetricsServiceImpl.class);

    static final long DEFAULT_SLOW_THRESHOLD_MS = 1000;

    private final long slowThresholdMs;
    private final Queue<LatencyMetric> metricLog = new ConcurrentLinkedQueue<>();
    private final Map<String, Queue<Double>> durationsByOperation = new ConcurrentHashMap<>();

    public LatencyMetricsServiceImpl(@Value("${app.metrics.slow-threshold-ms:1000}") long slowThresholdMs) {
        this.slowThresholdMs = slowThresholdMs;
    }

    @Override
    public LatencyTimer startTimer(String operation, Map<String, Object> metadata) {
        requireOperation(operation);
        var start = System.nanoTime();
        var closed = new AtomicBoolean();
        return () -> {
            if (closed.compareAndSet(false, true)) {
                record(operation, (System.nanoTime() - start) / 1_000_000.0, metadata);
            }
        };
    }

    @Override
    public <T> T timed(String operation, Supplier<T> work) {
        try (var ignored = startTimer(operation, Map.of())) {
            return work.get();
        }
    }

    @Override
    public void record(String operation, double durationMs, Map<String, Object> metadata) {
        requireOperation(operation);
        metricLog.add(new LatencyMetric(operation, durationMs, Instant.now(), metadata));
        durationsByOperation.computeIfAbsent(operation, k -> new ConcurrentLinkedQueue<>()).add(durationMs);

        if (durationMs > slowThresholdMs) {
            log.warn("SLOW: {} took {}ms", operation, Math.round(durationMs));
        } else {
            log.debug("{}: {}ms", operation, Math.round(durationMs));
        }
    }

    @Override
    public Map<String, OperationStats> summary() {
        Map<String, OperationStats> summary = new LinkedHashMap<>();
        durationsByOperation.forEach((operation, durations) -> {
            var stats = durations.stream().mapToDouble(Double::doubleValue).summaryStatistics();
            if (stats.getCount() > 0) {
                summary.put(operation, new OperationStats(
                        (int) stats.getCount(),
                        stats.getAverage(),
                        stats.getMin(),
                        stats.getMax(),
                        stats.getSum()));
            }
        });
        return summary;
    }

    @Override
    public List<LatencyMetric> metrics() {
        return List.copyOf(metricLog);
    }

    @Override
    public void clear() {
        log.info("Clearing {} latency samples", metricLog.size());
        metricLog.clear();
        durationsByOperation.clear();
    }

    private static void requireOperation(String operation) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("Operation name must not be blank");
        }
    }
}
