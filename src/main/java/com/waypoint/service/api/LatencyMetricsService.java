package com.waypoint.service.api;

import com.waypoint.model.LatencyMetric;
import com.waypoint.model.OperationStats;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Process-wide latency log with aggregation at read time.
 * <p>
 * Samples above the configured slow threshold are logged at WARN but are counted like any other sample.
 * </p>
 */
public interface LatencyMetricsService {

    /**
     * Starts timing an operation. Closing the returned scope records the elapsed time, so it should be
     * used in a try-with-resources block; the sample is recorded even when the block throws.
     *
     * @param operation Operation name, must not be blank.
     * @param metadata  Extra attributes stored with the sample, may be {@code null}.
     */
    LatencyTimer startTimer(String operation, Map<String, Object> metadata);

    /**
     * Runs {@code work} inside a timer and returns its result. Exceptions propagate unchanged.
     */
    <T> T timed(String operation, Supplier<T> work);

    void record(String operation, double durationMs, Map<String, Object> metadata);

    /**
     * @return Statistics per operation, computed from every sample recorded before the call.
     */
    Map<String, OperationStats> summary();

    /**
     * @return A copy of the full sample log in recording order.
     */
    List<LatencyMetric> metrics();

    /**
     * Drops all samples. Intended for tests and maintenance only.
     */
    void clear();

    /**
     * An open timing scope.
     */
    interface LatencyTimer extends AutoCloseable {

        /**
         * Records the elapsed time. Only the first call has an effect.
         */
        @Override
        void close();
    }
}
