package com.healthmetrics.core.storage;

import com.healthmetrics.core.model.AggregatedEntry;
import com.healthmetrics.core.model.RawMetricPoint;
import java.time.Instant;
import java.util.List;

/**
 * Storage contract shared by every backend. Backends only store what they are given: aggregation
 * happens once, upstream, before {@link #writeAggregated(List)} is called.
 */
public interface MetricsBackend extends AutoCloseable {

    void writeAggregated(List<AggregatedEntry> entries);

    /**
     * Entries whose window key falls in {@code [start, end]} (inclusive), sorted by window key.
     *
     * @param component component filter; {@code null} or empty means every component
     */
    List<AggregatedEntry> readMetrics(String component, Instant start, Instant end);

    /** Distinct component names, sorted. */
    List<String> listComponents();

    /** Raw points are never accepted by a backend. */
    default void writeRaw(List<RawMetricPoint> points) {
        throw new UnsupportedOperationException(
                getClass().getSimpleName() + " only accepts aggregated entries");
    }

    /** Drains any internal write buffering. Backends without one have nothing to do. */
    default void flush() {}

    @Override
    void close();
}
