package com.healthmetrics.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.healthmetrics.core.aggregate.MetricStats;
import com.healthmetrics.core.window.TimeWindowKeys;
import java.time.Instant;

/**
 * Statistics for one (window, component, metric) triple. This is the unit every backend persists.
 *
 * <p>There is no stored type flag: an entry whose min, max and avg are all 1.0 is read back as a
 * counter, with {@code count} as the number of increments.
 */
public record AggregatedEntry(
        String timeWindowKey, String component, String metricName, double min, double max, double avg, long count) {

    public static AggregatedEntry of(String timeWindowKey, String component, String metricName, MetricStats stats) {
        return new AggregatedEntry(
                timeWindowKey, component, metricName, stats.min(), stats.max(), stats.avg(), stats.count());
    }

    @JsonIgnore
    public MetricStats stats() {
        return new MetricStats(min, max, avg, count);
    }

    @JsonIgnore
    public boolean isCounter() {
        return stats().looksLikeCounter();
    }

    @JsonIgnore
    public Instant windowStart() {
        return TimeWindowKeys.parse(timeWindowKey);
    }
}
