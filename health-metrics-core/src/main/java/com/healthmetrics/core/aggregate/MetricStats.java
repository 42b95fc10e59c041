package com.healthmetrics.core.aggregate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Reduction of a sequence of raw values. An empty sequence reduces to all zeros.
 */
@JsonPropertyOrder({"count", "min", "max", "avg"})
public record MetricStats(double min, double max, double avg, long count) {

    public static final MetricStats EMPTY = new MetricStats(0.0d, 0.0d, 0.0d, 0L);

    @JsonIgnore
    public boolean isEmpty() {
        return count == 0;
    }

    /** Counters are recorded as 1.0 per increment, so every statistic collapses to 1.0. */
    public boolean looksLikeCounter() {
        return count > 0 && min == 1.0d && max == 1.0d && avg == 1.0d;
    }
}
