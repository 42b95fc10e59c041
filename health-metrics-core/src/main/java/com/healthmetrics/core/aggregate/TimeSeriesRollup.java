package com.healthmetrics.core.aggregate;

import com.healthmetrics.core.model.AggregatedEntry;
import com.healthmetrics.core.window.TimeWindowKeys;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-aggregates stored window entries into coarser buckets, e.g. 1-minute windows into 5-minute
 * points, per component and metric.
 */
public final class TimeSeriesRollup {

    private TimeSeriesRollup() {}

    public static List<AggregatedEntry> rollup(List<AggregatedEntry> entries, Duration interval) {
        TimeWindowKeys buckets = new TimeWindowKeys(interval, Clock.systemUTC());
        Map<BucketKey, MetricStats> merged = new LinkedHashMap<>();
        for (AggregatedEntry entry : entries) {
            String bucket = buckets.keyFor(entry.windowStart());
            merged.merge(
                    new BucketKey(bucket, entry.component(), entry.metricName()),
                    entry.stats(),
                    Aggregation::merge);
        }

        List<AggregatedEntry> result = new ArrayList<>(merged.size());
        merged.forEach((key, stats) ->
                result.add(AggregatedEntry.of(key.windowKey(), key.component(), key.metricName(), stats)));
        result.sort(Comparator.comparing(AggregatedEntry::timeWindowKey)
                .thenComparing(AggregatedEntry::component)
                .thenComparing(AggregatedEntry::metricName));
        return result;
    }

    /** Collapses every entry of one metric into a single summary, ignoring window boundaries. */
    public static MetricStats total(List<AggregatedEntry> entries, String component, String metricName) {
        MetricStats result = MetricStats.EMPTY;
        for (AggregatedEntry entry : entries) {
            if (entry.component().equals(component) && entry.metricName().equals(metricName)) {
                result = Aggregation.merge(result, entry.stats());
            }
        }
        return result;
    }

    private record BucketKey(String windowKey, String component, String metricName) {}
}
