package com.healthmetrics.core.collect;

import com.healthmetrics.core.model.AggregatedEntry;
import com.healthmetrics.core.model.RawMetricPoint;
import com.healthmetrics.core.window.TimeWindowKeys;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * component → window key → metric name → values. Not thread-safe; owners guard it with their own lock.
 */
public final class WindowTable {

    private static final Comparator<AggregatedEntry> ENTRY_ORDER = Comparator.comparing(AggregatedEntry::timeWindowKey)
            .thenComparing(AggregatedEntry::component)
            .thenComparing(AggregatedEntry::metricName);

    private final Map<String, Map<String, Map<String, ValueSeries>>> components = new HashMap<>();

    /** Groups raw points by component, window and name. Points with invalid names are skipped. */
    public static WindowTable fromPoints(Collection<RawMetricPoint> points, TimeWindowKeys windowKeys) {
        WindowTable table = new WindowTable();
        for (RawMetricPoint point : points) {
            if (!RawMetricPoint.isValidName(point.name())) {
                continue;
            }
            table.components
                    .computeIfAbsent(point.component(), k -> new HashMap<>())
                    .computeIfAbsent(windowKeys.keyFor(point.timestamp()), k -> new HashMap<>())
                    .computeIfAbsent(point.name(), k -> new ValueSeries())
                    .append(point.value());
        }
        return table;
    }

    void putWindow(String component, String windowKey, Map<String, ValueSeries> metrics) {
        Map<String, Map<String, ValueSeries>> windows = components.computeIfAbsent(component, k -> new HashMap<>());
        Map<String, ValueSeries> existing = windows.get(windowKey);
        if (existing == null) {
            windows.put(windowKey, metrics);
            return;
        }
        metrics.forEach((name, series) -> existing.merge(name, series, (current, incoming) -> {
            current.appendAll(incoming);
            return current;
        }));
    }

    /** Moves every window of {@code other} into this table; {@code other} is left empty. */
    public void absorb(WindowTable other) {
        other.components.forEach((component, windows) ->
                windows.forEach((windowKey, metrics) -> putWindow(component, windowKey, metrics)));
        other.components.clear();
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    public int windowCount() {
        int count = 0;
        for (Map<String, Map<String, ValueSeries>> windows : components.values()) {
            count += windows.size();
        }
        return count;
    }

    public long pointCount() {
        long points = 0;
        for (Map<String, Map<String, ValueSeries>> windows : components.values()) {
            for (Map<String, ValueSeries> metrics : windows.values()) {
                for (ValueSeries series : metrics.values()) {
                    points += series.size();
                }
            }
        }
        return points;
    }

    public List<String> windowKeys(String component) {
        Map<String, Map<String, ValueSeries>> windows = components.get(component);
        if (windows == null) {
            return List.of();
        }
        List<String> keys = new ArrayList<>(windows.keySet());
        keys.sort(null);
        return keys;
    }

    /** Reduces every series to one entry, ordered by window, component, metric. */
    public List<AggregatedEntry> aggregate() {
        List<AggregatedEntry> entries = new ArrayList<>();
        components.forEach((component, windows) -> windows.forEach((windowKey, metrics) ->
                metrics.forEach((name, series) -> {
                    if (series.size() > 0) {
                        entries.add(AggregatedEntry.of(windowKey, component, name, series.summarize()));
                    }
                })));
        entries.sort(ENTRY_ORDER);
        return entries;
    }

    public void clear() {
        components.clear();
    }
}
