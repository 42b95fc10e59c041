package com.healthmetrics.core.collect;

import com.healthmetrics.core.aggregate.Aggregation;
import com.healthmetrics.core.aggregate.MetricStats;
import com.healthmetrics.core.model.RawMetricPoint;
import com.healthmetrics.core.window.TimeWindowKeys;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Hot-path store for raw values keyed by component and time window.
 *
 * <p>Writers share the read side of {@link #tableLock} and contend only on the series they append
 * to. Moving windows out takes the write side, so a move never observes a half-written window and
 * no writer keeps a reference into a window after it has been moved. Snapshots take the read side
 * and copy values, which makes them mutually exclusive with a move but not with writers.
 */
@Slf4j
public class TimeWindowedCollector {

    private static final long SERIES_OVERHEAD_BYTES = 64L;

    private final TimeWindowKeys windowKeys;
    private final ConcurrentMap<String, ConcurrentMap<String, ConcurrentMap<String, ValueSeries>>> table =
            new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock tableLock = new ReentrantReadWriteLock();

    public TimeWindowedCollector(TimeWindowKeys windowKeys) {
        this.windowKeys = Objects.requireNonNull(windowKeys, "windowKeys");
    }

    public TimeWindowKeys windowKeys() {
        return windowKeys;
    }

    public void increment(String component, String name) {
        append(component, name, 1.0d);
    }

    /** Values are stored as given; NaN and infinities are not filtered. */
    public void record(String component, String name, double value) {
        append(component, name, value);
    }

    private void append(String component, String name, double value) {
        if (!RawMetricPoint.isValidName(name)) {
            return;
        }
        String resolvedComponent = RawMetricPoint.normalizeComponent(component);
        String windowKey = windowKeys.currentKey();

        tableLock.readLock().lock();
        try {
            table.computeIfAbsent(resolvedComponent, k -> new ConcurrentHashMap<>())
                    .computeIfAbsent(windowKey, k -> new ConcurrentHashMap<>())
                    .computeIfAbsent(name, k -> new ValueSeries())
                    .append(value);
        } finally {
            tableLock.readLock().unlock();
        }
    }

    /** Moves every window other than the current one out of the table. */
    public WindowTable moveCompletedWindows() {
        return move(false);
    }

    /** Moves every window, the current one included. Used on shutdown and forced flushes. */
    public WindowTable moveAllWindows() {
        return move(true);
    }

    private WindowTable move(boolean includeCurrent) {
        String currentKey = windowKeys.currentKey();
        WindowTable moved = new WindowTable();

        tableLock.writeLock().lock();
        try {
            Iterator<Map.Entry<String, ConcurrentMap<String, ConcurrentMap<String, ValueSeries>>>> components =
                    table.entrySet().iterator();
            while (components.hasNext()) {
                Map.Entry<String, ConcurrentMap<String, ConcurrentMap<String, ValueSeries>>> component =
                        components.next();
                Iterator<Map.Entry<String, ConcurrentMap<String, ValueSeries>>> windows =
                        component.getValue().entrySet().iterator();
                while (windows.hasNext()) {
                    Map.Entry<String, ConcurrentMap<String, ValueSeries>> window = windows.next();
                    if (includeCurrent || !window.getKey().equals(currentKey)) {
                        moved.putWindow(component.getKey(), window.getKey(), window.getValue());
                        windows.remove();
                    }
                }
                if (component.getValue().isEmpty()) {
                    components.remove();
                }
            }
        } finally {
            tableLock.writeLock().unlock();
        }

        if (log.isDebugEnabled() && !moved.isEmpty()) {
            log.debug(
                    "Moved windows currentKey={} includeCurrent={} windows={} points={}",
                    currentKey,
                    includeCurrent,
                    moved.windowCount(),
                    moved.pointCount());
        }
        return moved;
    }

    /**
     * Point-in-time summaries of the current window, keyed by component then metric name.
     * Components with nothing recorded in the current window are omitted.
     */
    public Map<String, Map<String, SeriesSummary>> snapshotCurrentWindow() {
        String currentKey = windowKeys.currentKey();
        Map<String, Map<String, double[]>> copies = new TreeMap<>();

        tableLock.readLock().lock();
        try {
            table.forEach((component, windows) -> {
                Map<String, ValueSeries> metrics = windows.get(currentKey);
                if (metrics == null || metrics.isEmpty()) {
                    return;
                }
                Map<String, double[]> componentCopies = new TreeMap<>();
                metrics.forEach((name, series) -> {
                    double[] values = series.toArray();
                    if (values.length > 0) {
                        componentCopies.put(name, values);
                    }
                });
                if (!componentCopies.isEmpty()) {
                    copies.put(component, componentCopies);
                }
            });
        } finally {
            tableLock.readLock().unlock();
        }

        Map<String, Map<String, SeriesSummary>> result = new TreeMap<>();
        copies.forEach((component, metrics) -> {
            Map<String, SeriesSummary> summaries = new TreeMap<>();
            metrics.forEach((name, values) -> summaries.put(name, SeriesSummary.of(values)));
            result.put(component, summaries);
        });
        return result;
    }

    public int windowCount() {
        tableLock.readLock().lock();
        try {
            int count = 0;
            for (Map<String, ConcurrentMap<String, ValueSeries>> windows : table.values()) {
                count += windows.size();
            }
            return count;
        } finally {
            tableLock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return windowCount() == 0;
    }

    /** Rough heap footprint of the buffered values, reported by the system collector. */
    public long estimatedSizeBytes() {
        tableLock.readLock().lock();
        try {
            long bytes = 0;
            for (Map<String, ConcurrentMap<String, ValueSeries>> windows : table.values()) {
                for (Map<String, ValueSeries> metrics : windows.values()) {
                    for (Map.Entry<String, ValueSeries> entry : metrics.entrySet()) {
                        bytes += SERIES_OVERHEAD_BYTES
                                + 2L * entry.getKey().length()
                                + 8L * entry.getValue().capacity();
                    }
                }
            }
            return bytes;
        } finally {
            tableLock.readLock().unlock();
        }
    }

    public record SeriesSummary(boolean counter, MetricStats stats) {

        static SeriesSummary of(double[] values) {
            return new SeriesSummary(Aggregation.allOnes(values, values.length), Aggregation.summarize(values));
        }
    }
}
