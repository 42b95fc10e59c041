package com.healthmetrics.core.storage;

import com.healthmetrics.core.model.AggregatedEntry;
import com.healthmetrics.core.window.TimeWindowKeys;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Append-only in-memory backend for tests and deployments without a database. Closing discards
 * everything stored.
 */
@Slf4j
public class MemoryBackend implements MetricsBackend {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<AggregatedEntry> storage = new ArrayList<>();

    @Override
    public void writeAggregated(List<AggregatedEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            storage.addAll(entries);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<AggregatedEntry> readMetrics(String component, Instant start, Instant end) {
        String startKey = TimeWindowKeys.format(start);
        String endKey = TimeWindowKeys.format(end);
        boolean allComponents = component == null || component.isEmpty();

        List<AggregatedEntry> result = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (AggregatedEntry entry : storage) {
                if (!allComponents && !entry.component().equals(component)) {
                    continue;
                }
                if (entry.timeWindowKey().compareTo(startKey) < 0
                        || entry.timeWindowKey().compareTo(endKey) > 0) {
                    continue;
                }
                result.add(entry);
            }
        } finally {
            lock.readLock().unlock();
        }
        // stable sort keeps append order within a window
        result.sort(Comparator.comparing(AggregatedEntry::timeWindowKey));
        return result;
    }

    @Override
    public List<String> listComponents() {
        TreeSet<String> components = new TreeSet<>();
        lock.readLock().lock();
        try {
            for (AggregatedEntry entry : storage) {
                components.add(entry.component());
            }
        } finally {
            lock.readLock().unlock();
        }
        return new ArrayList<>(components);
    }

    public int size() {
        lock.readLock().lock();
        try {
            return storage.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            storage.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            log.debug("Memory backend closed entriesDiscarded={}", storage.size());
            storage.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
