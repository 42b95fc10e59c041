package com.healthmetrics.core.queue;

import com.healthmetrics.core.collect.WindowTable;
import com.healthmetrics.core.model.AggregatedEntry;
import com.healthmetrics.core.storage.StorageException;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds windows moved out of the collector until they are aggregated and written. Guarded by its
 * own lock so slow writes never block the collector.
 */
@Slf4j
public class WindowFlushQueue {

    private final BatchWriter<AggregatedEntry> sink;
    private final Object flushLock = new Object();
    private final WindowTable pending = new WindowTable();

    public WindowFlushQueue(BatchWriter<AggregatedEntry> sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /** Takes ownership of the moved windows. */
    public void accept(WindowTable moved) {
        if (moved == null || moved.isEmpty()) {
            return;
        }
        synchronized (flushLock) {
            pending.absorb(moved);
        }
    }

    /**
     * Aggregates and writes every pending window. The pending table is cleared before the write, so
     * a failed write loses that batch; the failure is thrown.
     *
     * @return number of entries written
     */
    public int forceFlush() {
        synchronized (flushLock) {
            if (pending.isEmpty()) {
                return 0;
            }
            List<AggregatedEntry> entries = pending.aggregate();
            pending.clear();
            if (entries.isEmpty()) {
                return 0;
            }
            try {
                sink.write(entries);
            } catch (StorageException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                throw new StorageException("Failed to write aggregated windows", ex);
            }
            log.debug("Flushed aggregated windows entries={}", entries.size());
            return entries.size();
        }
    }

    /** Periodic variant: failures are logged and the batch is dropped. */
    public int flushQuietly() {
        try {
            return forceFlush();
        } catch (RuntimeException ex) {
            log.error("Failed to write aggregated windows, batch dropped", ex);
            return 0;
        }
    }

    public int pendingWindows() {
        synchronized (flushLock) {
            return pending.windowCount();
        }
    }
}
