package com.healthmetrics.core.queue;

import com.healthmetrics.core.storage.StorageException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Buffers items and hands them to a {@link BatchWriter} when the batch size is reached or the
 * flush interval elapses.
 *
 * <p>The buffer is swapped out before the writer runs, so enqueuers never wait on backend I/O and
 * a failed batch is dropped rather than retried. Scheduled flush failures are logged; explicit
 * {@link #forceFlush()} and the final flush in {@link #stop()} throw.
 */
@Slf4j
public class BatchWriteQueue<T> implements AutoCloseable {

    private final String name;
    private final BatchWriter<T> writer;
    private final Duration flushInterval;
    private final int batchSize;

    private final Object bufferLock = new Object();
    private final Object flushLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    private List<T> buffer = new ArrayList<>();
    private ScheduledExecutorService scheduler;

    public BatchWriteQueue(String name, BatchWriter<T> writer, Duration flushInterval, int batchSize) {
        this.name = Objects.requireNonNull(name, "name");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval");
        if (flushInterval.isZero() || flushInterval.isNegative()) {
            throw new IllegalArgumentException("Flush interval must be positive: " + flushInterval);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "health-queue-" + name);
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = flushInterval.toMillis();
        scheduler.scheduleAtFixedRate(this::flushScheduled, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Batch queue started name={} flushInterval={} batchSize={}", name, flushInterval, batchSize);
    }

    /**
     * Adds items to the buffer and writes synchronously once the batch size is reached. A failure of
     * that write is thrown to the caller.
     */
    public void enqueue(Collection<? extends T> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        boolean full;
        synchronized (bufferLock) {
            buffer.addAll(items);
            full = buffer.size() >= batchSize;
        }
        if (full) {
            flush();
        }
    }

    public void enqueue(T item) {
        if (item != null) {
            enqueue(List.of(item));
        }
    }

    /** Writes everything buffered, blocking until the writer returns. */
    public void forceFlush() {
        flush();
    }

    public int size() {
        synchronized (bufferLock) {
            return buffer.size();
        }
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    void flushScheduled() {
        try {
            flush();
        } catch (RuntimeException ex) {
            log.error("Scheduled flush failed, batch dropped name={}", name, ex);
        }
    }

    private void flush() {
        synchronized (flushLock) {
            List<T> batch;
            synchronized (bufferLock) {
                if (buffer.isEmpty()) {
                    return;
                }
                batch = buffer;
                buffer = new ArrayList<>(Math.min(batch.size(), batchSize));
            }
            try {
                writer.write(batch);
            } catch (StorageException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                throw new StorageException("Batch write failed for queue " + name, ex);
            }
            log.debug("Batch queue flushed name={} items={}", name, batch.size());
        }
    }

    /**
     * Stops the timer, waits for an in-flight flush and then flushes what is left. Safe to call more
     * than once; only the first call flushes.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            awaitTermination();
        }
        flush();
        log.info("Batch queue stopped name={}", name);
    }

    private void awaitTermination() {
        try {
            while (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                log.debug("Waiting for in-flight flush name={}", name);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }
}
