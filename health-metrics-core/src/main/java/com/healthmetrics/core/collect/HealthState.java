package com.healthmetrics.core.collect;

import com.healthmetrics.core.json.JsonSupport;
import com.healthmetrics.core.model.RawMetricPoint;
import com.healthmetrics.core.queue.WindowFlushQueue;
import com.healthmetrics.core.storage.PersistenceManager;
import com.healthmetrics.core.storage.StorageException;
import com.healthmetrics.core.system.SystemMetricsCollector;
import com.healthmetrics.core.window.TimeWindowKeys;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for recording metrics. Owns the collector, the window flush queue, the background
 * move ticker and the persistence manager; lifecycle is construct, record, {@link #close()}.
 */
@Slf4j
public class HealthState implements AutoCloseable {

    public static final String DEFAULT_IDENTITY = "identity unset";

    private final TimeWindowedCollector collector;
    private final WindowFlushQueue flushQueue;
    private final PersistenceManager persistence;
    private final ScheduledExecutorService ticker;
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile String identity;
    private volatile long started;
    private volatile SystemMetricsCollector systemCollector;

    public HealthState(
            String identity, TimeWindowKeys windowKeys, Duration moveInterval, PersistenceManager persistence) {
        Objects.requireNonNull(moveInterval, "moveInterval");
        if (moveInterval.isZero() || moveInterval.isNegative()) {
            throw new IllegalArgumentException("Move interval must be positive: " + moveInterval);
        }
        this.collector = new TimeWindowedCollector(windowKeys);
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.flushQueue = new WindowFlushQueue(persistence::persistAggregated);
        setIdentity(identity);

        this.ticker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "health-move-and-flush");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = moveInterval.toMillis();
        ticker.scheduleAtFixedRate(this::moveToFlushQueue, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info(
                "Health state started identity={} window={} moveInterval={} persistence={}",
                this.identity,
                windowKeys.window(),
                moveInterval,
                persistence.isEnabled());
    }

    /** Default window, no persistence. */
    public static HealthState create(String identity) {
        TimeWindowKeys windowKeys = TimeWindowKeys.defaults();
        return new HealthState(identity, windowKeys, windowKeys.window(), PersistenceManager.disabled());
    }

    /** Sets the identity shown in {@link #dump()} and resets the start time. */
    public void setIdentity(String identity) {
        this.identity = identity == null || identity.isEmpty() ? DEFAULT_IDENTITY : identity;
        this.started = collector.windowKeys().clock().instant().getEpochSecond();
    }

    public String identity() {
        return identity;
    }

    public long started() {
        return started;
    }

    /** Recording after {@link #close()} is a no-op; nothing would move the data out. */
    public void incrMetric(String name) {
        if (!closed.get()) {
            collector.increment(RawMetricPoint.GLOBAL_COMPONENT, name);
        }
    }

    public void incrComponentMetric(String component, String name) {
        if (!closed.get()) {
            collector.increment(component, name);
        }
    }

    public void addMetric(String name, double value) {
        if (!closed.get()) {
            collector.record(RawMetricPoint.GLOBAL_COMPONENT, name, value);
        }
    }

    public void addComponentMetric(String component, String name, double value) {
        if (!closed.get()) {
            collector.record(component, name, value);
        }
    }

    public MetricsSnapshot snapshot() {
        return MetricsSnapshot.of(identity, started, collector.snapshotCurrentWindow());
    }

    /** JSON view of the current, unflushed window. Historical data lives in the backend. */
    public String dump() {
        return JsonSupport.toPrettyJson(snapshot());
    }

    /**
     * One ticker step: moves completed windows out of the collector and writes them. Write failures
     * are logged and the batch is dropped.
     */
    public int moveToFlushQueue() {
        try {
            flushQueue.accept(collector.moveCompletedWindows());
            return flushQueue.flushQuietly();
        } catch (RuntimeException ex) {
            log.error("Move-and-flush failed", ex);
            return 0;
        }
    }

    /**
     * Moves every window, the current one included, writes it and drains the persistence layer.
     * Failures are thrown.
     */
    public int forceFlush() {
        flushQueue.accept(collector.moveAllWindows());
        int written = flushQueue.forceFlush();
        persistence.forceFlush();
        return written;
    }

    public void startSystemMetrics(Duration interval) {
        if (closed.get()) {
            throw new IllegalStateException("Health state is closed");
        }
        synchronized (this) {
            if (systemCollector != null) {
                return;
            }
            systemCollector = new SystemMetricsCollector(this, interval);
            systemCollector.start();
        }
    }

    public TimeWindowedCollector collector() {
        return collector;
    }

    public WindowFlushQueue flushQueue() {
        return flushQueue;
    }

    public PersistenceManager persistence() {
        return persistence;
    }

    /**
     * Stops background work, flushes everything recorded so far and closes persistence. Values
     * recorded concurrently with the final flush may be lost. Only the first call has any effect.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        SystemMetricsCollector system = systemCollector;
        if (system != null) {
            system.stop();
        }

        ticker.shutdown();
        try {
            while (!ticker.awaitTermination(1, TimeUnit.SECONDS)) {
                log.debug("Waiting for in-flight move-and-flush");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }

        StorageException failure = null;
        try {
            flushQueue.accept(collector.moveAllWindows());
            flushQueue.forceFlush();
        } catch (RuntimeException ex) {
            failure = ex instanceof StorageException se ? se : new StorageException("Final flush failed", ex);
        }
        try {
            persistence.close();
        } catch (RuntimeException ex) {
            StorageException closeFailure =
                    ex instanceof StorageException se ? se : new StorageException("Failed to close persistence", ex);
            if (failure == null) {
                failure = closeFailure;
            } else {
                failure.addSuppressed(closeFailure);
            }
        }
        log.info("Health state closed identity={}", identity);
        if (failure != null) {
            throw failure;
        }
    }
}
