package com.healthmetrics.core.storage;

import com.healthmetrics.core.backup.BackupService;
import com.healthmetrics.core.backup.BackupSettings;
import com.healthmetrics.core.collect.WindowTable;
import com.healthmetrics.core.model.AggregatedEntry;
import com.healthmetrics.core.model.MetricKind;
import com.healthmetrics.core.model.RawMetricPoint;
import com.healthmetrics.core.queue.BatchWriteQueue;
import com.healthmetrics.core.window.TimeWindowKeys;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Connects collector output to a {@link MetricsBackend}. Owns the raw-point queue, passes reads
 * through to the backend and drives backups.
 *
 * <p>A manager without a backend is disabled: writes are silently ignored and reads fail with
 * {@link PersistenceDisabledException}.
 */
@Slf4j
public class PersistenceManager implements AutoCloseable {

    private final MetricsBackend backend;
    private final BatchWriteQueue<RawMetricPoint> rawQueue;
    private final BackupService backupService;
    private final TimeWindowKeys windowKeys;
    private final AtomicBoolean closed = new AtomicBoolean();

    public PersistenceManager(
            MetricsBackend backend,
            PersistenceSettings settings,
            BackupService backupService,
            TimeWindowKeys windowKeys) {
        this.backend = backend;
        this.backupService = Objects.requireNonNull(backupService, "backupService");
        this.windowKeys = Objects.requireNonNull(windowKeys, "windowKeys");
        if (backend != null) {
            Objects.requireNonNull(settings, "settings");
            this.rawQueue = new BatchWriteQueue<>(
                    "raw-points", this::writeRawBatch, settings.flushInterval(), settings.batchSize());
            this.rawQueue.start();
        } else {
            this.rawQueue = null;
        }
    }

    public static PersistenceManager disabled() {
        return disabled(new BackupService(BackupSettings.disabled(), Clock.systemUTC()), TimeWindowKeys.defaults());
    }

    public static PersistenceManager disabled(BackupService backupService, TimeWindowKeys windowKeys) {
        return new PersistenceManager(null, null, backupService, windowKeys);
    }

    /**
     * Builds a manager around the backend produced by {@code backendFactory}. If the backend cannot be
     * created the manager comes up disabled instead of failing the host process.
     */
    public static PersistenceManager create(
            Supplier<? extends MetricsBackend> backendFactory,
            PersistenceSettings settings,
            BackupService backupService,
            TimeWindowKeys windowKeys) {
        MetricsBackend backend;
        try {
            backend = backendFactory.get();
        } catch (RuntimeException ex) {
            log.warn("Persistence backend unavailable, continuing without persistence: {}", ex.getMessage(), ex);
            return disabled(backupService, windowKeys);
        }
        return new PersistenceManager(backend, settings, backupService, windowKeys);
    }

    public boolean isEnabled() {
        return backend != null;
    }

    public Optional<MetricsBackend> backend() {
        return Optional.ofNullable(backend);
    }

    public void persistMetric(String component, String name, double value, MetricKind kind) {
        if (!isEnabled() || !RawMetricPoint.isValidName(name)) {
            return;
        }
        Instant now = windowKeys.clock().instant();
        rawQueue.enqueue(new RawMetricPoint(now, component, name, value, kind));
    }

    public void persistMetrics(List<RawMetricPoint> points) {
        if (!isEnabled() || points == null || points.isEmpty()) {
            return;
        }
        rawQueue.enqueue(points);
    }

    /** Writes already-aggregated entries straight to the backend. */
    public void persistAggregated(List<AggregatedEntry> entries) {
        if (!isEnabled() || entries == null || entries.isEmpty()) {
            return;
        }
        backend.writeAggregated(entries);
    }

    public List<AggregatedEntry> readMetrics(String component, Instant start, Instant end) {
        requireEnabled();
        try {
            return backend.readMetrics(component, start, end);
        } catch (StorageException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new StorageException("backend query failed", ex);
        }
    }

    public List<String> listComponents() {
        requireEnabled();
        try {
            return backend.listComponents();
        } catch (StorageException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new StorageException("backend query failed", ex);
        }
    }

    /** Drains the raw-point queue and the backend's own buffering. Failures are thrown. */
    public void forceFlush() {
        if (!isEnabled()) {
            return;
        }
        rawQueue.forceFlush();
        backend.flush();
    }

    /**
     * Snapshots the durable backend into today's backup artifact. Does nothing when backups are
     * disabled or the backend keeps no files.
     */
    public Optional<Path> createBackup() {
        if (!isEnabled() || !backupService.isEnabled() || !(backend instanceof SnapshotCapable snapshotCapable)) {
            return Optional.empty();
        }
        forceFlush();
        return backupService.createBackup(snapshotCapable);
    }

    public List<String> listBackups() {
        return backupService.listBackups();
    }

    public void restoreFromBackup(String backupName, Path targetPath) {
        backupService.restore(backupName, targetPath);
    }

    public Map<String, Object> backupInfo() {
        return backupService.describe();
    }

    public BackupService backupService() {
        return backupService;
    }

    /**
     * Stops the raw queue with a final flush, takes a best-effort backup when enabled and closes the
     * backend. Only the first call has any effect.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true) || !isEnabled()) {
            return;
        }
        StorageException failure = null;
        try {
            rawQueue.stop();
            backend.flush();
        } catch (RuntimeException ex) {
            failure = asStorageException("Final flush failed", ex);
        }

        if (backupService.isEnabled()) {
            try {
                createBackup();
            } catch (RuntimeException ex) {
                log.warn("Shutdown backup failed: {}", ex.getMessage(), ex);
            }
        }

        try {
            backend.close();
        } catch (RuntimeException ex) {
            StorageException closeFailure = asStorageException("Failed to close backend", ex);
            if (failure == null) {
                failure = closeFailure;
            } else {
                failure.addSuppressed(closeFailure);
            }
        }
        log.info("Persistence manager closed");
        if (failure != null) {
            throw failure;
        }
    }

    private void writeRawBatch(List<RawMetricPoint> points) {
        List<AggregatedEntry> entries = WindowTable.fromPoints(points, windowKeys).aggregate();
        backend.writeAggregated(entries);
    }

    private void requireEnabled() {
        if (!isEnabled()) {
            throw new PersistenceDisabledException();
        }
    }

    private static StorageException asStorageException(String message, RuntimeException ex) {
        return ex instanceof StorageException se ? se : new StorageException(message, ex);
    }
}
