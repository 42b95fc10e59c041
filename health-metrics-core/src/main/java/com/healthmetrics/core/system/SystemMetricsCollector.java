package com.healthmetrics.core.system;

import com.healthmetrics.core.collect.HealthState;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.RuntimeMXBean;
import java.lang.management.ThreadMXBean;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodically records JVM process metrics under the {@code system} component through the regular
 * recording API.
 */
@Slf4j
public class SystemMetricsCollector {

    public static final String COMPONENT = "system";

    private final HealthState state;
    private final Duration interval;
    private final AtomicBoolean running = new AtomicBoolean();
    private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
    private final ThreadMXBean threads = ManagementFactory.getThreadMXBean();
    private final RuntimeMXBean runtime = ManagementFactory.getRuntimeMXBean();
    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();

    private ScheduledExecutorService scheduler;

    public SystemMetricsCollector(HealthState state, Duration interval) {
        this.state = Objects.requireNonNull(state, "state");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + interval);
        }
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "health-system-metrics");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::collectQuietly, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("System metrics collection started interval={}", interval);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Records one sample of every system metric. */
    public void collect() {
        state.addComponentMetric(COMPONENT, "cpu_percent", cpuPercent());
        state.addComponentMetric(
                COMPONENT, "memory_bytes", (double) memory.getHeapMemoryUsage().getUsed());
        state.addComponentMetric(
                COMPONENT, "health_data_size", (double) state.collector().estimatedSizeBytes());
        state.addComponentMetric(COMPONENT, "threads", threads.getThreadCount());
        state.addComponentMetric(COMPONENT, "uptime_seconds", runtime.getUptime() / 1000.0d);
    }

    private void collectQuietly() {
        try {
            collect();
        } catch (RuntimeException ex) {
            log.warn("System metrics collection failed: {}", ex.getMessage(), ex);
        }
    }

    private double cpuPercent() {
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            double load = sunOs.getProcessCpuLoad();
            return load < 0 ? 0.0d : load * 100.0d;
        }
        double average = os.getSystemLoadAverage();
        return average < 0 ? 0.0d : average;
    }
}
