package com.healthmetrics.core.system;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.healthmetrics.core.collect.HealthState;
import com.healthmetrics.core.collect.TimeWindowedCollector;
import com.healthmetrics.core.storage.PersistenceManager;
import com.healthmetrics.core.window.TimeWindowKeys;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SystemMetricsCollectorTest {

    private HealthState state;

    @BeforeEach
    void setUp() {
        state = new HealthState(
                "system-test",
                new TimeWindowKeys(Duration.ofMinutes(1), Clock.fixed(Instant.parse("2024-01-01T00:00:30Z"), ZoneOffset.UTC)),
                Duration.ofHours(1),
                PersistenceManager.disabled());
    }

    @AfterEach
    void tearDown() {
        state.close();
    }

    @Test
    void collectRecordsUnderSystemComponent() {
        SystemMetricsCollector collector = new SystemMetricsCollector(state, Duration.ofMinutes(1));

        collector.collect();

        Map<String, TimeWindowedCollector.SeriesSummary> system =
                state.collector().snapshotCurrentWindow().get(SystemMetricsCollector.COMPONENT);
        assertThat(system)
                .containsKeys("cpu_percent", "memory_bytes", "health_data_size", "threads", "uptime_seconds");
        assertThat(system.get("memory_bytes").stats().max()).isPositive();
        assertThat(system.get("cpu_percent").stats().min()).isGreaterThanOrEqualTo(0.0d);
    }

    @Test
    void startAndStopAreIdempotent() {
        SystemMetricsCollector collector = new SystemMetricsCollector(state, Duration.ofHours(1));

        collector.start();
        collector.start();
        assertThat(collector.isRunning()).isTrue();

        collector.stop();
        collector.stop();
        assertThat(collector.isRunning()).isFalse();
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> new SystemMetricsCollector(state, Duration.ZERO));
    }

    @Test
    void startSystemMetricsOnClosedStateFails() {
        state.close();

        assertThrows(IllegalStateException.class, () -> state.startSystemMetrics(Duration.ofMinutes(1)));
    }
}
