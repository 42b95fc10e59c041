package com.healthmetrics.core.collect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.JsonNode;
import com.healthmetrics.core.MutableClock;
import com.healthmetrics.core.backup.BackupService;
import com.healthmetrics.core.backup.BackupSettings;
import com.healthmetrics.core.json.JsonSupport;
import com.healthmetrics.core.model.AggregatedEntry;
import com.healthmetrics.core.storage.MemoryBackend;
import com.healthmetrics.core.storage.MetricsBackend;
import com.healthmetrics.core.storage.PersistenceManager;
import com.healthmetrics.core.storage.PersistenceSettings;
import com.healthmetrics.core.storage.StorageException;
import com.healthmetrics.core.window.TimeWindowKeys;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HealthStateTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:10Z");
    private static final Duration NEVER = Duration.ofHours(1);

    private MutableClock clock;
    private TimeWindowKeys keys;
    private MemoryBackend backend;
    private HealthState state;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        keys = new TimeWindowKeys(Duration.ofMinutes(1), clock);
        backend = new MemoryBackend();
        state = new HealthState("checkout", keys, NEVER, managerFor(backend));
    }

    @AfterEach
    void tearDown() {
        state.close();
    }

    @Test
    void dumpRendersCountersAndMeasurements() throws Exception {
        state.incrMetric("requests");
        state.incrMetric("requests");
        state.incrMetric("requests");
        state.addMetric("latency", 10);
        state.addMetric("latency", 20);
        state.addMetric("latency", 30);

        JsonNode dump = JsonSupport.mapper().readTree(state.dump());

        assertThat(dump.get("Identity").asText()).isEqualTo("checkout");
        assertThat(dump.get("Started").asLong()).isEqualTo(START.getEpochSecond());
        JsonNode global = dump.get("Metrics").get("Global");
        assertThat(global.get("requests").asLong()).isEqualTo(3);
        JsonNode latency = global.get("latency");
        assertThat(latency.get("count").asLong()).isEqualTo(3);
        assertThat(latency.get("min").asDouble()).isEqualTo(10.0d);
        assertThat(latency.get("max").asDouble()).isEqualTo(30.0d);
        assertThat(latency.get("avg").asDouble()).isEqualTo(20.0d);
    }

    @Test
    void componentMetricsAreGroupedByComponent() throws Exception {
        state.incrComponentMetric("db", "queries");
        state.addComponentMetric("db", "query_ms", 4.5);

        JsonNode db = JsonSupport.mapper().readTree(state.dump()).get("Metrics").get("db");

        assertThat(db.get("queries").asLong()).isEqualTo(1);
        assertThat(db.get("query_ms").get("avg").asDouble()).isEqualTo(4.5d);
    }

    @Test
    void blankNamesNeverReachDump() throws Exception {
        state.incrMetric("");
        state.addMetric("   ", 5);

        JsonNode dump = JsonSupport.mapper().readTree(state.dump());

        assertThat(dump.get("Metrics").isEmpty()).isTrue();
        assertThat(state.collector().isEmpty()).isTrue();
    }

    @Test
    void identityDefaultsWhenBlank() {
        state.setIdentity("");

        assertThat(state.identity()).isEqualTo(HealthState.DEFAULT_IDENTITY);
        clock.advance(Duration.ofSeconds(42));
        state.setIdentity("renamed");
        assertThat(state.started()).isEqualTo(START.getEpochSecond() + 42);
    }

    @Test
    void tickerStepPersistsCompletedWindowsOnly() {
        state.incrMetric("requests");
        clock.advance(Duration.ofMinutes(1));
        state.incrMetric("requests");

        assertThat(state.moveToFlushQueue()).isEqualTo(1);
        assertThat(state.moveToFlushQueue()).isZero();

        List<AggregatedEntry> stored = backend.readMetrics(null, START.minusSeconds(60), START.plusSeconds(120));
        assertThat(stored).containsExactly(new AggregatedEntry("20240501120000", "Global", "requests", 1, 1, 1, 1));
    }

    @Test
    void forceFlushWritesCurrentWindow() {
        state.addMetric("latency", 8);

        assertThat(state.forceFlush()).isEqualTo(1);
        assertThat(backend.size()).isEqualTo(1);
        assertThat(state.collector().isEmpty()).isTrue();
    }

    @Test
    void tickerFailureIsLoggedAndDropped() {
        MetricsBackend failing = mock(MetricsBackend.class);
        doThrow(new StorageException("disk full")).when(failing).writeAggregated(anyList());
        HealthState failingState = new HealthState("f", keys, NEVER, managerFor(failing));
        failingState.incrMetric("requests");
        clock.advance(Duration.ofMinutes(1));

        assertThat(failingState.moveToFlushQueue()).isZero();
        assertThat(failingState.flushQueue().pendingWindows()).isZero();
        assertThat(failingState.collector().isEmpty()).isTrue();

        failingState.incrMetric("requests");
        assertThrows(StorageException.class, failingState::forceFlush);
        failingState.close();
    }

    @Test
    void closeFlushesEverythingAndIsIdempotent() {
        state.incrMetric("requests");
        state.close();
        state.close();

        assertThat(state.collector().isEmpty()).isTrue();
    }

    @Test
    void recordingAfterCloseIsDiscarded() {
        state.close();

        state.incrMetric("requests");
        state.incrComponentMetric("api", "requests");
        state.addMetric("latency", 5);
        state.addComponentMetric("api", "latency", 5);

        assertThat(state.collector().windowCount()).isZero();
    }

    @Test
    void disabledPersistenceStillCollects() {
        HealthState plain = HealthState.create("plain");
        plain.incrMetric("requests");

        assertThat(plain.persistence().isEnabled()).isFalse();
        assertThat(plain.forceFlush()).isEqualTo(1);
        plain.close();
    }

    private PersistenceManager managerFor(MetricsBackend metricsBackend) {
        return new PersistenceManager(
                metricsBackend,
                new PersistenceSettings(Duration.ofHours(1), 100),
                new BackupService(BackupSettings.disabled(), clock),
                keys);
    }
}
