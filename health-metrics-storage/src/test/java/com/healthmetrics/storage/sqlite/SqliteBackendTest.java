package com.healthmetrics.storage.sqlite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.healthmetrics.core.model.AggregatedEntry;
import com.healthmetrics.core.model.RawMetricPoint;
import com.healthmetrics.core.storage.StorageException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteBackendTest {

    private static final Instant FROM = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2024-01-02T00:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteBackend backend;

    @AfterEach
    void tearDown() {
        if (backend != null) {
            backend.close();
        }
    }

    @Test
    void migrationsRunOnceAcrossReopen() {
        Path db = tempDir.resolve("health.db");
        backend = open(db);
        assertThat(backend.schemaVersion()).isEqualTo(2);
        backend.writeAggregated(List.of(entry("20240101100000", "api", "requests", 1, 1, 1, 3)));
        backend.close();

        backend = open(db);

        assertThat(backend.schemaVersion()).isEqualTo(2);
        assertThat(backend.readMetrics("api", FROM, TO)).hasSize(1);
    }

    @Test
    void writesAreBufferedUntilFlush() {
        backend = open(tempDir.resolve("health.db"));

        backend.writeAggregated(List.of(entry("20240101100000", "api", "requests", 1, 1, 1, 3)));
        assertThat(backend.pendingWrites()).isEqualTo(1);
        assertThat(backend.readMetrics("api", FROM, TO)).isEmpty();

        backend.flush();

        assertThat(backend.pendingWrites()).isZero();
        assertThat(backend.readMetrics("api", FROM, TO))
                .containsExactly(entry("20240101100000", "api", "requests", 1, 1, 1, 3));
    }

    @Test
    void batchSizeTriggersWrite() {
        backend = new SqliteBackend(new SqliteSettings(tempDir.resolve("b.db").toString(), Duration.ofHours(1), 2));

        backend.writeAggregated(List.of(
                entry("20240101100000", "api", "a", 1, 1, 1, 1), entry("20240101100000", "api", "b", 1, 1, 1, 1)));

        assertThat(backend.readMetrics(null, FROM, TO)).hasSize(2);
    }

    @Test
    void sameWindowWritesMergeIntoOneRow() {
        backend = open(tempDir.resolve("health.db"));

        backend.writeAggregated(List.of(entry("20240101100000", "api", "latency", 10, 20, 15, 2)));
        backend.flush();
        backend.writeAggregated(List.of(entry("20240101100000", "api", "latency", 5, 30, 30, 1)));
        backend.flush();

        List<AggregatedEntry> stored = backend.readMetrics("api", FROM, TO);
        assertThat(stored).hasSize(1);
        AggregatedEntry merged = stored.get(0);
        assertThat(merged.min()).isEqualTo(5.0d);
        assertThat(merged.max()).isEqualTo(30.0d);
        assertThat(merged.avg()).isCloseTo(20.0d, within(1e-9));
        assertThat(merged.count()).isEqualTo(3);
    }

    @Test
    void readFiltersRangeAndSortsByWindow() {
        backend = open(tempDir.resolve("health.db"));
        backend.writeAggregated(List.of(
                entry("20240101100200", "api", "b", 1, 1, 1, 1),
                entry("20240101100000", "db", "a", 1, 1, 1, 1),
                entry("20240101100000", "api", "z", 1, 1, 1, 1),
                entry("20240101100300", "api", "c", 1, 1, 1, 1)));
        backend.flush();

        List<AggregatedEntry> api = backend.readMetrics(
                "api", Instant.parse("2024-01-01T10:00:00Z"), Instant.parse("2024-01-01T10:02:00Z"));
        List<AggregatedEntry> all = backend.readMetrics("", FROM, TO);

        assertThat(api).extracting(AggregatedEntry::metricName).containsExactly("z", "b");
        assertThat(all)
                .extracting(AggregatedEntry::timeWindowKey)
                .containsExactly("20240101100000", "20240101100000", "20240101100200", "20240101100300");
        assertThat(all.get(0).component()).isEqualTo("api");
        assertThat(backend.listComponents()).containsExactly("api", "db");
    }

    @Test
    void nanStatisticsReadBackAsNan() {
        backend = open(tempDir.resolve("health.db"));
        backend.writeAggregated(List.of(entry("20240101100000", "api", "ratio", Double.NaN, Double.NaN, Double.NaN, 1)));
        backend.flush();

        AggregatedEntry stored = backend.readMetrics("api", FROM, TO).get(0);

        assertThat(stored.avg()).isNaN();
        assertThat(stored.count()).isEqualTo(1);
    }

    @Test
    void rejectsRawPoints() {
        backend = open(tempDir.resolve("health.db"));

        assertThrows(
                UnsupportedOperationException.class,
                () -> backend.writeRaw(List.of(RawMetricPoint.counter(FROM, "api", "requests"))));
    }

    @Test
    void unopenableDatabaseFailsWithStorageException() throws Exception {
        Path notADirectory = Files.writeString(tempDir.resolve("file"), "x");

        assertThrows(StorageException.class, () -> open(notADirectory.resolve("health.db")));
    }

    @Test
    void snapshotIncludesPendingWrites() {
        backend = open(tempDir.resolve("health.db"));
        backend.writeAggregated(List.of(entry("20240101100000", "api", "requests", 1, 1, 1, 7)));
        Path copy = tempDir.resolve("copy.db");

        backend.snapshotTo(copy);

        try (SqliteBackend restored = open(copy)) {
            assertThat(restored.readMetrics("api", FROM, TO))
                    .containsExactly(entry("20240101100000", "api", "requests", 1, 1, 1, 7));
        }
    }

    @Test
    void closedBackendRefusesWork() {
        backend = open(tempDir.resolve("health.db"));
        backend.close();
        backend.close();

        assertThrows(StorageException.class, () -> backend.writeAggregated(List.of()));
        assertThrows(StorageException.class, () -> backend.readMetrics("api", FROM, TO));
    }

    @Test
    void inMemoryDatabaseWorks() {
        backend = new SqliteBackend(new SqliteSettings(SqliteSettings.IN_MEMORY, Duration.ofHours(1), 100));
        backend.writeAggregated(List.of(entry("20240101100000", "api", "requests", 1, 1, 1, 1)));
        backend.flush();

        assertThat(backend.listComponents()).containsExactly("api");
    }

    private static SqliteBackend open(Path path) {
        return new SqliteBackend(new SqliteSettings(path.toString(), Duration.ofHours(1), 100));
    }

    private static AggregatedEntry entry(
            String key, String component, String metric, double min, double max, double avg, long count) {
        return new AggregatedEntry(key, component, metric, min, max, avg, count);
    }
}
