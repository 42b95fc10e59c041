package com.healthmetrics.storage.sqlite;

import com.healthmetrics.core.model.AggregatedEntry;
import com.healthmetrics.core.queue.BatchWriteQueue;
import com.healthmetrics.core.storage.MetricsBackend;
import com.healthmetrics.core.storage.SnapshotCapable;
import com.healthmetrics.core.storage.StorageException;
import com.healthmetrics.core.window.TimeWindowKeys;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable backend on a single-file SQLite database.
 *
 * <p>Uses exactly one connection; every statement is serialized through {@link #connectionLock}.
 * Writes go through an internal {@link BatchWriteQueue} so callers never cause one transaction per
 * entry. Entries for an existing (window, component, metric) are merged into the stored row.
 */
@Slf4j
public class SqliteBackend implements MetricsBackend, SnapshotCapable {

    private static final String UPSERT_SQL =
            """
            INSERT INTO time_series_metrics (time_window_key, component, metric, min_value, max_value, avg_value, count)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (time_window_key, component, metric) DO UPDATE SET
                min_value = MIN(time_series_metrics.min_value, excluded.min_value),
                max_value = MAX(time_series_metrics.max_value, excluded.max_value),
                avg_value = (time_series_metrics.avg_value * time_series_metrics.count
                        + excluded.avg_value * excluded.count)
                        / (time_series_metrics.count + excluded.count),
                count = time_series_metrics.count + excluded.count
            """;

    private static final String SELECT_COLUMNS =
            "SELECT time_window_key, component, metric, min_value, max_value, avg_value, count FROM time_series_metrics";

    private static final RowMapper<AggregatedEntry> ENTRY_MAPPER = (rs, rowNum) -> new AggregatedEntry(
            rs.getString("time_window_key"),
            rs.getString("component"),
            rs.getString("metric"),
            nullableDouble(rs, "min_value"),
            nullableDouble(rs, "max_value"),
            nullableDouble(rs, "avg_value"),
            rs.getLong("count"));

    private final SqliteSettings settings;
    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final TransactionTemplate txTemplate;
    private final SchemaMigrator migrator;
    private final BatchWriteQueue<AggregatedEntry> writeQueue;
    private final ReentrantLock connectionLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean();

    public SqliteBackend(SqliteSettings settings) {
        this.settings = settings;
        this.dataSource = new SingleConnectionDataSource(settings.jdbcUrl(), true);
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.txTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.migrator = new SchemaMigrator(jdbcTemplate, txTemplate);

        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            int applied = migrator.migrate(SqliteMigrations.ALL);
            log.info(
                    "SQLite backend opened path={} schemaVersion={} migrationsApplied={}",
                    settings.dbPath(),
                    migrator.currentVersion(),
                    applied);
        } catch (DataAccessException | IllegalStateException ex) {
            dataSource.destroy();
            throw new StorageException("Failed to open SQLite database " + settings.dbPath(), ex);
        }

        this.writeQueue = new BatchWriteQueue<>(
                "sqlite-writes", this::writeBatch, settings.flushInterval(), settings.batchSize());
        this.writeQueue.start();
    }

    public SqliteSettings settings() {
        return settings;
    }

    @Override
    public void writeAggregated(List<AggregatedEntry> entries) {
        ensureOpen();
        writeQueue.enqueue(entries);
    }

    @Override
    public List<AggregatedEntry> readMetrics(String component, Instant start, Instant end) {
        ensureOpen();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("startKey", TimeWindowKeys.format(start))
                .addValue("endKey", TimeWindowKeys.format(end));
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS)
                .append(" WHERE time_window_key >= :startKey AND time_window_key <= :endKey");
        if (component != null && !component.isEmpty()) {
            sql.append(" AND component = :component");
            params.addValue("component", component);
        }
        sql.append(" ORDER BY time_window_key, component, metric");

        return withConnection(
                "query metrics", () -> namedJdbcTemplate.query(sql.toString(), params, ENTRY_MAPPER));
    }

    @Override
    public List<String> listComponents() {
        ensureOpen();
        return withConnection(
                "list components",
                () -> jdbcTemplate.queryForList(
                        "SELECT DISTINCT component FROM time_series_metrics ORDER BY component", String.class));
    }

    @Override
    public void flush() {
        writeQueue.forceFlush();
    }

    /** Flushes pending writes, then copies the database with {@code VACUUM INTO}. */
    @Override
    public void snapshotTo(Path target) {
        ensureOpen();
        writeQueue.forceFlush();
        String escaped = target.toAbsolutePath().toString().replace("'", "''");
        withConnection("snapshot", () -> {
            jdbcTemplate.execute("VACUUM INTO '" + escaped + "'");
            return null;
        });
    }

    public int schemaVersion() {
        ensureOpen();
        return withConnection("read schema version", migrator::currentVersion);
    }

    public int pendingWrites() {
        return writeQueue.size();
    }

    /** Stops the write queue with a final flush and closes the connection. Idempotent. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            writeQueue.stop();
        } finally {
            connectionLock.lock();
            try {
                dataSource.destroy();
            } finally {
                connectionLock.unlock();
            }
            log.info("SQLite backend closed path={}", settings.dbPath());
        }
    }

    private void writeBatch(List<AggregatedEntry> entries) {
        withConnection("write metrics", () -> {
            txTemplate.executeWithoutResult(status -> jdbcTemplate.batchUpdate(
                    UPSERT_SQL, entries, entries.size(), (ps, entry) -> {
                        ps.setString(1, entry.timeWindowKey());
                        ps.setString(2, entry.component());
                        ps.setString(3, entry.metricName());
                        setNullableDouble(ps, 4, entry.min());
                        setNullableDouble(ps, 5, entry.max());
                        setNullableDouble(ps, 6, entry.avg());
                        ps.setLong(7, entry.count());
                    }));
            return null;
        });
        log.debug("SQLite batch written entries={}", entries.size());
    }

    private <T> T withConnection(String operation, Supplier<T> action) {
        connectionLock.lock();
        try {
            return action.get();
        } catch (DataAccessException ex) {
            throw new StorageException("SQLite " + operation + " failed", ex);
        } finally {
            connectionLock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new StorageException("SQLite backend is closed");
        }
    }

    private static void setNullableDouble(PreparedStatement ps, int index, double value) throws SQLException {
        if (Double.isNaN(value)) {
            ps.setNull(index, Types.REAL);
        } else {
            ps.setDouble(index, value);
        }
    }

    private static double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? Double.NaN : value;
    }
}
