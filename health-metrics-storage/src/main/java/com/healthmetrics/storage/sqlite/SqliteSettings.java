package com.healthmetrics.storage.sqlite;

import com.healthmetrics.core.storage.PersistenceSettings;
import java.time.Duration;
import java.util.Objects;

/**
 * @param dbPath database file, or {@code :memory:} for a private in-memory database
 */
public record SqliteSettings(String dbPath, Duration flushInterval, int batchSize) {

    public static final String IN_MEMORY = ":memory:";

    public SqliteSettings {
        Objects.requireNonNull(dbPath, "dbPath");
        Objects.requireNonNull(flushInterval, "flushInterval");
    }

    public static SqliteSettings of(String dbPath, PersistenceSettings persistence) {
        return new SqliteSettings(dbPath, persistence.flushInterval(), persistence.batchSize());
    }

    public String jdbcUrl() {
        return "jdbc:sqlite:" + dbPath;
    }
}
