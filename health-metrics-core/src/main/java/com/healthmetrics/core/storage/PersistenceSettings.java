package com.healthmetrics.core.storage;

import java.time.Duration;
import java.util.Objects;

public record PersistenceSettings(Duration flushInterval, int batchSize) {

    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(60);
    public static final int DEFAULT_BATCH_SIZE = 100;

    public PersistenceSettings {
        Objects.requireNonNull(flushInterval, "flushInterval");
    }

    public static PersistenceSettings defaults() {
        return new PersistenceSettings(DEFAULT_FLUSH_INTERVAL, DEFAULT_BATCH_SIZE);
    }
}
