package com.healthmetrics.storage.sqlite;

import java.util.List;

final class SqliteMigrations {

    static final List<Migration> ALL = List.of(
            new Migration(
                    1,
                    "time series table",
                    List.of(
                            """
                            CREATE TABLE time_series_metrics (
                                time_window_key TEXT NOT NULL,
                                component TEXT NOT NULL,
                                metric TEXT NOT NULL,
                                min_value REAL,
                                max_value REAL,
                                avg_value REAL,
                                count INTEGER NOT NULL,
                                created_at INTEGER DEFAULT (strftime('%s', 'now')),
                                PRIMARY KEY (time_window_key, component, metric)
                            )
                            """)),
            new Migration(
                    2,
                    "time series indexes",
                    List.of(
                            "CREATE INDEX idx_time_series_component ON time_series_metrics (component, time_window_key)",
                            "CREATE INDEX idx_time_series_window ON time_series_metrics (time_window_key)")));

    private SqliteMigrations() {}
}
