package com.healthmetrics.storage.sqlite;

import java.util.List;

/** One schema step. Statements run in order inside a single transaction. */
public record Migration(int version, String description, List<String> statements) {

    public Migration {
        if (version < 1) {
            throw new IllegalArgumentException("Migration version must be positive: " + version);
        }
        statements = List.copyOf(statements);
    }
}
