package com.healthmetrics.storage.sqlite;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Applies ordered migrations, recording each version in {@code schema_migrations} so a re-run only
 * applies what is missing.
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaMigrator {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate txTemplate;

    /** @return number of migrations applied by this call */
    public int migrate(List<Migration> migrations) {
        jdbcTemplate.execute(
                """
                CREATE TABLE IF NOT EXISTS schema_migrations (
                    version INTEGER PRIMARY KEY,
                    applied_at INTEGER NOT NULL DEFAULT (strftime('%s', 'now'))
                )
                """);

        int current = currentVersion();
        int previous = 0;
        int applied = 0;
        for (Migration migration : migrations) {
            if (migration.version() <= previous) {
                throw new IllegalStateException("Migrations out of order at version " + migration.version());
            }
            previous = migration.version();
            if (migration.version() <= current) {
                continue;
            }
            txTemplate.executeWithoutResult(status -> {
                for (String statement : migration.statements()) {
                    jdbcTemplate.execute(statement);
                }
                jdbcTemplate.update("INSERT INTO schema_migrations (version) VALUES (?)", migration.version());
            });
            applied++;
            log.info("Applied migration version={} description={}", migration.version(), migration.description());
        }
        return applied;
    }

    public int currentVersion() {
        Integer version =
                jdbcTemplate.queryForObject("SELECT COALESCE(MAX(version), 0) FROM schema_migrations", Integer.class);
        return version == null ? 0 : version;
    }
}
