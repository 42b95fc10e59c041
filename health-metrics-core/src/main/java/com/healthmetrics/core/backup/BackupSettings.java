package com.healthmetrics.core.backup;

import java.nio.file.Path;
import java.util.Objects;

public record BackupSettings(boolean enabled, Path directory, int retentionDays) {

    public static final Path DEFAULT_DIRECTORY = Path.of("/data/backups/health");
    public static final int DEFAULT_RETENTION_DAYS = 30;

    public BackupSettings {
        Objects.requireNonNull(directory, "directory");
        if (retentionDays < 0) {
            throw new IllegalArgumentException("Retention days must not be negative: " + retentionDays);
        }
    }

    public static BackupSettings disabled() {
        return new BackupSettings(false, DEFAULT_DIRECTORY, DEFAULT_RETENTION_DAYS);
    }
}
