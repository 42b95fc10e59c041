package com.healthmetrics.core.config;

import com.healthmetrics.core.backup.BackupSettings;
import com.healthmetrics.core.storage.PersistenceSettings;
import com.healthmetrics.core.window.TimeWindowKeys;
import java.nio.file.Path;
import java.time.Duration;

public class HealthProperties {

    private String identity = "";
    private Duration windowSize = TimeWindowKeys.DEFAULT_WINDOW;
    private Persistence persistence = new Persistence();
    private Backup backup = new Backup();
    private SystemMetrics system = new SystemMetrics();

    public String getIdentity() {
        return identity;
    }

    public void setIdentity(String identity) {
        this.identity = identity;
    }

    public Duration getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(Duration windowSize) {
        this.windowSize = windowSize;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Backup getBackup() {
        return backup;
    }

    public void setBackup(Backup backup) {
        this.backup = backup;
    }

    public SystemMetrics getSystem() {
        return system;
    }

    public void setSystem(SystemMetrics system) {
        this.system = system;
    }

    public PersistenceSettings toPersistenceSettings() {
        return new PersistenceSettings(persistence.getFlushInterval(), persistence.getBatchSize());
    }

    public BackupSettings toBackupSettings() {
        return new BackupSettings(backup.isEnabled(), Path.of(backup.getDirectory()), backup.getRetentionDays());
    }

    public static class Persistence {
        public static final String DEFAULT_DB_PATH = "/tmp/health.db";

        private boolean enabled = false;
        private String dbPath = DEFAULT_DB_PATH;
        private Duration flushInterval = PersistenceSettings.DEFAULT_FLUSH_INTERVAL;
        private int batchSize = PersistenceSettings.DEFAULT_BATCH_SIZE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /** Empty selects the in-memory backend. */
        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }

        public Duration getFlushInterval() {
            return flushInterval;
        }

        public void setFlushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Backup {
        private boolean enabled = false;
        private String directory = BackupSettings.DEFAULT_DIRECTORY.toString();
        private int retentionDays = BackupSettings.DEFAULT_RETENTION_DAYS;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }
    }

    public static class SystemMetrics {
        private boolean enabled = true;
        private Duration interval;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /** Null means "same as the window size". */
        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }
}
