package com.healthmetrics.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.healthmetrics.core.backup.BackupSettings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HealthPropertiesLoaderTest {

    @Test
    void defaultsWhenNothingIsSet() {
        HealthProperties props = HealthPropertiesLoader.load(Map.of());

        assertThat(props.getWindowSize()).isEqualTo(Duration.ofSeconds(60));
        assertThat(props.getPersistence().isEnabled()).isFalse();
        assertThat(props.getPersistence().getDbPath()).isEqualTo("/tmp/health.db");
        assertThat(props.getPersistence().getFlushInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(props.getPersistence().getBatchSize()).isEqualTo(100);
        assertThat(props.getBackup().isEnabled()).isFalse();
        assertThat(props.getBackup().getRetentionDays()).isEqualTo(30);
        assertThat(props.getSystem().isEnabled()).isTrue();
        assertThat(props.getSystem().getInterval()).isNull();
        assertThat(props.toBackupSettings().directory()).isEqualTo(BackupSettings.DEFAULT_DIRECTORY);
    }

    @Test
    void readsEveryKey() {
        Map<String, String> env = new HashMap<>();
        env.put(HealthPropertiesLoader.IDENTITY, "orders-7");
        env.put(HealthPropertiesLoader.SAMPLE_RATE, "15");
        env.put(HealthPropertiesLoader.PERSISTENCE_ENABLED, "true");
        env.put(HealthPropertiesLoader.DB_PATH, " /var/lib/health.db ");
        env.put(HealthPropertiesLoader.FLUSH_INTERVAL, "10s");
        env.put(HealthPropertiesLoader.BATCH_SIZE, "250");
        env.put(HealthPropertiesLoader.BACKUP_ENABLED, "yes");
        env.put(HealthPropertiesLoader.BACKUP_DIR, "/srv/backups");
        env.put(HealthPropertiesLoader.BACKUP_RETENTION_DAYS, "0");
        env.put(HealthPropertiesLoader.SYSTEM_METRICS_ENABLED, "false");
        env.put(HealthPropertiesLoader.SYSTEM_METRICS_INTERVAL, "5m");

        HealthProperties props = HealthPropertiesLoader.load(env);

        assertThat(props.getIdentity()).isEqualTo("orders-7");
        assertThat(props.getWindowSize()).isEqualTo(Duration.ofSeconds(15));
        assertThat(props.getPersistence().isEnabled()).isTrue();
        assertThat(props.getPersistence().getDbPath()).isEqualTo("/var/lib/health.db");
        assertThat(props.toPersistenceSettings().flushInterval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(props.toPersistenceSettings().batchSize()).isEqualTo(250);
        assertThat(props.toBackupSettings()).isEqualTo(new BackupSettings(true, Path.of("/srv/backups"), 0));
        assertThat(props.getSystem().isEnabled()).isFalse();
        assertThat(props.getSystem().getInterval()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        Map<String, String> env = new HashMap<>();
        env.put(HealthPropertiesLoader.SAMPLE_RATE, "-3");
        env.put(HealthPropertiesLoader.PERSISTENCE_ENABLED, "maybe");
        env.put(HealthPropertiesLoader.FLUSH_INTERVAL, "often");
        env.put(HealthPropertiesLoader.BATCH_SIZE, "0");
        env.put(HealthPropertiesLoader.BACKUP_RETENTION_DAYS, "-1");

        HealthProperties props = HealthPropertiesLoader.load(env);

        assertThat(props.getWindowSize()).isEqualTo(Duration.ofSeconds(60));
        assertThat(props.getPersistence().isEnabled()).isFalse();
        assertThat(props.getPersistence().getFlushInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(props.getPersistence().getBatchSize()).isEqualTo(100);
        assertThat(props.getBackup().getRetentionDays()).isEqualTo(30);
    }

    @Test
    void sampleRateAcceptsDurationString() {
        HealthProperties props = HealthPropertiesLoader.load(Map.of(HealthPropertiesLoader.SAMPLE_RATE, "2m"));

        assertThat(props.getWindowSize()).isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    void emptyDbPathSelectsMemory() {
        HealthProperties props = HealthPropertiesLoader.load(Map.of(HealthPropertiesLoader.DB_PATH, ""));

        assertThat(props.getPersistence().getDbPath()).isEmpty();
    }
}
