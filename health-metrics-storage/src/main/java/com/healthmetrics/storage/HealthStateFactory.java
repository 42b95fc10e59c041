package com.healthmetrics.storage;

import com.healthmetrics.core.backup.BackupService;
import com.healthmetrics.core.collect.HealthState;
import com.healthmetrics.core.config.HealthProperties;
import com.healthmetrics.core.config.HealthPropertiesLoader;
import com.healthmetrics.core.storage.MemoryBackend;
import com.healthmetrics.core.storage.PersistenceManager;
import com.healthmetrics.core.storage.PersistenceSettings;
import com.healthmetrics.core.window.TimeWindowKeys;
import com.healthmetrics.storage.sqlite.SqliteBackend;
import com.healthmetrics.storage.sqlite.SqliteSettings;
import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Wires a {@link HealthState} from {@link HealthProperties}: window keys, persistence backend,
 * backups and the optional system metrics sampler.
 */
@Slf4j
public final class HealthStateFactory {

    private HealthStateFactory() {}

    /** Reads {@code HEALTH_*} environment variables and builds a state from them. */
    public static HealthState fromEnvironment() {
        return create(HealthPropertiesLoader.fromEnvironment());
    }

    public static HealthState create(HealthProperties props) {
        return create(props, Clock.systemUTC());
    }

    public static HealthState create(HealthProperties props, Clock clock) {
        TimeWindowKeys windowKeys = new TimeWindowKeys(props.getWindowSize(), clock);
        PersistenceManager persistence = createPersistence(props, windowKeys);
        HealthState state = new HealthState(props.getIdentity(), windowKeys, windowKeys.window(), persistence);

        HealthProperties.SystemMetrics system = props.getSystem();
        if (system.isEnabled()) {
            Duration interval = system.getInterval() != null ? system.getInterval() : windowKeys.window();
            state.startSystemMetrics(interval);
        }
        return state;
    }

    /**
     * Disabled when persistence is off, in-memory when no database path is set, SQLite otherwise. A
     * database that cannot be opened leaves persistence disabled.
     */
    public static PersistenceManager createPersistence(HealthProperties props, TimeWindowKeys windowKeys) {
        BackupService backupService = new BackupService(props.toBackupSettings(), windowKeys.clock());
        HealthProperties.Persistence persistence = props.getPersistence();
        if (!persistence.isEnabled()) {
            return PersistenceManager.disabled(backupService, windowKeys);
        }

        PersistenceSettings settings = props.toPersistenceSettings();
        String dbPath = persistence.getDbPath();
        if (dbPath == null || dbPath.isBlank()) {
            log.info("Persistence using in-memory backend");
            return PersistenceManager.create(MemoryBackend::new, settings, backupService, windowKeys);
        }
        return PersistenceManager.create(
                () -> new SqliteBackend(SqliteSettings.of(dbPath, settings)), settings, backupService, windowKeys);
    }
}
