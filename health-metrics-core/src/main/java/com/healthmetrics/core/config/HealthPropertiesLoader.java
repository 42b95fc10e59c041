package com.healthmetrics.core.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads {@code HEALTH_*} keys (normally the process environment) into {@link HealthProperties}.
 * Malformed values keep their defaults instead of failing startup.
 */
@Slf4j
public final class HealthPropertiesLoader {

    public static final String IDENTITY = "HEALTH_IDENTITY";
    public static final String SAMPLE_RATE = "HEALTH_SAMPLE_RATE";
    public static final String PERSISTENCE_ENABLED = "HEALTH_PERSISTENCE_ENABLED";
    public static final String DB_PATH = "HEALTH_DB_PATH";
    public static final String FLUSH_INTERVAL = "HEALTH_FLUSH_INTERVAL";
    public static final String BATCH_SIZE = "HEALTH_BATCH_SIZE";
    public static final String BACKUP_ENABLED = "HEALTH_BACKUP_ENABLED";
    public static final String BACKUP_DIR = "HEALTH_BACKUP_DIR";
    public static final String BACKUP_RETENTION_DAYS = "HEALTH_BACKUP_RETENTION_DAYS";
    public static final String SYSTEM_METRICS_ENABLED = "HEALTH_SYSTEM_METRICS_ENABLED";
    public static final String SYSTEM_METRICS_INTERVAL = "HEALTH_SYSTEM_METRICS_INTERVAL";

    private HealthPropertiesLoader() {}

    public static HealthProperties fromEnvironment() {
        return load(System.getenv());
    }

    public static HealthProperties load(Map<String, String> source) {
        HealthProperties props = new HealthProperties();

        String identity = source.get(IDENTITY);
        if (identity != null) {
            props.setIdentity(identity);
        }

        // sample rate is a plain number of seconds; a duration string is accepted too
        String sampleRate = source.get(SAMPLE_RATE);
        if (sampleRate != null && !sampleRate.isBlank()) {
            Integer seconds = parsePositiveInt(SAMPLE_RATE, sampleRate);
            if (seconds != null) {
                props.setWindowSize(Duration.ofSeconds(seconds));
            } else {
                props.setWindowSize(wholeSeconds(DurationParser.parseOrDefault(sampleRate, props.getWindowSize())));
            }
        }

        HealthProperties.Persistence persistence = props.getPersistence();
        persistence.setEnabled(parseBoolean(PERSISTENCE_ENABLED, source.get(PERSISTENCE_ENABLED), persistence.isEnabled()));
        String dbPath = source.get(DB_PATH);
        if (dbPath != null) {
            persistence.setDbPath(dbPath.trim());
        }
        persistence.setFlushInterval(
                DurationParser.parseOrDefault(source.get(FLUSH_INTERVAL), persistence.getFlushInterval()));
        Integer batchSize = parsePositiveInt(BATCH_SIZE, source.get(BATCH_SIZE));
        if (batchSize != null) {
            persistence.setBatchSize(batchSize);
        }

        HealthProperties.Backup backup = props.getBackup();
        backup.setEnabled(parseBoolean(BACKUP_ENABLED, source.get(BACKUP_ENABLED), backup.isEnabled()));
        String backupDir = source.get(BACKUP_DIR);
        if (backupDir != null && !backupDir.isBlank()) {
            backup.setDirectory(backupDir.trim());
        }
        Integer retention = parseNonNegativeInt(BACKUP_RETENTION_DAYS, source.get(BACKUP_RETENTION_DAYS));
        if (retention != null) {
            backup.setRetentionDays(retention);
        }

        HealthProperties.SystemMetrics system = props.getSystem();
        system.setEnabled(parseBoolean(SYSTEM_METRICS_ENABLED, source.get(SYSTEM_METRICS_ENABLED), system.isEnabled()));
        system.setInterval(DurationParser.parseOrDefault(source.get(SYSTEM_METRICS_INTERVAL), system.getInterval()));

        return props;
    }

    private static Duration wholeSeconds(Duration duration) {
        return duration.getSeconds() < 1 ? Duration.ofSeconds(1) : Duration.ofSeconds(duration.getSeconds());
    }

    private static boolean parseBoolean(String key, String value, boolean fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "t", "yes" -> true;
            case "false", "0", "f", "no" -> false;
            default -> {
                log.debug("Ignoring invalid boolean key={} value={}", key, value);
                yield fallback;
            }
        };
    }

    private static Integer parsePositiveInt(String key, String value) {
        Integer parsed = parseInt(key, value);
        return parsed != null && parsed > 0 ? parsed : null;
    }

    private static Integer parseNonNegativeInt(String key, String value) {
        Integer parsed = parseInt(key, value);
        return parsed != null && parsed >= 0 ? parsed : null;
    }

    private static Integer parseInt(String key, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            log.debug("Ignoring invalid number key={} value={}", key, value);
            return null;
        }
    }
}
