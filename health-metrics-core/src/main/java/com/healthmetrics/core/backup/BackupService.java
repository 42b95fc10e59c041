package com.healthmetrics.core.backup;

import com.healthmetrics.core.storage.SnapshotCapable;
import com.healthmetrics.core.storage.StorageException;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Dated file-level backups of the durable store: one artifact per calendar day named
 * {@code health_yyyyMMdd.db}, pruned by a retention window in days.
 */
@Slf4j
public class BackupService {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
    private static final Pattern BACKUP_NAME = Pattern.compile("^health_(\\d{8})\\.db$");

    private final BackupSettings settings;
    private final Clock clock;

    public BackupService(BackupSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BackupSettings settings() {
        return settings;
    }

    public boolean isEnabled() {
        return settings.enabled();
    }

    public static String backupName(LocalDate date) {
        return "health_" + DATE_FORMAT.format(date) + ".db";
    }

    /**
     * Snapshots {@code source} into today's artifact, replacing one taken earlier the same day, then
     * prunes expired artifacts. Returns empty when backups are disabled.
     */
    public Optional<Path> createBackup(SnapshotCapable source) {
        if (!settings.enabled()) {
            return Optional.empty();
        }
        Objects.requireNonNull(source, "source");
        Path target = settings.directory().resolve(backupName(LocalDate.now(clock)));
        try {
            Files.createDirectories(settings.directory());
            Files.deleteIfExists(target);
        } catch (IOException ex) {
            throw new StorageException("Failed to prepare backup " + target, ex);
        }

        source.snapshotTo(target);
        log.info("Backup created path={}", target);

        try {
            pruneExpired();
        } catch (StorageException ex) {
            throw new StorageException("Backup succeeded but cleanup failed", ex);
        }
        return Optional.of(target);
    }

    /**
     * Deletes artifacts dated before {@code today - retentionDays}. Files that do not follow the
     * naming pattern are left alone.
     *
     * @return number of artifacts removed
     */
    public int pruneExpired() {
        LocalDate cutoff = LocalDate.now(clock).minusDays(settings.retentionDays());
        int removed = 0;
        for (Path file : listBackupFiles()) {
            Optional<LocalDate> date = parseDate(file.getFileName().toString());
            if (date.isEmpty() || !date.get().isBefore(cutoff)) {
                continue;
            }
            try {
                Files.deleteIfExists(file);
                removed++;
            } catch (IOException ex) {
                throw new StorageException("Failed to remove old backup " + file.getFileName(), ex);
            }
        }
        if (removed > 0) {
            log.info("Backup retention pruned removed={} retentionDays={}", removed, settings.retentionDays());
        }
        return removed;
    }

    /** Artifact names sorted chronologically. A missing directory yields an empty list. */
    public List<String> listBackups() {
        requireEnabled();
        List<String> names = new ArrayList<>();
        for (Path file : listBackupFiles()) {
            names.add(file.getFileName().toString());
        }
        names.sort(null);
        return names;
    }

    public void restore(String backupName, Path targetPath) {
        requireEnabled();
        Objects.requireNonNull(targetPath, "targetPath");
        if (backupName == null || backupName.isBlank() || backupName.contains("/") || backupName.contains("\\")) {
            throw new BackupNotFoundException(String.valueOf(backupName));
        }
        Path source = settings.directory().resolve(backupName);
        if (!Files.isRegularFile(source)) {
            throw new BackupNotFoundException(backupName);
        }
        try {
            Path parent = targetPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(source, targetPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new StorageException("Failed to restore database from " + backupName, ex);
        }
        log.info("Backup restored name={} target={}", backupName, targetPath);
    }

    public String findBackupForDate(LocalDate date) {
        String name = backupName(date);
        if (!Files.isRegularFile(settings.directory().resolve(name))) {
            throw new BackupNotFoundException(name);
        }
        return name;
    }

    public Map<String, Object> describe() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("enabled", settings.enabled());
        info.put("backup_dir", settings.directory().toString());
        info.put("retention_days", settings.retentionDays());
        return info;
    }

    private List<Path> listBackupFiles() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(settings.directory())) {
            for (Path file : stream) {
                if (Files.isRegularFile(file) && BACKUP_NAME.matcher(file.getFileName().toString()).matches()) {
                    files.add(file);
                }
            }
        } catch (NoSuchFileException ex) {
            return files;
        } catch (IOException ex) {
            throw new StorageException("Failed to read backup directory " + settings.directory(), ex);
        }
        return files;
    }

    private static Optional<LocalDate> parseDate(String fileName) {
        Matcher matcher = BACKUP_NAME.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(matcher.group(1), DATE_FORMAT));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private void requireEnabled() {
        if (!settings.enabled()) {
            throw new BackupDisabledException();
        }
    }
}
