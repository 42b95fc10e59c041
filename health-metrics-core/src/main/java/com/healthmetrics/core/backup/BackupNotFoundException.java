package com.healthmetrics.core.backup;

import com.healthmetrics.core.storage.StorageException;

public class BackupNotFoundException extends StorageException {

    public BackupNotFoundException(String backupName) {
        super("backup not found: " + backupName);
    }
}
