package com.healthmetrics.core.backup;

import com.healthmetrics.core.storage.StorageException;

public class BackupDisabledException extends StorageException {

    public BackupDisabledException() {
        super("backup not enabled");
    }
}
