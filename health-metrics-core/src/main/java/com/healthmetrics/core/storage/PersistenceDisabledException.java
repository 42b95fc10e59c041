package com.healthmetrics.core.storage;

/** Raised by read and admin operations when no backend is active. */
public class PersistenceDisabledException extends StorageException {

    public PersistenceDisabledException() {
        super("persistence not enabled");
    }
}
