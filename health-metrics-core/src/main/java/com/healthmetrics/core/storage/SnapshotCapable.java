package com.healthmetrics.core.storage;

import java.nio.file.Path;

/** Backends that can write a consistent file-level copy of themselves. */
public interface SnapshotCapable {

    /** Writes a consistent copy of the live store to {@code target}, which must not exist yet. */
    void snapshotTo(Path target);
}
