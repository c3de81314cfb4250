package com.williamcallahan.booru_source_resolver.model.backup;

/**
 * Lifecycle of a platform export job.
 */
public enum BackupJobState {
    PENDING,
    READY,
    FAILED
}
