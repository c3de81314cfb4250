package com.williamcallahan.booru_source_resolver.model.backup;

import lombok.Value;

/**
 * Snapshot of a backup job as reported by the platform. {@code downloadLink} is only set once ready.
 */
@Value
public class BackupJob {
    BackupJobState state;
    String downloadLink;

    public static BackupJob pending() {
        return new BackupJob(BackupJobState.PENDING, null);
    }

    public static BackupJob ready(String downloadLink) {
        return new BackupJob(BackupJobState.READY, downloadLink);
    }

    public static BackupJob failed() {
        return new BackupJob(BackupJobState.FAILED, null);
    }

    public boolean isReady() {
        return state == BackupJobState.READY && downloadLink != null;
    }
}
