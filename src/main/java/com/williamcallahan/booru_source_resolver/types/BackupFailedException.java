package com.williamcallahan.booru_source_resolver.types;

/**
 * The platform refused to start a backup job or reported the job as failed.
 */
public class BackupFailedException extends SourceResolutionException {

    public BackupFailedException(String message) {
        super(message, true);
    }

    public BackupFailedException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
