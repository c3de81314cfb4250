/**
 * Base exception for every failure raised while resolving a source image
 *
 * @author William Callahan
 *
 * Features:
 * - Carries a recoverable flag consulted by the strategy chain
 * - Recoverable failures demote to "try the next strategy"
 * - Non-recoverable failures propagate to the caller
 */
package com.williamcallahan.booru_source_resolver.types;

public class SourceResolutionException extends RuntimeException {

    private final boolean recoverable;

    public SourceResolutionException(String message, boolean recoverable) {
        super(message);
        this.recoverable = recoverable;
    }

    public SourceResolutionException(String message, Throwable cause, boolean recoverable) {
        super(message, cause);
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
