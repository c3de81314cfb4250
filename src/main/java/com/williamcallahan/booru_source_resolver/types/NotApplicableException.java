package com.williamcallahan.booru_source_resolver.types;

/**
 * Signals that a strategy's precondition is not met. Always recoverable.
 */
public class NotApplicableException extends SourceResolutionException {

    public NotApplicableException(String message) {
        super(message, true);
    }

    public NotApplicableException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
