package com.williamcallahan.booru_source_resolver.types;

/**
 * Thrown when bytes cannot be read as an image or the header does not yield a type and size.
 */
public class DecodeException extends SourceResolutionException {

    public DecodeException(String message) {
        super(message, true);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
