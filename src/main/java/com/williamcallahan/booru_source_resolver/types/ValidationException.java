package com.williamcallahan.booru_source_resolver.types;

/**
 * Thrown when an image decodes fine but its type, dimensions or size differ from the expected original.
 */
public class ValidationException extends SourceResolutionException {

    public ValidationException(String message) {
        super(message, true);
    }
}
