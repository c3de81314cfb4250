package com.williamcallahan.booru_source_resolver.model.source;

/**
 * Hosting platforms the engine knows how to acquire originals from.
 */
public enum SourcePlatform {
    DEVIANTART,
    TUMBLR,
    GENERIC
}
