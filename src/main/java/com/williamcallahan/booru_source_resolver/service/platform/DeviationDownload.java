package com.williamcallahan.booru_source_resolver.service.platform;

/**
 * Download endpoint answer: where the original lives and what it declares to be.
 */
public record DeviationDownload(String src, String filename, int width, int height) {
}
