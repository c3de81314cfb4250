/**
 * Resolved artwork image returned to scrapers
 *
 * @author William Callahan
 *
 * Features:
 * - Holds the validated bytes and, when known, the URL they were fetched from
 * - Type and dimensions always come from probing the bytes, never from platform metadata
 * - Optional filename taken from the platform (archive entry name, storage path)
 */
package com.williamcallahan.booru_source_resolver.model.image;

import java.util.Objects;

public final class SourceImage {

    private final byte[] bytes;
    private final String url;
    private final String filename;
    private final String type;
    private final int width;
    private final int height;

    private SourceImage(byte[] bytes, String url, String filename, ProbeResult probe) {
        this.bytes = Objects.requireNonNull(bytes, "bytes");
        this.url = url;
        this.filename = filename;
        this.type = probe.getType();
        this.width = probe.getWidth();
        this.height = probe.getHeight();
    }

    /**
     * Builds a source image from probed bytes
     *
     * @param bytes the image payload
     * @param url where the payload was fetched from, or null when it was assembled locally
     * @param filename platform-provided filename, may be null
     * @param probe header probe of {@code bytes}
     * @return the source image
     */
    public static SourceImage of(byte[] bytes, String url, String filename, ProbeResult probe) {
        return new SourceImage(bytes, url, filename, probe);
    }

    public byte[] getBytes() {
        return bytes;
    }

    public String getUrl() {
        return url;
    }

    public String getFilename() {
        return filename;
    }

    public String getType() {
        return type;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public SourceImage withFilename(String newFilename) {
        return new SourceImage(bytes, url, newFilename, new ProbeResult(type, width, height));
    }

    @Override
    public String toString() {
        return "SourceImage{" + type + " " + width + "x" + height + ", " + bytes.length + " bytes"
            + (url != null ? ", url=" + url : "")
            + (filename != null ? ", filename=" + filename : "") + "}";
    }
}
