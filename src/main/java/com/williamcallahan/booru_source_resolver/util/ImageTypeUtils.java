package com.williamcallahan.booru_source_resolver.util;

import java.util.Locale;

/**
 * Normalizes image type names coming from MIME types, file extensions and ImageIO format names.
 */
public final class ImageTypeUtils {

    private ImageTypeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Maps a loose type name onto the short lowercase name used everywhere else
     *
     * @example
     * <pre>
     * ImageTypeUtils.normalize("image/jpeg") → "jpg"
     * ImageTypeUtils.normalize("PNG")        → "png"
     * ImageTypeUtils.normalize(null)         → null
     * </pre>
     */
    public static String normalize(String type) {
        if (type == null || type.isBlank()) {
            return null;
        }
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("image/")) {
            normalized = normalized.substring("image/".length());
        }
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return switch (normalized) {
            case "jpeg", "jpe", "pjpeg" -> "jpg";
            case "pnj", "x-png" -> "png";
            default -> normalized;
        };
    }

    public static String mimeType(String type) {
        String normalized = normalize(type);
        if (normalized == null) {
            return "application/octet-stream";
        }
        return "jpg".equals(normalized) ? "image/jpeg" : "image/" + normalized;
    }
}
