package com.williamcallahan.booru_source_resolver.model.image;

import lombok.Value;

/**
 * Type and dimensions read from an image header.
 */
@Value
public class ProbeResult {
    String type;
    int width;
    int height;

    /**
     * Applies a declared rotation. Quarter turns swap the axes, half turns keep them.
     */
    public ProbeResult rotated(int degrees) {
        int normalized = ((degrees % 360) + 360) % 360;
        if (normalized == 90 || normalized == 270) {
            return new ProbeResult(type, height, width);
        }
        return this;
    }

    public String dimensions() {
        return width + "x" + height;
    }
}
