/**
 * Caller-known ground truth about the original file
 *
 * @author William Callahan
 *
 * Features:
 * - Expected type, width and height taken from platform metadata
 * - Optional expected byte size
 * - Every field is optional; absent fields are not checked
 */
package com.williamcallahan.booru_source_resolver.model.image;

import com.williamcallahan.booru_source_resolver.util.ImageTypeUtils;

public final class OriginalFileDescriptor {

    private final String type;
    private final Integer width;
    private final Integer height;
    private final Long size;

    public OriginalFileDescriptor(String type, Integer width, Integer height, Long size) {
        this.type = ImageTypeUtils.normalize(type);
        this.width = width;
        this.height = height;
        this.size = size;
    }

    public static OriginalFileDescriptor of(String type, int width, int height) {
        return new OriginalFileDescriptor(type, width, height, null);
    }

    public static OriginalFileDescriptor unknown() {
        return new OriginalFileDescriptor(null, null, null, null);
    }

    public String getType() {
        return type;
    }

    public Integer getWidth() {
        return width;
    }

    public Integer getHeight() {
        return height;
    }

    public Long getSize() {
        return size;
    }

    public boolean hasDimensions() {
        return width != null && height != null;
    }

    public boolean matchesDimensions(int otherWidth, int otherHeight) {
        return hasDimensions() && width == otherWidth && height == otherHeight;
    }

    @Override
    public String toString() {
        return "OriginalFileDescriptor{" + (type != null ? type : "?") + " "
            + (width != null ? width : "?") + "x" + (height != null ? height : "?")
            + (size != null ? ", " + size + " bytes" : "") + "}";
    }
}
