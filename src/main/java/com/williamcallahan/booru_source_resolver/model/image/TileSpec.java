package com.williamcallahan.booru_source_resolver.model.image;

/**
 * Rectangle of the canonical canvas fetched as one tile. Edge tiles may be narrower or shorter than the chunk size.
 */
public record TileSpec(int x, int y, int width, int height) {

    @Override
    public String toString() {
        return width + "x" + height + "@" + x + "," + y;
    }
}
