package com.williamcallahan.booru_source_resolver.types;

import com.williamcallahan.booru_source_resolver.model.image.TileSpec;

/**
 * Raised when a single tile is missing, truncated or a placeholder. Aborts the whole reconstruction.
 */
public class BadChunkException extends SourceResolutionException {

    private final TileSpec tile;

    public BadChunkException(TileSpec tile, String message) {
        super("Bad chunk " + tile + ": " + message, true);
        this.tile = tile;
    }

    public BadChunkException(TileSpec tile, String message, Throwable cause) {
        super("Bad chunk " + tile + ": " + message, cause, true);
        this.tile = tile;
    }

    public TileSpec getTile() {
        return tile;
    }
}
