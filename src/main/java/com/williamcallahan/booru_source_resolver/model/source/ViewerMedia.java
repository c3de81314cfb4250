/**
 * Viewer-resolution rendition metadata exposed by a platform page
 *
 * @author William Callahan
 *
 * Features:
 * - Base URI and pretty name of the stored media
 * - Auth tokens indexed by the rendition's token index
 * - Rendition size, which may be smaller than the original
 * - Crop command template and chunk size for tiled access
 */
package com.williamcallahan.booru_source_resolver.model.source;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class ViewerMedia {

    public static final String PLACEHOLDER_WIDTH = "{width}";
    public static final String PLACEHOLDER_HEIGHT = "{height}";
    public static final String PLACEHOLDER_X = "{x}";
    public static final String PLACEHOLDER_Y = "{y}";
    public static final String PLACEHOLDER_NAME = "<prettyName>";

    private final String baseUri;
    private final String prettyName;
    private final List<String> tokens;
    private final int width;
    private final int height;
    private final int tokenIndex; // Negative when the rendition needs no token
    private final String cropCommand; // e.g. /v1/crop/w_{width},h_{height},x_{x},y_{y}/<prettyName>.png
    private final Integer chunkWidth;
    private final Integer chunkHeight;

    /**
     * Returns the token for this rendition, or null when none applies
     */
    public String token() {
        if (tokenIndex < 0 || tokens == null || tokenIndex >= tokens.size()) {
            return null;
        }
        return tokens.get(tokenIndex);
    }

    public boolean hasCropCommand() {
        return cropCommand != null && !cropCommand.isBlank();
    }

    public int effectiveChunkWidth() {
        return chunkWidth != null ? chunkWidth : width;
    }

    public int effectiveChunkHeight() {
        return chunkHeight != null ? chunkHeight : height;
    }
}
