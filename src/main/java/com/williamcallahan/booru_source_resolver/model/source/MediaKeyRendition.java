package com.williamcallahan.booru_source_resolver.model.source;

import lombok.Builder;
import lombok.Getter;

/**
 * Size-capped rendition of a keyed media item, e.g. {@code .../s640x960/abc.jpg}.
 * A media key means the host can serve the same item at a larger size segment.
 */
@Getter
@Builder
public class MediaKeyRendition {
    private final String url;
    private final String mediaKey;

    public boolean hasMediaKey() {
        return mediaKey != null && !mediaKey.isBlank();
    }
}
