package com.williamcallahan.booru_source_resolver.service.platform;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.source.ViewerMedia;

/**
 * A resubmitted deviation as its Sta.sh page describes it. {@code fullview} is null when the
 * page lists no fullview rendition.
 */
public record StashedDeviation(long itemId, ViewerMedia fullview, OriginalFileDescriptor originalFile) {

    public boolean fullviewIsOriginalSize() {
        return fullview != null && originalFile.matchesDimensions(fullview.getWidth(), fullview.getHeight());
    }
}
