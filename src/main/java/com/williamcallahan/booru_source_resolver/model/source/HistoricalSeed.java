package com.williamcallahan.booru_source_resolver.model.source;

import lombok.Builder;
import lombok.Getter;

/**
 * Template for the historical direct-storage URL of an item.
 * The stored path is {@code {baseUrl}/{flag}/{year}/{dayOfYear}/{shardA}/{shardB}{suffix}}.
 */
@Getter
@Builder
public class HistoricalSeed {
    private final String baseUrl;
    private final String suffix;
    private final boolean downloadableHint;
}
