/**
 * Per-call source metadata handed to the resolver by a platform scraper
 *
 * @author William Callahan
 *
 * Features:
 * - Identifies the platform and page the artwork was linked from
 * - Carries every optional hint a strategy may need (direct URL, viewer media, download id,
 *   deviation id, historical storage seed, blog post reference, keyed media rendition)
 * - Strategies inspect the hints to decide applicability
 */
package com.williamcallahan.booru_source_resolver.model.source;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.LocalDate;
import java.util.Map;

@Getter
@Builder
public class SourceContext {

    private final SourcePlatform platform;
    private final String pageUrl;
    private final LocalDate publishDate;
    private final String directUrl;
    @Singular
    private final Map<String, String> requestHeaders;
    private final ViewerMedia viewerMedia;
    private final boolean downloadable;
    private final String downloadId;
    private final Long deviationId; // Numeric id used for Sta.sh resubmission
    private final HistoricalSeed historicalSeed;
    private final BlogPostReference blogPost;
    private final MediaKeyRendition mediaKeyRendition;
    private final String filename;
    private final int declaredRotation; // Clockwise degrees the platform says the stored file is turned

    /**
     * Short label used in log lines and exhaustion messages
     */
    public String label() {
        return (platform != null ? platform.name() : "UNKNOWN") + " " + (pageUrl != null ? pageUrl : "<no page url>");
    }
}
