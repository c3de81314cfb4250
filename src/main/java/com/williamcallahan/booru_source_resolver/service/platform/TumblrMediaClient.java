package com.williamcallahan.booru_source_resolver.service.platform;

import com.williamcallahan.booru_source_resolver.service.fetch.FetchRequest;
import com.williamcallahan.booru_source_resolver.service.fetch.RateLimitedFetchClient;
import com.williamcallahan.booru_source_resolver.types.FetchException;
import com.williamcallahan.booru_source_resolver.types.NotApplicableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;
import reactor.core.publisher.Mono;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the Tumblr media host for the largest rendition of a keyed media item.
 * Requesting an HTML page at an oversized size segment returns a wrapper page whose image
 * points at the largest file the host keeps.
 */
@Service
@Slf4j
public class TumblrMediaClient {

    static final String LARGEST_SIZE_SEGMENT = "/s99999x99999/";

    private static final Pattern SIZE_SEGMENT = Pattern.compile("/s\\d+x\\d+/");
    private static final Pattern IMAGE_SRC = Pattern.compile("\" src=\"(.+?)\"");

    private final RateLimitedFetchClient fetchClient;

    public TumblrMediaClient(RateLimitedFetchClient fetchClient) {
        this.fetchClient = fetchClient;
    }

    /**
     * Rewrites a rendition URL to the largest size segment
     *
     * @return the rewritten URL, or null if the URL carries no size segment
     */
    public static String largestRenditionUrl(String renditionUrl) {
        Matcher matcher = SIZE_SEGMENT.matcher(renditionUrl);
        return matcher.find() ? matcher.replaceFirst(LARGEST_SIZE_SEGMENT) : null;
    }

    /**
     * Resolves the image URL behind the largest rendition's wrapper page
     */
    public Mono<String> fetchLargestImageUrl(String renditionUrl) {
        String pageUrl = largestRenditionUrl(renditionUrl);
        if (pageUrl == null) {
            return Mono.error(new NotApplicableException("Rendition URL has no size segment: " + renditionUrl));
        }
        FetchRequest request = FetchRequest.builder()
            .url(pageUrl)
            .header(HttpHeaders.ACCEPT, MediaType.TEXT_HTML_VALUE)
            .build();
        return fetchClient.execute(request).map(response -> {
            Matcher matcher = IMAGE_SRC.matcher(response.bodyAsString());
            if (!matcher.find()) {
                throw new FetchException("Could not find the image URL on the media page", pageUrl, response.getStatus());
            }
            String imageUrl = HtmlUtils.htmlUnescape(matcher.group(1));
            log.debug("Largest rendition of {} is {}", renditionUrl, imageUrl);
            return imageUrl;
        });
    }
}
