package com.williamcallahan.booru_source_resolver.util;

import org.springframework.lang.Nullable;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * URL helpers shared by the strategies and the historical locator.
 */
public final class UrlUtils {

    private UrlUtils() {
    }

    /**
     * Last path segment of a URL with any query string removed.
     *
     * <pre>
     * UrlUtils.lastPathSegment("https://cdn.example/a/image.jpg?token=abc") → "image.jpg"
     * </pre>
     */
    public static String lastPathSegment(String url) {
        int query = url.indexOf('?');
        String path = query >= 0 ? url.substring(0, query) : url;
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /**
     * Resolves a redirect Location against the URL that returned it.
     *
     * @param base URL the redirect came from
     * @param location raw Location header value, absolute or relative
     * @return absolute target, or null if either side is not a valid URI
     */
    @Nullable
    public static String resolveRedirect(String base, @Nullable String location) {
        if (location == null || location.isBlank()) {
            return null;
        }
        try {
            return new URI(base).resolve(new URI(location)).toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
