/**
 * Network or HTTP failure surfaced by the fetch layer after retries
 *
 * @author William Callahan
 */
package com.williamcallahan.booru_source_resolver.types;

import java.time.Duration;

public class FetchException extends SourceResolutionException {

    private final String url;
    private final Integer statusCode; // Null for connection-level failures
    private final Duration retryAfter; // Server-requested wait on 429, zero otherwise

    public FetchException(String message, String url, Integer statusCode) {
        this(message, url, statusCode, Duration.ZERO);
    }

    public FetchException(String message, String url, Integer statusCode, Duration retryAfter) {
        super(message, true);
        this.url = url;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter != null ? retryAfter : Duration.ZERO;
    }

    public FetchException(String message, String url, Integer statusCode, Throwable cause) {
        super(message, cause, true);
        this.url = url;
        this.statusCode = statusCode;
        this.retryAfter = Duration.ZERO;
    }

    public String getUrl() {
        return url;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public boolean isServerError() {
        return statusCode != null && statusCode >= 500;
    }
}
