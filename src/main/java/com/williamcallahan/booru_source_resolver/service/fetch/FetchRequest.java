package com.williamcallahan.booru_source_resolver.service.fetch;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpMethod;

import java.util.Map;

/**
 * One HTTP request as seen by {@link HttpFetcher}.
 */
@Value
@Builder(toBuilder = true)
public class FetchRequest {

    @Builder.Default
    HttpMethod method = HttpMethod.GET;

    String url;

    @Singular
    Map<String, String> headers;

    byte[] body;

    String contentType;

    @Builder.Default
    boolean followRedirects = true;

    public static FetchRequest get(String url) {
        return FetchRequest.builder().url(url).build();
    }

    /**
     * HEAD request that reports redirects instead of following them
     */
    public static FetchRequest redirectProbe(String url) {
        return FetchRequest.builder().method(HttpMethod.HEAD).url(url).followRedirects(false).build();
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}
