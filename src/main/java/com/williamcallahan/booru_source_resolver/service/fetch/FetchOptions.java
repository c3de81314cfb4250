package com.williamcallahan.booru_source_resolver.service.fetch;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Per-call settings for {@link RateLimitedFetchClient}.
 */
@Getter
@Builder(toBuilder = true)
public class FetchOptions {

    private static final IntPredicate SUCCESSFUL = status -> status >= 200 && status < 300;

    @Builder.Default
    private final FetchPool pool = FetchPool.API;

    private final Integer retryBudget; // Null uses the pool default

    @Builder.Default
    private final IntPredicate acceptedStatus = SUCCESSFUL;

    private final CancellationSignal cancellation;

    @Singular
    private final Map<String, String> headers;

    public static FetchOptions defaults() {
        return FetchOptions.builder().build();
    }

    public boolean accepts(int status) {
        return acceptedStatus.test(status);
    }
}
