package com.williamcallahan.booru_source_resolver.service.fetch;

import reactor.core.publisher.Mono;

/**
 * Generic HTTP primitive. Every status, including 4xx and 5xx, completes as a {@link FetchResponse};
 * only transport failures error.
 */
@FunctionalInterface
public interface HttpFetcher {

    Mono<FetchResponse> fetch(FetchRequest request);
}
