/**
 * WebClient-backed implementation of the generic fetch primitive
 *
 * @author William Callahan
 *
 * Features:
 * - Chooses the redirecting or direct client per request
 * - Buffers the full body for every status
 * - Leaves status interpretation to callers
 */
package com.williamcallahan.booru_source_resolver.service.fetch;

import com.williamcallahan.booru_source_resolver.config.WebClientConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;

@Component
public class WebClientHttpFetcher implements HttpFetcher {

    private static final byte[] EMPTY_BODY = new byte[0];

    private final WebClient redirectingClient;
    private final WebClient directClient;

    public WebClientHttpFetcher(@Qualifier(WebClientConfig.REDIRECTING_CLIENT) WebClient redirectingClient,
                                @Qualifier(WebClientConfig.DIRECT_CLIENT) WebClient directClient) {
        this.redirectingClient = redirectingClient;
        this.directClient = directClient;
    }

    @Override
    public Mono<FetchResponse> fetch(FetchRequest request) {
        return Mono.defer(() -> {
            WebClient client = request.isFollowRedirects() ? redirectingClient : directClient;
            WebClient.RequestBodySpec spec = client.method(request.getMethod())
                .uri(URI.create(request.getUrl()))
                .headers(headers -> request.getHeaders().forEach(headers::set));

            WebClient.RequestHeadersSpec<?> ready = spec;
            if (request.getBody() != null) {
                if (request.getContentType() != null) {
                    spec.contentType(MediaType.parseMediaType(request.getContentType()));
                }
                ready = spec.bodyValue(request.getBody());
            }

            return ready.exchangeToMono(response -> response.bodyToMono(byte[].class)
                .defaultIfEmpty(EMPTY_BODY)
                .map(body -> new FetchResponse(response.statusCode().value(), response.headers().asHttpHeaders(), body)));
        });
    }
}
