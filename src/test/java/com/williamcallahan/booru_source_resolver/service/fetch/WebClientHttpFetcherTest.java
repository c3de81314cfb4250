package com.williamcallahan.booru_source_resolver.service.fetch;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientHttpFetcherTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private final WebClient redirecting = WebClient.builder()
        .exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK).body("image-bytes").build());
        })
        .build();

    private final WebClient direct = WebClient.builder()
        .exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(HttpStatus.MOVED_PERMANENTLY)
                .header(HttpHeaders.LOCATION, "https://storage.example/final.png")
                .build());
        })
        .build();

    private final WebClientHttpFetcher fetcher = new WebClientHttpFetcher(redirecting, direct);

    @Test
    void fetch_redirectProbeUsesNonFollowingClient() {
        StepVerifier.create(fetcher.fetch(FetchRequest.redirectProbe("https://storage.example/candidate.png")))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(301);
                assertThat(response.location()).isEqualTo("https://storage.example/final.png");
                assertThat(response.getBody()).isEmpty();
            })
            .verifyComplete();

        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.HEAD);
    }

    @Test
    void fetch_getBuffersBodyAndSendsHeaders() {
        FetchRequest request = FetchRequest.builder()
            .url("https://cdn.example/image.png")
            .header(HttpHeaders.REFERER, "https://page.example/")
            .build();

        StepVerifier.create(fetcher.fetch(request))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(200);
                assertThat(response.bodyAsString()).isEqualTo("image-bytes");
            })
            .verifyComplete();

        assertThat(lastRequest.get().headers().getFirst(HttpHeaders.REFERER)).isEqualTo("https://page.example/");
        assertThat(lastRequest.get().url().toString()).isEqualTo("https://cdn.example/image.png");
    }
}
