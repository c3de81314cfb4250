/**
 * Bounded-concurrency HTTP client shared by every acquisition strategy
 *
 * @author William Callahan
 *
 * Features:
 * - Separate Resilience4j bulkheads for API calls and historical locator probes
 * - A call that finds its bulkhead full waits and tries again without holding a thread
 * - Attaches the configured User-Agent and per-call headers to every request
 * - Retries connection failures, 5xx and 429 with a fixed base delay plus any Retry-After
 * - Any other unaccepted status fails immediately with a FetchException
 * - Requests under a fired CancellationSignal complete empty
 */
package com.williamcallahan.booru_source_resolver.service.fetch;

import com.williamcallahan.booru_source_resolver.config.ResolverConfigurationProperties;
import com.williamcallahan.booru_source_resolver.types.FetchException;
import com.williamcallahan.booru_source_resolver.types.SourceResolutionException;
import com.williamcallahan.booru_source_resolver.util.ErrorHandlingUtils;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;

@Service
@Slf4j
public class RateLimitedFetchClient {

    private final HttpFetcher httpFetcher;
    private final ResolverConfigurationProperties.Fetch properties;
    private final Bulkhead apiBulkhead;
    private final Bulkhead locatorBulkhead;

    public RateLimitedFetchClient(HttpFetcher httpFetcher, ResolverConfigurationProperties properties,
                                  BulkheadRegistry bulkheadRegistry) {
        this.httpFetcher = httpFetcher;
        this.properties = properties.getFetch();
        this.apiBulkhead = bulkheadRegistry.bulkhead(FetchPool.API.bulkheadName());
        this.locatorBulkhead = bulkheadRegistry.bulkhead(FetchPool.LOCATOR.bulkheadName());
    }

    public Mono<FetchResponse> execute(FetchRequest request) {
        return execute(request, FetchOptions.defaults());
    }

    /**
     * Executes a request under the selected pool's bulkhead with retry
     *
     * @param request the request to send
     * @param options pool, retry budget, accepted statuses, cancellation and extra headers
     * @return the response with an accepted status, empty if cancelled, or a FetchException
     */
    public Mono<FetchResponse> execute(FetchRequest request, FetchOptions options) {
        FetchRequest prepared = withDefaultHeaders(request, options.getHeaders());
        Bulkhead bulkhead = bulkhead(options.getPool());
        int budget = options.getRetryBudget() != null ? options.getRetryBudget() : defaultBudget(options.getPool());

        Mono<FetchResponse> singleAttempt = Mono.defer(() -> httpFetcher.fetch(prepared))
            .onErrorMap(error -> !(error instanceof SourceResolutionException),
                error -> new FetchException("Request failed for " + prepared.getUrl() + ": " + error.getMessage(),
                    prepared.getUrl(), null, error))
            .flatMap(response -> options.accepts(response.getStatus())
                ? Mono.just(response)
                : Mono.error(statusFailure(prepared, response)));

        Mono<FetchResponse> result = singleAttempt
            .transformDeferred(BulkheadOperator.of(bulkhead))
            .retryWhen(permitWait(bulkhead))
            .retryWhen(retrySpec(prepared, budget));

        CancellationSignal cancellation = options.getCancellation();
        if (cancellation == null) {
            return result;
        }
        return Mono.defer(() -> cancellation.isCancelled() ? Mono.<FetchResponse>empty() : result)
            .takeUntilOther(cancellation.asMono());
    }

    /**
     * GETs a URL on the API pool and returns the body of a 2xx response
     */
    public Mono<byte[]> getBytes(String url, Map<String, String> headers) {
        FetchRequest request = FetchRequest.builder().url(url).headers(headers != null ? headers : Map.of()).build();
        return execute(request).map(FetchResponse::getBody);
    }

    public Bulkhead bulkhead(FetchPool fetchPool) {
        return fetchPool == FetchPool.LOCATOR ? locatorBulkhead : apiBulkhead;
    }

    /**
     * Maximum concurrent requests on a pool, used by callers to size their own fan-out
     */
    public int capacity(FetchPool fetchPool) {
        return bulkhead(fetchPool).getBulkheadConfig().getMaxConcurrentCalls();
    }

    private int defaultBudget(FetchPool fetchPool) {
        return fetchPool == FetchPool.LOCATOR ? properties.getLocatorRetryBudget() : properties.getRetryBudget();
    }

    private FetchRequest withDefaultHeaders(FetchRequest request, Map<String, String> extraHeaders) {
        FetchRequest.FetchRequestBuilder builder = request.toBuilder();
        if (!request.getHeaders().containsKey(HttpHeaders.USER_AGENT) && properties.getUserAgent() != null) {
            builder.header(HttpHeaders.USER_AGENT, properties.getUserAgent());
        }
        extraHeaders.forEach(builder::header);
        return builder.build();
    }

    private FetchException statusFailure(FetchRequest request, FetchResponse response) {
        Duration retryAfter = response.getStatus() == 429 ? parseRetryAfter(response.header(HttpHeaders.RETRY_AFTER)) : Duration.ZERO;
        return new FetchException("HTTP " + response.getStatus() + " for " + request,
            request.getUrl(), response.getStatus(), retryAfter);
    }

    private Duration parseRetryAfter(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return Duration.ZERO;
        }
        try {
            long seconds = Long.parseLong(headerValue.trim());
            Duration requested = Duration.ofSeconds(Math.max(0, seconds));
            return requested.compareTo(properties.getMaxRetryAfter()) > 0 ? properties.getMaxRetryAfter() : requested;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After '{}'", headerValue);
            return Duration.ZERO;
        }
    }

    // A full bulkhead rejects at once; the call is resubscribed until a permit frees up
    private Retry permitWait(Bulkhead bulkhead) {
        return Retry.fixedDelay(Long.MAX_VALUE, properties.getPermitWaitInterval())
            .filter(BulkheadFullException.class::isInstance)
            .doBeforeRetry(retrySignal -> {
                if (retrySignal.totalRetries() == 0) {
                    log.trace("Bulkhead '{}' full, waiting for a permit", bulkhead.getName());
                }
            });
    }

    private Retry retrySpec(FetchRequest request, int budget) {
        return Retry.fixedDelay(budget, properties.getRetryBaseDelay())
            .filter(ErrorHandlingUtils::isRetryable)
            .doBeforeRetryAsync(retrySignal -> {
                Throwable failure = retrySignal.failure();
                if (failure instanceof FetchException fetchException && !fetchException.getRetryAfter().isZero()) {
                    return Mono.delay(fetchException.getRetryAfter()).then();
                }
                return Mono.empty();
            })
            .doBeforeRetry(retrySignal -> log.warn("Retrying {} after {}. Attempt #{}/{}",
                request, retrySignal.failure().getMessage(), retrySignal.totalRetries() + 1, budget))
            .onRetryExhaustedThrow((retrySpec, retrySignal) -> {
                log.debug("Retries exhausted for {} after {} attempts", request, retrySignal.totalRetries() + 1);
                return retrySignal.failure();
            });
    }
}
