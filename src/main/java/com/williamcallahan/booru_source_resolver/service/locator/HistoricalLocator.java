/**
 * Brute-force search for an item's historical direct-storage URL
 *
 * @author William Callahan
 *
 * Features:
 * - Searches days outward from the publish date, one day at a time
 * - Probes all 512 storage candidates of a day concurrently on the locator pool
 * - A 301 whose target probes as an exact descriptor match is a hit
 * - The first hit fires the day's cancellation signal so in-flight probes complete empty
 * - Exhausting every day is NotApplicable
 */
package com.williamcallahan.booru_source_resolver.service.locator;

import com.williamcallahan.booru_source_resolver.config.ResolverConfigurationProperties;
import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.image.SourceImage;
import com.williamcallahan.booru_source_resolver.model.locator.CandidateUrl;
import com.williamcallahan.booru_source_resolver.model.source.HistoricalSeed;
import com.williamcallahan.booru_source_resolver.service.fetch.CancellationSignal;
import com.williamcallahan.booru_source_resolver.service.fetch.FetchOptions;
import com.williamcallahan.booru_source_resolver.service.fetch.FetchPool;
import com.williamcallahan.booru_source_resolver.service.fetch.FetchRequest;
import com.williamcallahan.booru_source_resolver.service.fetch.RateLimitedFetchClient;
import com.williamcallahan.booru_source_resolver.service.image.ImageProbe;
import com.williamcallahan.booru_source_resolver.types.FetchException;
import com.williamcallahan.booru_source_resolver.types.NotApplicableException;
import com.williamcallahan.booru_source_resolver.types.SourceResolutionException;
import com.williamcallahan.booru_source_resolver.util.CandidateGenerator;
import com.williamcallahan.booru_source_resolver.util.ResolutionLogger;
import com.williamcallahan.booru_source_resolver.util.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class HistoricalLocator {

    private static final int MOVED_PERMANENTLY = 301;
    private static final int NOT_FOUND = 404;

    private final RateLimitedFetchClient fetchClient;
    private final ImageProbe imageProbe;
    private final ResolverConfigurationProperties.Locator properties;
    private final Clock clock;

    public HistoricalLocator(RateLimitedFetchClient fetchClient, ImageProbe imageProbe,
                             ResolverConfigurationProperties properties, Clock clock) {
        this.fetchClient = fetchClient;
        this.imageProbe = imageProbe;
        this.properties = properties.getLocator();
        this.clock = clock;
    }

    /**
     * Searches for the stored original
     *
     * @param seed storage URL template
     * @param publishDate the item's publish date, center of the search
     * @param descriptor ground truth a hit must match exactly
     * @param headers headers attached to every probe
     * @return the located image, or NotApplicableException when no day yields a hit
     */
    public Mono<SourceImage> locate(HistoricalSeed seed, LocalDate publishDate, OriginalFileDescriptor descriptor,
                                    Map<String, String> headers) {
        List<LocalDate> days = CandidateGenerator.searchDays(publishDate, properties.getDayRadius(), LocalDate.now(clock));
        return Flux.fromIterable(days)
            .concatMap(day -> searchDay(seed, day, publishDate, descriptor, headers))
            .next()
            .switchIfEmpty(Mono.error(() -> new NotApplicableException("No historical storage URL found within "
                + properties.getDayRadius() + " days of " + publishDate)));
    }

    Mono<SourceImage> searchDay(HistoricalSeed seed, LocalDate day, LocalDate publishDate,
                                OriginalFileDescriptor descriptor, Map<String, String> headers) {
        CancellationSignal cancellation = new CancellationSignal();
        List<CandidateUrl> candidates = CandidateGenerator.candidatesForDay(seed, day);
        ResolutionLogger.logLocatorDay(log, day.toString(), (int) (day.toEpochDay() - publishDate.toEpochDay()), candidates.size());

        int concurrency = fetchClient.capacity(FetchPool.LOCATOR);
        return Flux.fromIterable(candidates)
            .flatMap(candidate -> probeCandidate(candidate, cancellation, descriptor, headers), concurrency)
            .next()
            .doOnNext(hit -> cancellation.cancel())
            .doFinally(signal -> cancellation.cancel());
    }

    private Mono<SourceImage> probeCandidate(CandidateUrl candidate, CancellationSignal cancellation,
                                             OriginalFileDescriptor descriptor, Map<String, String> headers) {
        FetchOptions probeOptions = FetchOptions.builder()
            .pool(FetchPool.LOCATOR)
            .acceptedStatus(status -> status == MOVED_PERMANENTLY || status == NOT_FOUND)
            .cancellation(cancellation)
            .headers(headers)
            .build();

        return fetchClient.execute(FetchRequest.redirectProbe(candidate.url()), probeOptions)
            .flatMap(response -> {
                String location = response.location();
                if (response.getStatus() != MOVED_PERMANENTLY || location == null) {
                    return Mono.<SourceImage>empty();
                }
                String target = UrlUtils.resolveRedirect(candidate.url(), location);
                if (target == null) {
                    return Mono.<SourceImage>error(new FetchException("Unparsable redirect location: " + location,
                        candidate.url(), MOVED_PERMANENTLY));
                }
                return fetchTarget(target, cancellation, descriptor, headers)
                    .doOnNext(hit -> ResolutionLogger.logLocatorHit(log, candidate.url(), target));
            })
            .onErrorResume(SourceResolutionException.class, e -> {
                // 5xx after retries and unexpected statuses end this candidate only
                log.debug("Locator candidate {} discarded: {}", candidate.url(), e.getMessage());
                return Mono.empty();
            });
    }

    private Mono<SourceImage> fetchTarget(String target, CancellationSignal cancellation,
                                          OriginalFileDescriptor descriptor, Map<String, String> headers) {
        FetchOptions downloadOptions = FetchOptions.builder()
            .pool(FetchPool.API)
            .cancellation(cancellation)
            .headers(headers)
            .build();
        String filename = UrlUtils.lastPathSegment(target);
        return fetchClient.execute(FetchRequest.get(target), downloadOptions)
            .map(response -> imageProbe.accept(response.getBody(), target, filename, descriptor));
    }
}
