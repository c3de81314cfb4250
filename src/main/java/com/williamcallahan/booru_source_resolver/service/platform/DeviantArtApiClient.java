/**
 * DeviantArt OAuth API client for original-file downloads
 *
 * @author William Callahan
 *
 * Features:
 * - Refresh-token grant with a lazily refreshed, TTL-bound access token
 * - Keeps the rotated refresh token for the next grant
 * - Download lookups with mature content enabled
 * - Circuit breaker with a fallback that surfaces a recoverable FetchException
 */
package com.williamcallahan.booru_source_resolver.service.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.booru_source_resolver.config.ResolverConfigurationProperties;
import com.williamcallahan.booru_source_resolver.service.fetch.FetchRequest;
import com.williamcallahan.booru_source_resolver.service.fetch.RateLimitedFetchClient;
import com.williamcallahan.booru_source_resolver.types.FetchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class DeviantArtApiClient {

    private static final Logger logger = LoggerFactory.getLogger(DeviantArtApiClient.class);

    private final RateLimitedFetchClient fetchClient;
    private final ObjectMapper objectMapper;
    private final ResolverConfigurationProperties.DeviantArt properties;
    private final Clock clock;
    private final AtomicReference<String> refreshToken;
    private final CachedToken<String> accessToken;

    public DeviantArtApiClient(RateLimitedFetchClient fetchClient, ObjectMapper objectMapper,
                               ResolverConfigurationProperties properties, Clock clock) {
        this.fetchClient = fetchClient;
        this.objectMapper = objectMapper;
        this.properties = properties.getDeviantart();
        this.clock = clock;
        this.refreshToken = new AtomicReference<>(this.properties.getRefreshToken());
        this.accessToken = new CachedToken<>("deviantart access token", this::refreshAccessToken, clock);
    }

    public boolean isEnabled() {
        return properties.isEnabled() && properties.hasCredentials();
    }

    /**
     * Looks up the original-file download of a deviation
     *
     * @param deviationUuid the deviation's UUID
     * @return download location and declared dimensions
     */
    @CircuitBreaker(name = "deviantartApi", fallbackMethod = "fetchDownloadFallback")
    public Mono<DeviationDownload> fetchDownload(String deviationUuid) {
        return accessToken.get().flatMap(token -> {
            String url = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
                .path("/api/v1/oauth2/deviation/download/{uuid}")
                .queryParam("mature_content", "true")
                .queryParam("access_token", token)
                .encode()
                .buildAndExpand(deviationUuid)
                .toUriString();
            return getJson(url).map(json -> new DeviationDownload(
                PlatformResponses.requireText(json, "src", url),
                json.path("filename").asText(null),
                PlatformResponses.requireInt(json, "width", url),
                PlatformResponses.requireInt(json, "height", url)));
        });
    }

    public Mono<DeviationDownload> fetchDownloadFallback(String deviationUuid, Throwable t) {
        logger.warn("DeviantArtApiClient.fetchDownload failed for deviation {}. Error: {}", deviationUuid, t.getMessage());
        if (t instanceof FetchException fetchException) {
            return Mono.error(fetchException);
        }
        return Mono.error(new FetchException("DeviantArt API unavailable: " + t.getMessage(), null, null, t));
    }

    Mono<ExpiringValue<String>> refreshAccessToken() {
        if (!properties.hasCredentials()) {
            return Mono.error(new FetchException("Missing DeviantArt client id, client secret or refresh token", null, null));
        }
        String url = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
            .path("/oauth2/token")
            .queryParam("client_id", properties.getClientId())
            .queryParam("client_secret", properties.getClientSecret())
            .queryParam("grant_type", "refresh_token")
            .queryParam("refresh_token", refreshToken.get())
            .encode()
            .build()
            .toUriString();

        return getJson(url).map(json -> {
            String token = PlatformResponses.requireText(json, "access_token", url);
            int expiresIn = PlatformResponses.requireInt(json, "expires_in", url);
            String rotated = json.path("refresh_token").asText(null);
            if (rotated != null && !rotated.equals(refreshToken.get())) {
                refreshToken.set(rotated);
                logger.info("DeviantArt refresh token rotated; persist the new token before restarting");
            }
            logger.debug("Refreshed DeviantArt access token, valid for {}s", expiresIn);
            return ExpiringValue.of(token, Duration.ofSeconds(expiresIn), clock);
        });
    }

    private Mono<JsonNode> getJson(String url) {
        FetchRequest request = FetchRequest.builder()
            .url(url)
            .header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .build();
        return fetchClient.execute(request).map(response -> PlatformResponses.readJson(objectMapper, response, url));
    }
}
