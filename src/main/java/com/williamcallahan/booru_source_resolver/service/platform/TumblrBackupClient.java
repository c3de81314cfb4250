/**
 * Tumblr web API client driving backups on an intermediary blog
 *
 * @author William Callahan
 *
 * Features:
 * - Authenticates with the web client's bearer token, the account cookie and a scraped CSRF token
 * - Uses the account's last blog as the intermediary blog
 * - Unwraps the {meta, response} envelope and fails on non-2xx meta status
 * - Draft reblogs, backup requests, backup polling and post deletion
 */
package com.williamcallahan.booru_source_resolver.service.platform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.booru_source_resolver.config.ResolverConfigurationProperties;
import com.williamcallahan.booru_source_resolver.model.backup.BackupJob;
import com.williamcallahan.booru_source_resolver.model.source.BlogPostReference;
import com.williamcallahan.booru_source_resolver.service.backup.BackupPlatformClient;
import com.williamcallahan.booru_source_resolver.service.fetch.FetchRequest;
import com.williamcallahan.booru_source_resolver.service.fetch.FetchResponse;
import com.williamcallahan.booru_source_resolver.service.fetch.RateLimitedFetchClient;
import com.williamcallahan.booru_source_resolver.types.FetchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
@Slf4j
public class TumblrBackupClient implements BackupPlatformClient {

    private static final Pattern CSRF_TOKEN = Pattern.compile("\"csrfToken\":\"(.+?)\"");
    private static final int BACKUP_READY_STATUS = 3;

    private final RateLimitedFetchClient fetchClient;
    private final ObjectMapper objectMapper;
    private final ResolverConfigurationProperties.Tumblr properties;
    private final Clock clock;
    private final CachedToken<String> csrfToken;
    private final CachedToken<String> intermediaryBlog;

    public TumblrBackupClient(RateLimitedFetchClient fetchClient, ObjectMapper objectMapper,
                              ResolverConfigurationProperties properties, Clock clock) {
        this.fetchClient = fetchClient;
        this.objectMapper = objectMapper;
        this.properties = properties.getTumblr();
        this.clock = clock;
        this.csrfToken = new CachedToken<>("tumblr csrf token", this::fetchCsrfToken, clock);
        this.intermediaryBlog = new CachedToken<>("tumblr intermediary blog", this::fetchIntermediaryBlog, clock);
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled() && properties.hasCredentials();
    }

    @Override
    @CircuitBreaker(name = "tumblrApi", fallbackMethod = "createDraftRepostFallback")
    public Mono<String> createDraftRepost(BlogPostReference post) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", "draft");
        body.put("parent_tumblelog_uuid", post.getBlogUuid());
        body.put("parent_post_id", post.getPostId());
        body.put("reblog_key", post.getReblogKey());

        return intermediaryBlog.get()
            .flatMap(blog -> callApi(HttpMethod.POST, "blog/" + blog + "/posts", body))
            .map(response -> {
                String state = response.path("state").asText();
                if (!"draft".equals(state)) {
                    throw new FetchException("Reblog was created as '" + state + "' instead of a draft", null, null);
                }
                return PlatformResponses.requireText(response, "id", "blog/posts");
            });
    }

    public Mono<String> createDraftRepostFallback(BlogPostReference post, Throwable t) {
        log.warn("TumblrBackupClient.createDraftRepost failed for post {}/{}. Error: {}",
            post.getBlogName(), post.getPostId(), t.getMessage());
        if (t instanceof FetchException fetchException) {
            return Mono.error(fetchException);
        }
        return Mono.error(new FetchException("Tumblr API unavailable: " + t.getMessage(), null, null, t));
    }

    @Override
    public Mono<BackupJob> requestBackup() {
        return intermediaryBlog.get()
            .flatMap(blog -> callApi(HttpMethod.POST, "blog/" + blog + "/backup", null))
            .map(response -> {
                String status = response.path("status").asText();
                if ("pending".equals(status)) {
                    return BackupJob.pending();
                }
                log.warn("Backup request answered with status '{}'", status);
                return BackupJob.failed();
            });
    }

    @Override
    public Mono<BackupJob> pollBackup() {
        return intermediaryBlog.get()
            .flatMap(blog -> callApi(HttpMethod.GET, "blog/" + blog + "/backup", null))
            .map(response -> {
                int status = PlatformResponses.requireInt(response, "status", "blog/backup");
                if (status == BACKUP_READY_STATUS) {
                    String link = response.path("downloadLink").asText(null);
                    return link != null ? BackupJob.ready(link) : BackupJob.pending();
                }
                return status < 0 ? BackupJob.failed() : BackupJob.pending();
            });
    }

    @Override
    public Mono<Void> deletePost(String postId) {
        return intermediaryBlog.get()
            .flatMap(blog -> callApi(HttpMethod.POST, "blog/" + blog + "/post/delete?id=" + postId, null))
            .then();
    }

    Mono<ExpiringValue<String>> fetchCsrfToken() {
        String url = properties.getBaseUrl() + "/settings/account";
        FetchRequest request = FetchRequest.builder()
            .url(url)
            .header(HttpHeaders.ACCEPT, "text/html")
            .header(HttpHeaders.COOKIE, properties.getCookie())
            .build();
        return fetchClient.execute(request).map(response -> {
            Matcher matcher = CSRF_TOKEN.matcher(response.bodyAsString());
            if (!matcher.find()) {
                throw new FetchException("Could not find csrf token; the account cookie may be invalid", url, response.getStatus());
            }
            return ExpiringValue.of(matcher.group(1), properties.getCsrfTtl(), clock);
        });
    }

    Mono<ExpiringValue<String>> fetchIntermediaryBlog() {
        return callApi(HttpMethod.GET, "user/info", null).map(response -> {
            JsonNode blogs = response.path("user").path("blogs");
            if (!blogs.isArray() || blogs.isEmpty()) {
                throw new FetchException("Account has no blogs to use as intermediary", null, null);
            }
            String name = PlatformResponses.requireText(blogs.get(blogs.size() - 1), "name", "user/info");
            log.info("Using intermediary blog {}", name);
            return ExpiringValue.permanent(name);
        });
    }

    private Mono<JsonNode> callApi(HttpMethod method, String path, Object body) {
        String url = properties.getBaseUrl() + "/api/v2/" + path;
        return csrfToken.get().flatMap(csrf -> {
            FetchRequest.FetchRequestBuilder builder = FetchRequest.builder()
                .method(method)
                .url(url)
                .header(HttpHeaders.ACCEPT, "application/json;format=camelcase")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getBearerToken())
                .header(HttpHeaders.COOKIE, properties.getCookie())
                .header(HttpHeaders.ORIGIN, properties.getBaseUrl())
                .header(HttpHeaders.REFERER, properties.getBaseUrl() + "/")
                .header("X-CSRF", csrf);
            if (body != null) {
                builder.body(toJson(body)).contentType("application/json; charset=utf8");
            }
            return fetchClient.execute(builder.build()).map(response -> unwrapEnvelope(response, url));
        });
    }

    private JsonNode unwrapEnvelope(FetchResponse response, String url) {
        JsonNode root = PlatformResponses.readJson(objectMapper, response, url);
        int metaStatus = root.path("meta").path("status").asInt(response.getStatus());
        if (metaStatus < 200 || metaStatus >= 300) {
            throw new FetchException("Tumblr API error " + metaStatus + ": " + root.path("meta").path("msg").asText(),
                url, metaStatus);
        }
        return root.path("response");
    }

    private byte[] toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable request body", e);
        }
    }
}
