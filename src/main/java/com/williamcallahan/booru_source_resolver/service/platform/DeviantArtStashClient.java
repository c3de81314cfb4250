/**
 * Resubmits a deviation to Sta.sh and reads the stashed copy back
 *
 * @author William Callahan
 *
 * Features:
 * - Scrapes the API console's stash_submit form tokens with the account cookie
 * - Submits the deviation through the console's API request proxy
 * - Reads the stash page's embedded initial state for the fullview rendition and original file
 * - Circuit breaker with a fallback that surfaces a recoverable FetchException
 */
package com.williamcallahan.booru_source_resolver.service.platform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.booru_source_resolver.config.ResolverConfigurationProperties;
import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.source.ViewerMedia;
import com.williamcallahan.booru_source_resolver.service.fetch.FetchRequest;
import com.williamcallahan.booru_source_resolver.service.fetch.RateLimitedFetchClient;
import com.williamcallahan.booru_source_resolver.types.FetchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;
import reactor.core.publisher.Mono;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
@Slf4j
public class DeviantArtStashClient {

    private static final Pattern INITIAL_STATE = Pattern.compile("window\\.__INITIAL_STATE__ *= *JSON\\.parse\\((\".+\")\\);");
    private static final String FULLVIEW_UNPUBLISHED = "fullview_unpublished";
    private static final String FULLVIEW = "fullview";

    private final RateLimitedFetchClient fetchClient;
    private final ObjectMapper objectMapper;
    private final ResolverConfigurationProperties.DeviantArt properties;

    public DeviantArtStashClient(RateLimitedFetchClient fetchClient, ObjectMapper objectMapper,
                                 ResolverConfigurationProperties properties) {
        this.fetchClient = fetchClient;
        this.objectMapper = objectMapper;
        this.properties = properties.getDeviantart();
    }

    public boolean isEnabled() {
        return properties.isEnabled() && properties.isStashEnabled() && properties.hasCookie();
    }

    /**
     * Submits a deviation's file to the account's Sta.sh
     *
     * @param deviationId numeric deviation id
     * @return id of the new stash item
     */
    @CircuitBreaker(name = "deviantartStash", fallbackMethod = "submitFallback")
    public Mono<Long> submit(long deviationId) {
        return fetchSubmitTokens().flatMap(tokens -> {
            Map<String, String> params = new LinkedHashMap<>(tokens);
            params.put("mature_content", "true");
            params.put("file", Long.toString(deviationId));

            String url = properties.getBaseUrl() + "/developers/console/do_api_request";
            FetchRequest request = FetchRequest.builder()
                .method(HttpMethod.POST)
                .url(url)
                .header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .header(HttpHeaders.COOKIE, properties.getCookie())
                .header(HttpHeaders.ORIGIN, properties.getBaseUrl())
                .header(HttpHeaders.REFERER, consoleUrl())
                .header("X-Requested-With", "XMLHttpRequest")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED_VALUE)
                .body(formBody(submitForm(params)))
                .build();
            return fetchClient.execute(request).map(response -> {
                JsonNode json = PlatformResponses.readJson(objectMapper, response, url);
                if ("error".equals(json.path("status").asText())) {
                    throw new FetchException("Sta.sh submit failed: " + json.path("error_code").asText() + " "
                        + json.path("error").asText() + ": " + json.path("error_description").asText(), url, null);
                }
                long itemId = json.path("itemid").asLong(0);
                if (itemId <= 0) {
                    throw new FetchException("Missing 'itemid' in Sta.sh submit response", url, null);
                }
                log.info("Resubmitted deviation {} as stash item {}", deviationId, itemId);
                return itemId;
            });
        });
    }

    public Mono<Long> submitFallback(long deviationId, Throwable t) {
        log.warn("DeviantArtStashClient.submit failed for deviation {}. Error: {}", deviationId, t.getMessage());
        if (t instanceof FetchException fetchException) {
            return Mono.error(fetchException);
        }
        return Mono.error(new FetchException("Sta.sh submission unavailable: " + t.getMessage(), null, null, t));
    }

    /**
     * Reads a stash item's page
     */
    public Mono<StashedDeviation> fetchStashed(long itemId) {
        String url = properties.getBaseUrl() + "/stash/0" + Long.toString(itemId, 36);
        FetchRequest request = FetchRequest.builder()
            .url(url)
            .header(HttpHeaders.ACCEPT, MediaType.TEXT_HTML_VALUE)
            .header(HttpHeaders.REFERER, properties.getBaseUrl() + "/")
            .build();
        return fetchClient.execute(request).map(response -> parseStashPage(response.bodyAsString(), itemId, url));
    }

    StashedDeviation parseStashPage(String html, long itemId, String url) {
        Matcher matcher = INITIAL_STATE.matcher(html);
        if (!matcher.find()) {
            throw new FetchException("Could not find initial state on stash page", url, null);
        }
        JsonNode entities;
        try {
            String stateJson = objectMapper.readValue(matcher.group(1), String.class);
            entities = objectMapper.readTree(stateJson).path("@@entities");
        } catch (JsonProcessingException e) {
            throw new FetchException("Malformed initial state on stash page: " + e.getOriginalMessage(), url, null, e);
        }

        JsonNode deviation = null;
        for (JsonNode candidate : entities.path("deviation")) {
            if (candidate.path("deviationId").asLong() == itemId || candidate.path("stashPrivateid").asLong() == itemId) {
                deviation = candidate;
                break;
            }
        }
        if (deviation == null) {
            throw new FetchException("Stash page does not describe item " + itemId, url, null);
        }

        String deviationKey = deviation.path("deviationId").asText();
        JsonNode originalFile = entities.path("deviationExtended").path(deviationKey).path("originalFile");
        OriginalFileDescriptor original = new OriginalFileDescriptor(
            originalFile.path("type").asText(null),
            PlatformResponses.requireInt(originalFile, "width", url),
            PlatformResponses.requireInt(originalFile, "height", url),
            originalFile.hasNonNull("filesize") ? originalFile.path("filesize").asLong() : null);

        return new StashedDeviation(itemId, fullview(deviation.path("media")), original);
    }

    private ViewerMedia fullview(JsonNode media) {
        JsonNode chosen = null;
        for (String wanted : List.of(FULLVIEW_UNPUBLISHED, FULLVIEW)) {
            for (JsonNode type : media.path("types")) {
                if (wanted.equals(type.path("t").asText())) {
                    chosen = type;
                    break;
                }
            }
            if (chosen != null) {
                break;
            }
        }
        if (chosen == null || !media.hasNonNull("baseUri")) {
            return null;
        }
        List<String> tokens = new ArrayList<>();
        media.path("token").forEach(token -> tokens.add(token.asText()));
        return ViewerMedia.builder()
            .baseUri(media.path("baseUri").asText())
            .prettyName(media.path("prettyName").asText(null))
            .tokens(tokens)
            .width(chosen.path("w").asInt())
            .height(chosen.path("h").asInt())
            .tokenIndex(chosen.path("r").asInt(-1))
            .build();
    }

    private Mono<Map<String, String>> fetchSubmitTokens() {
        String url = consoleUrl();
        FetchRequest request = FetchRequest.builder()
            .url(url)
            .header(HttpHeaders.ACCEPT, MediaType.TEXT_HTML_VALUE)
            .header(HttpHeaders.COOKIE, properties.getCookie())
            .header(HttpHeaders.ORIGIN, properties.getBaseUrl())
            .build();
        return fetchClient.execute(request).map(response -> {
            String html = response.bodyAsString();
            Map<String, String> tokens = new LinkedHashMap<>();
            for (String name : List.of("validate_token", "validate_key")) {
                String value = inputValue(html, name);
                if (value == null) {
                    throw new FetchException("Could not find '" + name + "' on the API console; the account cookie may be invalid",
                        url, response.getStatus());
                }
                tokens.put(name, value);
            }
            return tokens;
        });
    }

    /**
     * Value attribute of the named input, in either attribute order
     */
    static String inputValue(String html, String name) {
        Matcher input = Pattern.compile("<input[^>]*\\bname=\"" + Pattern.quote(name) + "\"[^>]*>").matcher(html);
        if (!input.find()) {
            return null;
        }
        Matcher value = Pattern.compile("\\bvalue=\"([^\"]*)\"").matcher(input.group());
        return value.find() ? HtmlUtils.htmlUnescape(value.group(1)) : null;
    }

    private String consoleUrl() {
        return properties.getBaseUrl() + "/developers/console/stash/stash_submit/" + properties.getStashConsoleApp();
    }

    private Map<String, String> submitForm(Map<String, String> params) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("endpoint", "/stash/submit");
        form.put("params", toParamList(params));
        return form;
    }

    private String toParamList(Map<String, String> params) {
        List<Map<String, String>> list = new ArrayList<>();
        params.forEach((name, value) -> {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("name", name);
            entry.put("value", value);
            list.add(entry);
        });
        try {
            return objectMapper.writeValueAsString(list);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable stash parameters", e);
        }
    }

    private static byte[] formBody(Map<String, String> fields) {
        StringBuilder body = new StringBuilder();
        fields.forEach((name, value) -> {
            if (body.length() > 0) {
                body.append('&');
            }
            body.append(URLEncoder.encode(name, StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(value, StandardCharsets.UTF_8));
        });
        return body.toString().getBytes(StandardCharsets.UTF_8);
    }
}
