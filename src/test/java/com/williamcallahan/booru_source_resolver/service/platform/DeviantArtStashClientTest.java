package com.williamcallahan.booru_source_resolver.service.platform;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.booru_source_resolver.config.ResolverConfigurationProperties;
import com.williamcallahan.booru_source_resolver.service.fetch.FetchRequest;
import com.williamcallahan.booru_source_resolver.service.fetch.RateLimitedFetchClient;
import com.williamcallahan.booru_source_resolver.testutil.PlatformPages;
import com.williamcallahan.booru_source_resolver.testutil.ResolverTestProperties;
import com.williamcallahan.booru_source_resolver.testutil.ScriptedHttpFetcher;
import com.williamcallahan.booru_source_resolver.types.FetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import reactor.test.StepVerifier;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class DeviantArtStashClientTest {

    private static final long ITEM_ID = 123456789L;
    private static final String CONSOLE = "https://da.example/developers/console/stash/stash_submit/0f1832daa6b58a05841ec6058520c4f3";
    private static final String PROXY = "https://da.example/developers/console/do_api_request";

    private ResolverConfigurationProperties properties;

    @BeforeEach
    void setUp() {
        properties = ResolverTestProperties.fast();
        properties.getDeviantart().setBaseUrl("https://da.example");
        properties.getDeviantart().setCookie("auth=secret");
    }

    private DeviantArtStashClient client(ScriptedHttpFetcher fetcher) {
        return new DeviantArtStashClient(new RateLimitedFetchClient(fetcher, properties, ResolverTestProperties.bulkheads()),
            new ObjectMapper(), properties);
    }

    @Test
    void submit_postsConsoleTokensAndReturnsItemId() {
        ScriptedHttpFetcher fetcher = new ScriptedHttpFetcher(request -> {
            if (request.getUrl().equals(CONSOLE)) {
                return ScriptedHttpFetcher.ok(PlatformPages.stashConsole("vt&amp;1", "vk2"));
            }
            if (request.getUrl().equals(PROXY)) {
                return ScriptedHttpFetcher.json(PlatformPages.stashSubmitted(ITEM_ID));
            }
            return ScriptedHttpFetcher.status(404);
        });

        StepVerifier.create(client(fetcher).submit(42L))
            .expectNext(ITEM_ID)
            .verifyComplete();

        FetchRequest post = fetcher.requests().get(1);
        assertThat(post.getMethod()).isEqualTo(HttpMethod.POST);
        assertThat(post.getHeaders()).containsEntry(HttpHeaders.COOKIE, "auth=secret").containsEntry(HttpHeaders.REFERER, CONSOLE);
        String form = URLDecoder.decode(new String(post.getBody(), StandardCharsets.UTF_8), StandardCharsets.UTF_8);
        assertThat(form)
            .startsWith("endpoint=/stash/submit&params=")
            .contains("{\"name\":\"validate_token\",\"value\":\"vt&1\"}")
            .contains("{\"name\":\"validate_key\",\"value\":\"vk2\"}")
            .contains("{\"name\":\"mature_content\",\"value\":\"true\"}")
            .contains("{\"name\":\"file\",\"value\":\"42\"}");
    }

    @Test
    void submit_apiErrorIsAFetchException() {
        ScriptedHttpFetcher fetcher = new ScriptedHttpFetcher(request -> request.getUrl().equals(CONSOLE)
            ? ScriptedHttpFetcher.ok(PlatformPages.stashConsole("vt", "vk"))
            : ScriptedHttpFetcher.json("{\"status\":\"error\",\"error\":\"invalid_request\","
                + "\"error_description\":\"File not found\",\"error_code\":1}"));

        StepVerifier.create(client(fetcher).submit(42L))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(FetchException.class);
                assertThat(error.getMessage()).contains("File not found");
            })
            .verify();
    }

    @Test
    void submit_consoleWithoutTokensMeansInvalidCookie() {
        ScriptedHttpFetcher fetcher = new ScriptedHttpFetcher(request ->
            ScriptedHttpFetcher.ok("<html>Log in</html>".getBytes(StandardCharsets.UTF_8)));

        StepVerifier.create(client(fetcher).submit(42L))
            .expectErrorMatches(error -> error instanceof FetchException && error.getMessage().contains("validate_token"))
            .verify();

        assertThat(fetcher.urls()).containsExactly(CONSOLE);
    }

    @Test
    void fetchStashed_readsFullviewAndOriginalFileFromInitialState() {
        String page = "https://da.example/stash/0" + Long.toString(ITEM_ID, 36);
        ScriptedHttpFetcher fetcher = new ScriptedHttpFetcher(request -> request.getUrl().equals(page)
            ? ScriptedHttpFetcher.ok(PlatformPages.stashPage(ITEM_ID, "https://images.example/f/s/stashed.png", "tok",
                4000, 3000, 4000, 3000, 123456L))
            : ScriptedHttpFetcher.status(404));

        StepVerifier.create(client(fetcher).fetchStashed(ITEM_ID))
            .assertNext(stashed -> {
                assertThat(stashed.itemId()).isEqualTo(ITEM_ID);
                assertThat(stashed.fullview().getBaseUri()).isEqualTo("https://images.example/f/s/stashed.png");
                assertThat(stashed.fullview().token()).isEqualTo("tok");
                assertThat(stashed.fullview().getWidth()).isEqualTo(4000);
                assertThat(stashed.originalFile().getType()).isEqualTo("png");
                assertThat(stashed.originalFile().getSize()).isEqualTo(123456L);
                assertThat(stashed.fullviewIsOriginalSize()).isTrue();
            })
            .verifyComplete();
    }

    @Test
    void fetchStashed_pageWithoutInitialStateIsAFetchException() {
        ScriptedHttpFetcher fetcher = new ScriptedHttpFetcher(request ->
            ScriptedHttpFetcher.ok("<html></html>".getBytes(StandardCharsets.UTF_8)));

        StepVerifier.create(client(fetcher).fetchStashed(ITEM_ID))
            .expectError(FetchException.class)
            .verify();
    }

    @Test
    void inputValue_readsEitherAttributeOrder() {
        String html = new String(PlatformPages.stashConsole("a1", "b2"), StandardCharsets.UTF_8);

        assertEquals("a1", DeviantArtStashClient.inputValue(html, "validate_token"));
        assertEquals("b2", DeviantArtStashClient.inputValue(html, "validate_key"));
        assertNull(DeviantArtStashClient.inputValue(html, "missing"));
    }

    @Test
    void isEnabled_requiresCookie() {
        properties.getDeviantart().setCookie(" ");

        assertFalse(client(new ScriptedHttpFetcher(request -> ScriptedHttpFetcher.status(404))).isEnabled());
    }
}
