package com.williamcallahan.booru_source_resolver.service.platform;

import com.williamcallahan.booru_source_resolver.testutil.MutableClock;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CachedTokenTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final AtomicInteger refreshes = new AtomicInteger();

    private CachedToken<String> token(Duration ttl) {
        return new CachedToken<>("test token", () -> Mono.fromSupplier(() ->
            ExpiringValue.of("token-" + refreshes.incrementAndGet(), ttl, clock)), clock);
    }

    @Test
    void get_reusesValueUntilExpiry() {
        CachedToken<String> token = token(Duration.ofMinutes(5));

        assertThat(token.get().block()).isEqualTo("token-1");
        clock.advance(Duration.ofMinutes(4));
        assertThat(token.get().block()).isEqualTo("token-1");
        clock.advance(Duration.ofMinutes(1));
        assertThat(token.get().block()).isEqualTo("token-2");
    }

    @Test
    void get_concurrentReadersShareOneRefresh() {
        Sinks.One<ExpiringValue<String>> pending = Sinks.one();
        AtomicInteger calls = new AtomicInteger();
        CachedToken<String> token = new CachedToken<>("slow token", () -> {
            calls.incrementAndGet();
            return pending.asMono();
        }, clock);

        Mono<String> first = token.get();
        Mono<String> second = token.get();

        StepVerifier.create(Mono.zip(first, second))
            .then(() -> pending.tryEmitValue(ExpiringValue.permanent("shared")))
            .assertNext(pair -> {
                assertThat(pair.getT1()).isEqualTo("shared");
                assertThat(pair.getT2()).isEqualTo("shared");
            })
            .verifyComplete();

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void get_failedRefreshIsRetriedOnNextRead() {
        AtomicInteger calls = new AtomicInteger();
        CachedToken<String> token = new CachedToken<>("flaky token", () -> calls.incrementAndGet() == 1
            ? Mono.error(new IllegalStateException("refresh failed"))
            : Mono.just(ExpiringValue.permanent("recovered")), clock);

        StepVerifier.create(token.get()).expectError(IllegalStateException.class).verify();
        StepVerifier.create(token.get()).expectNext("recovered").verifyComplete();
    }

    @Test
    void invalidate_forcesRefresh() {
        CachedToken<String> token = token(Duration.ofHours(1));

        token.get().block();
        token.invalidate();

        assertThat(token.get().block()).isEqualTo("token-2");
    }
}
