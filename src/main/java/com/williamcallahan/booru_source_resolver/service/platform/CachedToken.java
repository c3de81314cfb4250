/**
 * Lazily refreshed credential holder
 *
 * @author William Callahan
 *
 * Features:
 * - Refreshes on read once the held value has expired
 * - Concurrent readers during a refresh share the one in-flight refresh
 * - A failed refresh is not cached; the next read tries again
 * - No lock is held while the refresh runs
 */
package com.williamcallahan.booru_source_resolver.service.platform;

import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.function.Supplier;

public class CachedToken<T> {

    private final String name;
    private final Supplier<Mono<ExpiringValue<T>>> refresher;
    private final Clock clock;

    private ExpiringValue<T> current; // guarded by this
    private Mono<ExpiringValue<T>> inFlight; // guarded by this

    public CachedToken(String name, Supplier<Mono<ExpiringValue<T>>> refresher, Clock clock) {
        this.name = name;
        this.refresher = refresher;
        this.clock = clock;
    }

    public Mono<T> get() {
        return Mono.defer(() -> {
            synchronized (this) {
                if (current != null && !current.isExpiredAt(clock.instant())) {
                    return Mono.just(current.getValue());
                }
                if (inFlight == null) {
                    inFlight = Mono.defer(refresher)
                        .switchIfEmpty(Mono.error(() -> new IllegalStateException("Refresh of " + name + " produced no value")))
                        .doOnNext(this::store)
                        .doFinally(signal -> clearInFlight())
                        .cache();
                }
                return inFlight.map(ExpiringValue::getValue);
            }
        });
    }

    /**
     * Drops the held value so the next read refreshes
     */
    public synchronized void invalidate() {
        current = null;
    }

    private synchronized void store(ExpiringValue<T> value) {
        current = value;
    }

    private synchronized void clearInFlight() {
        inFlight = null;
    }
}
