package com.williamcallahan.booru_source_resolver.service.fetch;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation shared by a group of requests. Firing is one-shot; requests subscribed
 * before or after the firing both complete empty.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Sinks.One<Boolean> sink = Sinks.one();

    /**
     * Fires the signal
     *
     * @return true if this call fired it, false if it was already fired
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        sink.tryEmitValue(Boolean.TRUE);
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Mono<Boolean> asMono() {
        return sink.asMono();
    }
}
