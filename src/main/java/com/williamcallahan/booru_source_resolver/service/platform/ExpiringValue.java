package com.williamcallahan.booru_source_resolver.service.platform;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * A value paired with the instant it stops being usable.
 */
public final class ExpiringValue<T> {

    private final T value;
    private final Instant expiresAt;

    public ExpiringValue(T value, Instant expiresAt) {
        this.value = value;
        this.expiresAt = expiresAt;
    }

    public static <T> ExpiringValue<T> of(T value, Duration ttl, Clock clock) {
        return new ExpiringValue<>(value, clock.instant().plus(ttl));
    }

    public static <T> ExpiringValue<T> permanent(T value) {
        return new ExpiringValue<>(value, Instant.MAX);
    }

    public T getValue() {
        return value;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
