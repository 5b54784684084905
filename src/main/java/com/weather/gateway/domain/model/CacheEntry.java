package com.weather.gateway.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Immutable cache entry. {@code storedAt} is the instant the source fetch started;
 * {@code freshUntil} is {@code storedAt} plus the configured TTL.
 */
@Value
public class CacheEntry {
    WeatherPayload payload;
    Instant storedAt;
    Instant freshUntil;

    public boolean isFreshAt(Instant now) {
        return now.isBefore(freshUntil);
    }
}
