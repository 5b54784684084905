package com.weather.gateway.domain.model;

/**
 * Normalized, provider-agnostic weather data as stored in the cache and returned to callers.
 * The freshness markers are applied when a payload is served; stored payloads carry neither.
 */
public interface WeatherPayload {

    String getProvider();

    String getTimestamp();

    boolean isCached();

    boolean isStale();

    /**
     * Copy of this payload with the given freshness markers. All other fields are unchanged.
     */
    WeatherPayload withFreshness(boolean cached, boolean stale);
}
