package com.weather.gateway.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Daily forecast in the internal schema, ordered by date ascending.
 */
@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"forecast", "provider", "cached", "stale", "timestamp"})
public class NormalizedForecast implements WeatherPayload {

    @Singular("day")
    @JsonProperty("forecast")
    List<DailyForecast> forecast;

    @JsonProperty("provider")
    String provider;

    @JsonProperty("cached")
    boolean cached;

    @JsonProperty("stale")
    boolean stale;

    @JsonProperty("timestamp")
    String timestamp;

    @Override
    public NormalizedForecast withFreshness(boolean cached, boolean stale) {
        return toBuilder().cached(cached).stale(stale).build();
    }
}
