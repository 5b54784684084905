package com.weather.gateway.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * Current conditions in the internal schema: metric units, ISO-8601 observation time.
 */
@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"temperature", "humidity", "rainfall", "wind_speed", "description",
    "provider", "cached", "stale", "timestamp"})
public class NormalizedWeather implements WeatherPayload {

    @JsonProperty("temperature")
    double temperature;

    @JsonProperty("humidity")
    int humidity;

    @JsonProperty("rainfall")
    double rainfall;

    @JsonProperty("wind_speed")
    double windSpeed;

    @JsonProperty("description")
    String description;

    @JsonProperty("provider")
    String provider;

    @JsonProperty("cached")
    boolean cached;

    @JsonProperty("stale")
    boolean stale;

    @JsonProperty("timestamp")
    String timestamp;

    @Override
    public NormalizedWeather withFreshness(boolean cached, boolean stale) {
        return toBuilder().cached(cached).stale(stale).build();
    }
}
