package com.weather.gateway.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * One calendar day of an aggregated forecast.
 */
@Value
@Builder
@JsonPropertyOrder({"date", "temp_min", "temp_max", "humidity", "rainfall", "description"})
public class DailyForecast {

    @JsonProperty("date")
    String date;

    @JsonProperty("temp_min")
    double tempMin;

    @JsonProperty("temp_max")
    double tempMax;

    @JsonProperty("humidity")
    int humidity;

    @JsonProperty("rainfall")
    double rainfall;

    @JsonProperty("description")
    String description;
}
