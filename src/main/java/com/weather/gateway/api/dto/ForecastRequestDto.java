package com.weather.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;

/**
 * Request body for a forecast. Extends CoordinatesDto to reuse coordinate validation.
 */
@Getter
@Setter
@EqualsAndHashCode(callSuper = true)
public class ForecastRequestDto extends CoordinatesDto {

    @JsonProperty("days")
    @Min(value = 1, message = "days must be between 1 and 5")
    @Max(value = 5, message = "days must be between 1 and 5")
    private Integer days = 5;

    public ForecastRequestDto() {
        super();
    }

    public ForecastRequestDto(Double lat, Double lon, Integer days) {
        super(lat, lon);
        this.days = days;
    }
}
