package com.weather.gateway.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Value object representing rounded coordinates used in cache keys and upstream requests.
 */
@Getter
@EqualsAndHashCode
@ToString
public class CanonicalCoordinates {
    private final BigDecimal lat;
    private final BigDecimal lon;

    public CanonicalCoordinates(BigDecimal lat, BigDecimal lon) {
        if (lat == null || lon == null) {
            throw new IllegalArgumentException("Canonical latitude and longitude must not be null");
        }
        this.lat = lat;
        this.lon = lon;
    }
}
