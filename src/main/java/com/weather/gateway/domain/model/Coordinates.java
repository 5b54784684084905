package com.weather.gateway.domain.model;

import com.weather.gateway.domain.exception.InvalidWeatherRequestException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value object representing a geographic coordinate pair, in degrees.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Coordinates {
    private final double lat;
    private final double lon;

    public Coordinates(double lat, double lon) {
        if (Double.isNaN(lat) || lat < -90.0 || lat > 90.0) {
            throw new InvalidWeatherRequestException("Latitude must be between -90 and 90, got " + lat);
        }
        if (Double.isNaN(lon) || lon < -180.0 || lon > 180.0) {
            throw new InvalidWeatherRequestException("Longitude must be between -180 and 180, got " + lon);
        }
        this.lat = lat;
        this.lon = lon;
    }
}
