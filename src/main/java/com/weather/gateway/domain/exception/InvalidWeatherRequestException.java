package com.weather.gateway.domain.exception;

/**
 * Thrown when a weather request carries out-of-range coordinates or forecast horizon.
 * Raised before the cache or the upstream provider is consulted.
 */
public class InvalidWeatherRequestException extends IllegalArgumentException {

    public InvalidWeatherRequestException(String message) {
        super(message);
    }
}
