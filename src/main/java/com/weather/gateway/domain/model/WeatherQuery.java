package com.weather.gateway.domain.model;

import com.weather.gateway.domain.exception.InvalidWeatherRequestException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A validated request for one kind of weather data at one location.
 *
 * Horizon policy: forecasts accept 1 to 5 days and reject anything else;
 * an omitted horizon means 5 days. Current-weather queries ignore the horizon
 * and always carry 0.
 */
@Getter
@EqualsAndHashCode
@ToString
public class WeatherQuery {

    public static final int MIN_HORIZON_DAYS = 1;
    public static final int MAX_HORIZON_DAYS = 5;
    public static final int DEFAULT_HORIZON_DAYS = 5;

    private final Coordinates coordinates;
    private final DataKind kind;
    private final int horizonDays;

    private WeatherQuery(Coordinates coordinates, DataKind kind, int horizonDays) {
        this.coordinates = coordinates;
        this.kind = kind;
        this.horizonDays = horizonDays;
    }

    public static WeatherQuery of(double lat, double lon, DataKind kind, Integer horizonDays) {
        if (kind == null) {
            throw new InvalidWeatherRequestException("Data kind must not be null");
        }
        Coordinates coordinates = new Coordinates(lat, lon);
        if (kind == DataKind.CURRENT) {
            return new WeatherQuery(coordinates, kind, 0);
        }
        int days = horizonDays == null ? DEFAULT_HORIZON_DAYS : horizonDays;
        if (days < MIN_HORIZON_DAYS || days > MAX_HORIZON_DAYS) {
            throw new InvalidWeatherRequestException(
                "Forecast days must be between " + MIN_HORIZON_DAYS + " and " + MAX_HORIZON_DAYS + ", got " + days);
        }
        return new WeatherQuery(coordinates, kind, days);
    }

    public static WeatherQuery current(double lat, double lon) {
        return of(lat, lon, DataKind.CURRENT, null);
    }

    public static WeatherQuery forecast(double lat, double lon, Integer horizonDays) {
        return of(lat, lon, DataKind.FORECAST, horizonDays);
    }
}
