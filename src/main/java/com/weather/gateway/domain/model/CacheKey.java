package com.weather.gateway.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Cache key built from canonical coordinates, data kind and, for forecasts, the horizon.
 */
@Getter
@EqualsAndHashCode
public class CacheKey {
    private final BigDecimal lat;
    private final BigDecimal lon;
    private final DataKind kind;
    private final int horizonDays;

    public CacheKey(CanonicalCoordinates coordinates, DataKind kind, int horizonDays) {
        this.lat = coordinates.getLat();
        this.lon = coordinates.getLon();
        this.kind = kind;
        this.horizonDays = kind == DataKind.FORECAST ? horizonDays : 0;
    }

    @Override
    public String toString() {
        String endpoint = kind == DataKind.FORECAST ? kind.label() + "_" + horizonDays : kind.label();
        return lat.toPlainString() + "|" + lon.toPlainString() + "|" + endpoint;
    }
}
