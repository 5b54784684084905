package com.weather.gateway.domain.service;

import com.weather.gateway.domain.model.CacheKey;
import com.weather.gateway.domain.model.CanonicalCoordinates;
import com.weather.gateway.domain.model.Coordinates;
import com.weather.gateway.domain.model.WeatherQuery;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Domain service for canonicalizing coordinates.
 * 
 * Canonicalization Rule: Round half-up to 4 decimal places (~11m precision)
 * 
 * Rationale:
 * - Numerically equal coordinates written differently (12.97160, 12.9716) share a key
 * - Weather does not vary at the ~11m scale, so nearby requests share upstream budget
 * - Deterministic, so the same input always maps to the same cache key
 */
@Service
public class CoordinateCanonicalizer {

    private static final int DECIMAL_PLACES = 4;

    /**
     * Canonicalizes coordinates by rounding to 4 decimal places.
     * 
     * @param coordinates Validated coordinates
     * @return Coordinates rounded to 4 decimal places
     */
    public CanonicalCoordinates canonicalize(Coordinates coordinates) {
        return new CanonicalCoordinates(round(coordinates.getLat()), round(coordinates.getLon()));
    }

    /**
     * Builds the cache key for a validated query.
     * 
     * @param query Validated weather query
     * @return Key combining canonical coordinates, data kind and horizon
     */
    public CacheKey keyFor(WeatherQuery query) {
        return new CacheKey(canonicalize(query.getCoordinates()), query.getKind(), query.getHorizonDays());
    }

    private static BigDecimal round(double degrees) {
        // BigDecimal.valueOf uses the shortest decimal form of the double, not its binary expansion
        return BigDecimal.valueOf(degrees).setScale(DECIMAL_PLACES, RoundingMode.HALF_UP);
    }
}
