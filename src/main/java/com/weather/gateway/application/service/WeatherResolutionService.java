package com.weather.gateway.application.service;

import com.weather.gateway.application.port.in.ResolveWeatherUseCase;
import com.weather.gateway.application.port.out.UpstreamException;
import com.weather.gateway.application.port.out.UpstreamException.Reason;
import com.weather.gateway.application.port.out.WeatherCacheStore;
import com.weather.gateway.application.port.out.WeatherProviderClient;
import com.weather.gateway.domain.exception.NormalizationException;
import com.weather.gateway.domain.model.CacheEntry;
import com.weather.gateway.domain.model.CacheKey;
import com.weather.gateway.domain.model.CacheLookup;
import com.weather.gateway.domain.model.DataKind;
import com.weather.gateway.domain.model.NormalizedForecast;
import com.weather.gateway.domain.model.NormalizedWeather;
import com.weather.gateway.domain.model.RawWeatherPayload;
import com.weather.gateway.domain.model.WeatherPayload;
import com.weather.gateway.domain.model.WeatherQuery;
import com.weather.gateway.domain.service.CoordinateCanonicalizer;
import com.weather.gateway.domain.service.WeatherNormalizer;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Application service resolving weather requests.
 * Implements cache-first strategy with upstream refresh and stale fallback.
 *
 * Per request:
 * - Validate coordinates and horizon (nothing touched on failure)
 * - Fresh cache entry: serve it, no upstream call
 * - Stale or absent: fetch, normalize, store, serve
 * - Fetch or normalization failure: serve any cached entry marked stale,
 *   otherwise fail with {@link WeatherUnavailableException}
 *
 * Concurrent misses for the same key share a single upstream call.
 */
@Service
public class WeatherResolutionService implements ResolveWeatherUseCase {

    private static final Logger logger = LoggerFactory.getLogger(WeatherResolutionService.class);

    private final CoordinateCanonicalizer coordinateCanonicalizer;
    private final WeatherCacheStore cacheStore;
    private final WeatherProviderClient providerClient;
    private final WeatherNormalizer normalizer;
    private final Clock clock;
    private final ConcurrentMap<CacheKey, CompletableFuture<WeatherPayload>> inFlight = new ConcurrentHashMap<>();

    public WeatherResolutionService(
            CoordinateCanonicalizer coordinateCanonicalizer,
            WeatherCacheStore cacheStore,
            WeatherProviderClient providerClient,
            WeatherNormalizer normalizer,
            Clock clock) {
        this.coordinateCanonicalizer = coordinateCanonicalizer;
        this.cacheStore = cacheStore;
        this.providerClient = providerClient;
        this.normalizer = normalizer;
        this.clock = clock;
    }

    @Override
    public WeatherPayload resolve(double lat, double lon, DataKind kind, Integer horizonDays) {
        // Step 1: Validate; throws before any cache or upstream access
        WeatherQuery query = WeatherQuery.of(lat, lon, kind, horizonDays);
        CacheKey key = coordinateCanonicalizer.keyFor(query);

        // Step 2: Cache lookup
        CacheLookup lookup = cacheStore.get(key);
        if (lookup.isFresh()) {
            return lookup.getEntry().getPayload().withFreshness(true, false);
        }

        // Step 3: Stale or absent - go upstream
        try {
            return fetchShared(key, query).withFreshness(false, false);
        } catch (UpstreamException e) {
            logger.warn("Upstream {} failure for key: {}: {}", e.getReason(), key, e.getMessage());
            return fallback(key, e.getReason(), e);
        } catch (NormalizationException e) {
            logger.error("Provider payload rejected by normalizer for key: {} (provider contract change?): {}",
                    key, e.getMessage());
            return fallback(key, Reason.MALFORMED_RESPONSE, e);
        }
    }

    @Override
    public NormalizedWeather getCurrentWeather(double lat, double lon) {
        return (NormalizedWeather) resolve(lat, lon, DataKind.CURRENT, null);
    }

    @Override
    public NormalizedForecast getForecast(double lat, double lon, Integer horizonDays) {
        return (NormalizedForecast) resolve(lat, lon, DataKind.FORECAST, horizonDays);
    }

    @Override
    public boolean isConfigured() {
        return providerClient.isConfigured();
    }

    /**
     * Join the in-flight fetch for this key, or lead a new one.
     */
    private WeatherPayload fetchShared(CacheKey key, WeatherQuery query) {
        CompletableFuture<WeatherPayload> flight = new CompletableFuture<>();
        CompletableFuture<WeatherPayload> existing = inFlight.putIfAbsent(key, flight);
        if (existing != null) {
            logger.debug("Joining in-flight upstream fetch for key: {}", key);
            return await(existing);
        }

        try {
            WeatherPayload payload = fetchNormalizeAndStore(key, query);
            flight.complete(payload);
            return payload;
        } catch (RuntimeException | Error e) {
            // followers must never wait on a flight that will not complete
            flight.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, flight);
        }
    }

    private WeatherPayload fetchNormalizeAndStore(CacheKey key, WeatherQuery query) {
        Instant fetchStartedAt = clock.instant();
        double lat = key.getLat().doubleValue();
        double lon = key.getLon().doubleValue();

        logger.info("Cache miss or expired for key: {}, querying upstream provider", key);
        WeatherPayload payload;
        if (query.getKind() == DataKind.CURRENT) {
            RawWeatherPayload raw = providerClient.fetchCurrent(lat, lon);
            payload = normalizer.normalizeCurrent(raw);
        } else {
            RawWeatherPayload raw = providerClient.fetchForecast(lat, lon, query.getHorizonDays());
            payload = normalizer.normalizeForecast(raw, query.getHorizonDays());
        }

        // Only normalized payloads reach the cache
        cacheStore.put(key, payload, fetchStartedAt);
        return payload;
    }

    private WeatherPayload await(CompletableFuture<WeatherPayload> flight) {
        try {
            return flight.join();
        } catch (CompletionException e) {
            // rethrow what the leader saw so followers take the same fallback or error path
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Serve whatever the cache holds for the key now, or propagate the failure.
     * The cache is re-read because a concurrent request may have refreshed it.
     */
    private WeatherPayload fallback(CacheKey key, Reason reason, RuntimeException failure) {
        CacheLookup lookup = cacheStore.get(key);
        if (lookup.isAbsent()) {
            logger.error("No cached data to fall back on for key: {}", key);
            throw new WeatherUnavailableException(reason, failure);
        }

        CacheEntry entry = lookup.getEntry();
        if (lookup.isStale()) {
            logger.warn("Returning stale cache for key: {} (stored {}) due to upstream {} failure",
                    key, entry.getStoredAt(), reason);
            return entry.getPayload().withFreshness(true, true);
        }
        logger.info("Entry for key: {} was refreshed concurrently, serving it despite upstream {} failure",
                key, reason);
        return entry.getPayload().withFreshness(true, false);
    }

    /**
     * Exception thrown when the upstream fetch fails and nothing was ever cached for the key.
     */
    @Getter
    public static class WeatherUnavailableException extends RuntimeException {

        private final Reason reason;

        public WeatherUnavailableException(Reason reason, Throwable cause) {
            super(describe(reason) + ": " + cause.getMessage(), cause);
            this.reason = reason;
        }

        public boolean isRetryable() {
            return reason.isRetryable();
        }

        private static String describe(Reason reason) {
            return switch (reason) {
                case NOT_FOUND -> "Location rejected by weather provider";
                case MALFORMED_RESPONSE -> "Weather provider returned unusable data and no cached data exists";
                default -> "Weather provider temporarily unavailable and no cached data exists";
            };
        }
    }
}
