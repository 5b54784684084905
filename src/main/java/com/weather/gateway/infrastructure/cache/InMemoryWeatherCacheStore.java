package com.weather.gateway.infrastructure.cache;

import com.weather.gateway.application.port.out.WeatherCacheStore;
import com.weather.gateway.domain.model.CacheEntry;
import com.weather.gateway.domain.model.CacheKey;
import com.weather.gateway.domain.model.CacheLookup;
import com.weather.gateway.domain.model.WeatherPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-process weather cache backed by a {@link ConcurrentHashMap}.
 *
 * <p>Entries are immutable and replaced whole, so readers never see a partially
 * written entry. Writes to one key are serialized by {@code compute}; a write whose
 * fetch started before the current entry's store time is discarded, which keeps
 * fresh-until monotonically non-decreasing per key. Nothing is ever evicted: expiry
 * is decided at read time and expired entries remain available as stale fallback.
 */
public class InMemoryWeatherCacheStore implements WeatherCacheStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryWeatherCacheStore.class);

    private final ConcurrentMap<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public InMemoryWeatherCacheStore(Clock clock, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public CacheLookup get(CacheKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            logger.debug("Cache miss for key: {}", key);
            return CacheLookup.absent();
        }
        if (entry.isFreshAt(clock.instant())) {
            logger.debug("Cache hit for key: {}", key);
            return CacheLookup.fresh(entry);
        }
        logger.debug("Cache expired for key: {} (fresh until {})", key, entry.getFreshUntil());
        return CacheLookup.stale(entry);
    }

    @Override
    public boolean put(CacheKey key, WeatherPayload payload, Instant storedAt) {
        CacheEntry candidate = new CacheEntry(payload.withFreshness(false, false), storedAt, storedAt.plus(ttl));
        CacheEntry winner = entries.compute(key, (k, current) ->
            current != null && storedAt.isBefore(current.getStoredAt()) ? current : candidate);

        if (winner != candidate) {
            logger.debug("Discarded out-of-order write for key: {} (fetch started {}, current entry stored {})",
                key, storedAt, winner.getStoredAt());
            return false;
        }
        logger.debug("Cache populated for key: {}, fresh until {}", key, candidate.getFreshUntil());
        return true;
    }

    public int size() {
        return entries.size();
    }
}
