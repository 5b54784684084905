package com.weather.gateway.application.port.out;

import com.weather.gateway.domain.model.CacheKey;
import com.weather.gateway.domain.model.CacheLookup;
import com.weather.gateway.domain.model.WeatherPayload;

import java.time.Instant;

/**
 * Output port for the volatile weather cache.
 * Expired entries are kept so they can be served as stale fallback.
 */
public interface WeatherCacheStore {

  /**
   * Classify the entry for a key as fresh, stale or absent at the current instant.
   */
  CacheLookup get(CacheKey key);

  /**
   * Store or replace the entry for a key. Fresh-until becomes {@code storedAt} plus the TTL.
   *
   * @param storedAt Instant the fetch that produced the payload started
   * @return false if a newer entry was already present and the write was discarded
   */
  boolean put(CacheKey key, WeatherPayload payload, Instant storedAt);
}
