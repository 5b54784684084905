package com.weather.gateway.infrastructure.cache;

import com.weather.gateway.application.port.out.WeatherCacheStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Cache configuration using a per-process in-memory store.
 * 
 * - Volatile: contents are lost on restart
 * - One TTL for every entry (CACHE_TTL, default 600 seconds)
 * - Expired entries are retained for stale fallback
 */
@Configuration
public class CacheConfig {

    @Value("${app.cache.ttl-seconds:600}")
    private long cacheTtlSeconds;

    @Bean
    public WeatherCacheStore weatherCacheStore(Clock clock) {
        return new InMemoryWeatherCacheStore(clock, Duration.ofSeconds(cacheTtlSeconds));
    }
}
