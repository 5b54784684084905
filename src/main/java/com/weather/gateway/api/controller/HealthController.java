package com.weather.gateway.api.controller;

import com.weather.gateway.api.dto.HealthResponseDto;
import com.weather.gateway.application.port.in.ResolveWeatherUseCase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health probe and service information. Neither endpoint calls the upstream provider.
 */
@RestController
public class HealthController {

    static final String SERVICE_NAME = "weather-gateway";

    private final ResolveWeatherUseCase resolveWeatherUseCase;
    private final long cacheTtlSeconds;

    public HealthController(
            ResolveWeatherUseCase resolveWeatherUseCase,
            @Value("${app.cache.ttl-seconds:600}") long cacheTtlSeconds) {
        this.resolveWeatherUseCase = resolveWeatherUseCase;
        this.cacheTtlSeconds = cacheTtlSeconds;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponseDto> health() {
        return ResponseEntity.ok(new HealthResponseDto(
                "healthy",
                SERVICE_NAME,
                resolveWeatherUseCase.isConfigured(),
                cacheTtlSeconds));
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("GET /", "This information page");
        endpoints.put("GET /health", "Health check");
        endpoints.put("POST /weather", "Get current weather (lat, lon)");
        endpoints.put("POST /forecast", "Get forecast (lat, lon, days)");
        endpoints.put("GET /weather/{lat}/{lon}", "Get current weather (URL params)");
        endpoints.put("GET /forecast/{lat}/{lon}", "Get 5-day forecast (URL params)");
        endpoints.put("GET /forecast/{lat}/{lon}/{days}", "Get N-day forecast (URL params)");

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("service", SERVICE_NAME);
        info.put("status", "operational");
        info.put("api_key_configured", resolveWeatherUseCase.isConfigured());
        info.put("cache_ttl", cacheTtlSeconds + " seconds");
        info.put("endpoints", endpoints);
        return ResponseEntity.ok(info);
    }
}
