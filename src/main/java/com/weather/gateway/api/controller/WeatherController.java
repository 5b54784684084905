package com.weather.gateway.api.controller;

import com.weather.gateway.api.dto.CoordinatesDto;
import com.weather.gateway.api.dto.ForecastRequestDto;
import com.weather.gateway.application.port.in.ResolveWeatherUseCase;
import com.weather.gateway.domain.model.NormalizedForecast;
import com.weather.gateway.domain.model.NormalizedWeather;
import com.weather.gateway.domain.model.WeatherQuery;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for current weather and forecast endpoints.
 * Only parses input and serializes results; caching and fallback live in the use case.
 */
@RestController
public class WeatherController {

    private static final Logger logger = LoggerFactory.getLogger(WeatherController.class);

    private final ResolveWeatherUseCase resolveWeatherUseCase;

    public WeatherController(ResolveWeatherUseCase resolveWeatherUseCase) {
        this.resolveWeatherUseCase = resolveWeatherUseCase;
    }

    /**
     * GET /weather/{lat}/{lon}
     * 
     * @return Current conditions with cached/stale markers
     */
    @GetMapping("/weather/{lat}/{lon}")
    public ResponseEntity<NormalizedWeather> getWeather(@PathVariable double lat, @PathVariable double lon) {
        logger.info("Querying current weather: lat={}, lon={}", lat, lon);
        return ResponseEntity.ok(resolveWeatherUseCase.getCurrentWeather(lat, lon));
    }

    /**
     * POST /weather
     * 
     * Body: {"lat": 12.9716, "lon": 77.5946}
     */
    @PostMapping("/weather")
    public ResponseEntity<NormalizedWeather> postWeather(@Valid @RequestBody CoordinatesDto request) {
        logger.info("Querying current weather: lat={}, lon={}", request.getLat(), request.getLon());
        return ResponseEntity.ok(resolveWeatherUseCase.getCurrentWeather(request.getLat(), request.getLon()));
    }

    /**
     * GET /forecast/{lat}/{lon}
     * 
     * @return 5-day forecast
     */
    @GetMapping("/forecast/{lat}/{lon}")
    public ResponseEntity<NormalizedForecast> getForecast(@PathVariable double lat, @PathVariable double lon) {
        logger.info("Querying forecast: lat={}, lon={}, days={}", lat, lon, WeatherQuery.DEFAULT_HORIZON_DAYS);
        return ResponseEntity.ok(resolveWeatherUseCase.getForecast(lat, lon, WeatherQuery.DEFAULT_HORIZON_DAYS));
    }

    /**
     * GET /forecast/{lat}/{lon}/{days}
     * 
     * @param days Number of days (1-5)
     */
    @GetMapping("/forecast/{lat}/{lon}/{days}")
    public ResponseEntity<NormalizedForecast> getForecastForDays(
            @PathVariable double lat,
            @PathVariable double lon,
            @PathVariable int days) {
        logger.info("Querying forecast: lat={}, lon={}, days={}", lat, lon, days);
        return ResponseEntity.ok(resolveWeatherUseCase.getForecast(lat, lon, days));
    }

    /**
     * POST /forecast
     * 
     * Body: {"lat": 28.7041, "lon": 77.1025, "days": 5}
     */
    @PostMapping("/forecast")
    public ResponseEntity<NormalizedForecast> postForecast(@Valid @RequestBody ForecastRequestDto request) {
        logger.info("Querying forecast: lat={}, lon={}, days={}", request.getLat(), request.getLon(), request.getDays());
        return ResponseEntity.ok(resolveWeatherUseCase.getForecast(request.getLat(), request.getLon(), request.getDays()));
    }
}
