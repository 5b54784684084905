package com.weather.gateway.application.port.in;

import com.weather.gateway.domain.model.DataKind;
import com.weather.gateway.domain.model.NormalizedForecast;
import com.weather.gateway.domain.model.NormalizedWeather;
import com.weather.gateway.domain.model.WeatherPayload;

/**
 * Input port for resolving weather data.
 * Strategy: Cache-first → upstream fetch → stale fallback on failure
 */
public interface ResolveWeatherUseCase {

  /**
   * Resolve weather data for a location.
   *
   * @param lat Latitude (-90 to 90)
   * @param lon Longitude (-180 to 180)
   * @param kind Current conditions or forecast
   * @param horizonDays Forecast days (1 to 5, null for 5); ignored for current conditions
   * @return Normalized payload marked with its freshness
   */
  WeatherPayload resolve(double lat, double lon, DataKind kind, Integer horizonDays);

  NormalizedWeather getCurrentWeather(double lat, double lon);

  NormalizedForecast getForecast(double lat, double lon, Integer horizonDays);

  /**
   * Whether the upstream credential is configured. No network call.
   */
  boolean isConfigured();
}
