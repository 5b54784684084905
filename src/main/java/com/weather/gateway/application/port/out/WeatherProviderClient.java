package com.weather.gateway.application.port.out;

import com.weather.gateway.domain.model.RawWeatherPayload;

/**
 * Output port for the upstream weather provider.
 * Pure transport: no caching, no retries, no normalization.
 */
public interface WeatherProviderClient {

  /**
   * Fetch current conditions for the given coordinates.
   *
   * @throws UpstreamException if the call fails for any reason
   */
  RawWeatherPayload fetchCurrent(double lat, double lon);

  /**
   * Fetch the forecast time series for the given coordinates.
   *
   * @param horizonDays Requested horizon, 1 to 5
   * @throws UpstreamException if the call fails for any reason
   */
  RawWeatherPayload fetchForecast(double lat, double lon, int horizonDays);

  /**
   * Whether a provider credential is configured. Never touches the network.
   */
  boolean isConfigured();
}
