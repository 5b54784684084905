package com.weather.gateway.infrastructure.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weather.gateway.application.port.out.UpstreamException;
import com.weather.gateway.application.port.out.UpstreamException.Reason;
import com.weather.gateway.application.port.out.WeatherProviderClient;
import com.weather.gateway.domain.model.RawWeatherPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * Client for the OpenWeather free tier (API 2.5).
 * Handles request building, HTTP calls, and classification of failures.
 * Returns the parsed JSON body untouched; normalization happens elsewhere.
 */
@Service
public class OpenWeatherClient implements WeatherProviderClient {

    private static final Logger logger = LoggerFactory.getLogger(OpenWeatherClient.class);

    static final String CURRENT_PATH = "/data/2.5/weather";
    static final String FORECAST_PATH = "/data/2.5/forecast";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String apiKey;
    private final String units;
    private final Duration timeout;

    @Autowired
    public OpenWeatherClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        Clock clock,
        @Value("${app.openweather.api-url:https://api.openweathermap.org}") String apiUrl,
        @Value("${app.openweather.api-key:}") String apiKey,
        @Value("${app.openweather.units:metric}") String units,
        @Value("${app.openweather.timeout-seconds:10}") int timeoutSeconds
    ) {
        this(webClientBuilder, objectMapper, clock, apiUrl, apiKey, units, Duration.ofSeconds(timeoutSeconds));
    }

    public OpenWeatherClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        Clock clock,
        String apiUrl,
        String apiKey,
        String units,
        Duration timeout
    ) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.apiKey = apiKey;
        this.units = units;
        this.timeout = timeout;
        this.webClient = webClientBuilder.clone()
            .baseUrl(apiUrl)
            .build();
    }

    @Override
    public RawWeatherPayload fetchCurrent(double lat, double lon) {
        return fetch(CURRENT_PATH, "Current Weather", lat, lon);
    }

    /**
     * The free tier always returns five days of 3-hour samples; the horizon is
     * applied during normalization.
     */
    @Override
    public RawWeatherPayload fetchForecast(double lat, double lon, int horizonDays) {
        return fetch(FORECAST_PATH, "Forecast", lat, lon);
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    private RawWeatherPayload fetch(String path, String apiName, double lat, double lon) {
        if (!isConfigured()) {
            logger.error("OpenWeather API key is not configured, cannot call {} API", apiName);
            throw new UpstreamException(Reason.TRANSPORT, "OpenWeather API key not configured");
        }

        long startNanos = System.nanoTime();
        String responseBody;
        try {
            responseBody = webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path(path)
                    .queryParam("lat", lat)
                    .queryParam("lon", lon)
                    .queryParam("appid", apiKey)
                    .queryParam("units", units)
                    .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new UpstreamException(Reason.TIMEOUT,
                    "OpenWeather " + apiName + " API did not respond within " + timeout.toMillis() + "ms", e))
                .block();
        } catch (UpstreamException e) {
            logger.warn("OpenWeather {} API timed out after {}ms", apiName, timeout.toMillis());
            throw e;
        } catch (WebClientResponseException e) {
            throw statusFailure(apiName, e);
        } catch (WebClientException e) {
            logger.error("Failed to connect to OpenWeather {} API", apiName, e);
            throw new UpstreamException(Reason.TRANSPORT, "Failed to connect to OpenWeather API", e);
        } catch (RuntimeException e) {
            logger.error("Unexpected error calling OpenWeather {} API", apiName, e);
            throw new UpstreamException(Reason.TRANSPORT, "Unexpected error calling OpenWeather API", e);
        }

        logger.info("OpenWeather {} API responded in {}ms", apiName, (System.nanoTime() - startNanos) / 1_000_000);
        return new RawWeatherPayload(parseBody(apiName, responseBody), clock.instant());
    }

    /**
     * Parse the body into a JSON object tree. Anything else is a malformed response.
     */
    private JsonNode parseBody(String apiName, String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            logger.error("OpenWeather {} API returned an empty body", apiName);
            throw new UpstreamException(Reason.MALFORMED_RESPONSE, "OpenWeather API returned an empty body");
        }
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            if (root == null || !root.isObject()) {
                throw new UpstreamException(Reason.MALFORMED_RESPONSE, "OpenWeather API response is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse OpenWeather {} API response", apiName, e);
            throw new UpstreamException(Reason.MALFORMED_RESPONSE, "Failed to parse OpenWeather API response", e);
        }
    }

    private UpstreamException statusFailure(String apiName, WebClientResponseException e) {
        int status = e.getStatusCode().value();
        logger.error("OpenWeather {} API returned error: {} - {}", apiName, status, e.getResponseBodyAsString());

        Reason reason;
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            reason = Reason.RATE_LIMITED;
        } else if (status == HttpStatus.NOT_FOUND.value() || status == HttpStatus.BAD_REQUEST.value()) {
            reason = Reason.NOT_FOUND;
        } else {
            reason = Reason.TRANSPORT;
        }
        return new UpstreamException(reason, "OpenWeather API error: " + status, status, e);
    }
}
