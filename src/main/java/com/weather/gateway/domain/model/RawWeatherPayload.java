package com.weather.gateway.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.time.Instant;

/**
 * Provider-shaped response body as parsed JSON, plus the instant it was received.
 * The tree is only read, never modified, after construction.
 */
@Value
public class RawWeatherPayload {
    JsonNode body;
    Instant receivedAt;
}
