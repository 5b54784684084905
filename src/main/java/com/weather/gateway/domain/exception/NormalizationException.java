package com.weather.gateway.domain.exception;

/**
 * Thrown when a provider payload does not match the shape the normalizer expects.
 * Usually means the provider changed its response contract.
 */
public class NormalizationException extends RuntimeException {

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
