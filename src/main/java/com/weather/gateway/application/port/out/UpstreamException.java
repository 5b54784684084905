package com.weather.gateway.application.port.out;

import lombok.Getter;

/**
 * Exception thrown when a call to the upstream weather provider fails.
 * The reason is what callers branch on; the status code is kept for logging.
 */
@Getter
public class UpstreamException extends RuntimeException {

    public enum Reason {
        /** No response within the configured request timeout. */
        TIMEOUT(true),
        /** Provider answered 429. */
        RATE_LIMITED(true),
        /** Provider rejected the location (400/404). */
        NOT_FOUND(false),
        /** Connection failure, missing credential, or any other non-2xx status. */
        TRANSPORT(true),
        /** Response body could not be parsed or violates the provider contract. */
        MALFORMED_RESPONSE(false);

        private final boolean retryable;

        Reason(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    private final Reason reason;
    private final Integer statusCode;

    public UpstreamException(Reason reason, String message) {
        this(reason, message, null, null);
    }

    public UpstreamException(Reason reason, String message, Throwable cause) {
        this(reason, message, null, cause);
    }

    public UpstreamException(Reason reason, String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = statusCode;
    }
}
