package com.desweep.core.platform;

import java.time.Duration;
import java.util.Optional;

/**
 * Retryable failure: connection timeout, connection reset, HTTP 429 or HTTP 503.
 */
public class TransientNetworkException extends PlatformApiException {

    private final Duration retryAfter;

    public TransientNetworkException(String message, int statusCode, Duration retryAfter) {
        super(message, statusCode, null);
        this.retryAfter = retryAfter;
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, 0, cause);
        this.retryAfter = null;
    }

    /** Server-provided "retry after" hint, if the response carried one. */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
