package com.desweep.core.platform;

/**
 * A platform API call failed. Not retryable unless it is a {@link TransientNetworkException}.
 */
public class PlatformApiException extends RuntimeException {

    private final int statusCode;

    public PlatformApiException(String message) {
        this(message, 0, null);
    }

    public PlatformApiException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public PlatformApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status, or 0 when the failure happened below HTTP. */
    public int getStatusCode() {
        return statusCode;
    }
}
