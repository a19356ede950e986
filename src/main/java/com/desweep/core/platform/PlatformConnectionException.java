package com.desweep.core.platform;

/**
 * The platform cannot be reached or authenticated against at all. The only
 * failure that aborts a metadata load.
 */
public class PlatformConnectionException extends RuntimeException {

    public PlatformConnectionException(String message) {
        super(message);
    }

    public PlatformConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
