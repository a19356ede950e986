package com.desweep.core.platform;

import java.time.Instant;

/**
 * Bearer token plus the REST base URL the platform issued it for.
 */
public record AccessToken(String value, String restInstanceUrl, Instant expiresAt) {

    public boolean isValidAt(Instant instant) {
        return value != null && instant.isBefore(expiresAt);
    }
}
