package com.desweep.core.platform;

/**
 * Supplies a valid bearer token for platform calls.
 */
public interface AccessTokenProvider {

    /**
     * @throws PlatformConnectionException if no token can be obtained
     */
    AccessToken getToken();
}
