package com.desweep.core.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;

/**
 * OAuth2 client-credentials grant against the platform auth endpoint, with the
 * token cached until shortly before expiry.
 */
public class ClientCredentialsTokenProvider implements AccessTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(ClientCredentialsTokenProvider.class);

    /** Refresh this many seconds before the reported expiry. */
    private static final long EXPIRY_BUFFER_SECONDS = 300;

    private final PlatformProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private AccessToken token;

    public ClientCredentialsTokenProvider(PlatformProperties properties, HttpClient httpClient,
                                          ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public synchronized AccessToken getToken() {
        if (token != null && token.isValidAt(clock.instant())) {
            return token;
        }
        if (!properties.isConfigured()) {
            throw new PlatformConnectionException(
                    "Platform credentials not configured. Set DESWEEP_PLATFORM_CLIENT_ID, "
                            + "DESWEEP_PLATFORM_CLIENT_SECRET, DESWEEP_PLATFORM_ACCOUNT_ID and DESWEEP_PLATFORM_AUTH_URL.");
        }

        var body = objectMapper.createObjectNode();
        body.put("grant_type", "client_credentials");
        body.put("client_id", properties.getClientId());
        body.put("client_secret", properties.getClientSecret());
        body.put("account_id", properties.getAccountId());

        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(trimSlash(properties.getAuthUrl()) + "/v2/token"))
                    .timeout(properties.requestTimeout())
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                    .build();

            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new PlatformConnectionException("Token request failed (HTTP %d): %s"
                        .formatted(response.statusCode(), response.body()));
            }

            JsonNode json = objectMapper.readTree(response.body());
            long expiresIn = json.path("expires_in").asLong(1200);
            Instant expiresAt = clock.instant().plusSeconds(Math.max(expiresIn - EXPIRY_BUFFER_SECONDS, 10));
            String restUrl = json.path("rest_instance_url").asText(properties.getRestUrl());
            token = new AccessToken(json.path("access_token").asText(), trimSlash(restUrl), expiresAt);

            log.info("Obtained platform access token (expires in {}s)", expiresIn);
            return token;
        } catch (IOException e) {
            throw new PlatformConnectionException("Cannot reach platform auth endpoint: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformConnectionException("Interrupted while requesting access token", e);
        }
    }

    static String trimSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
