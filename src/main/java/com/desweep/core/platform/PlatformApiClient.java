package com.desweep.core.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * HTTP client for the platform REST API.
 *
 * <p>Every GET runs under the shared {@link RetryPolicy} and is followed by a fixed
 * rate-limit pause. Paginated collections are walked sequentially with
 * {@code $page}/{@code $pageSize}.
 */
public class PlatformApiClient {

    private static final Logger log = LoggerFactory.getLogger(PlatformApiClient.class);

    private final PlatformProperties properties;
    private final AccessTokenProvider tokenProvider;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;

    public PlatformApiClient(PlatformProperties properties, AccessTokenProvider tokenProvider,
                             HttpClient httpClient, ObjectMapper objectMapper, RetryPolicy retryPolicy) {
        this.properties = properties;
        this.tokenProvider = tokenProvider;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Obtains a token and confirms the REST base URL answers.
     *
     * @throws PlatformConnectionException if authentication or the first call fails
     */
    public void verifyConnectivity() {
        try {
            get("/platform/v1/tokenContext", Map.of());
        } catch (PlatformConnectionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PlatformConnectionException("Platform connectivity check failed: " + e.getMessage(), e);
        }
    }

    public JsonNode get(String path, Map<String, String> params) {
        String operation = "GET " + path;
        JsonNode result = retryPolicy.execute(operation, () -> sendGet(path, params));
        pauseForRateLimit();
        return result;
    }

    /**
     * Fetches every page of a collection.
     *
     * <p>Stops when {@code page * pageSize >= count} (if the response reports those
     * fields), when a page comes back empty, or when a page is shorter than requested.
     */
    public List<JsonNode> getAllPages(String path, String itemsKey, int pageSize) {
        List<JsonNode> all = new ArrayList<>();
        int page = 1;
        boolean hasMore = true;
        while (hasMore) {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("$page", String.valueOf(page));
            params.put("$pageSize", String.valueOf(pageSize));
            JsonNode response = get(path, params);

            JsonNode items = response.path(itemsKey);
            if (!items.isArray()) {
                items = response.isArray() ? response : response.path("items");
            }
            int received = 0;
            if (items.isArray()) {
                for (JsonNode item : items) {
                    all.add(item);
                    received++;
                }
            }

            if (response.hasNonNull("page") && response.hasNonNull("pageSize") && response.hasNonNull("count")) {
                hasMore = (long) response.get("page").asInt() * response.get("pageSize").asInt()
                        < response.get("count").asLong();
            } else {
                hasMore = received > 0 && received >= pageSize;
            }
            log.debug("Fetched {} page {}: {} items (total {})", path, page, received, all.size());
            page++;
        }
        return all;
    }

    private JsonNode sendGet(String path, Map<String, String> params) {
        AccessToken token = tokenProvider.getToken();
        String base = token.restInstanceUrl() != null && !token.restInstanceUrl().isBlank()
                ? token.restInstanceUrl()
                : ClientCredentialsTokenProvider.trimSlash(properties.getRestUrl());
        var request = HttpRequest.newBuilder()
                .uri(URI.create(base + path + query(params)))
                .timeout(properties.requestTimeout())
                .header("Authorization", "Bearer " + token.value())
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientNetworkException("Timed out: GET " + path, e);
        } catch (ConnectException e) {
            throw new PlatformApiException("Cannot connect to platform: GET " + path, e);
        } catch (IOException e) {
            if (isConnectionReset(e)) {
                throw new TransientNetworkException("Connection reset: GET " + path, e);
            }
            throw new PlatformApiException("Platform request failed: GET " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformApiException("Interrupted: GET " + path, e);
        }

        int status = response.statusCode();
        if (status == 429 || status == 503) {
            throw new TransientNetworkException("Platform GET %s returned HTTP %d".formatted(path, status),
                    status, retryAfter(response));
        }
        if (status >= 400) {
            throw new PlatformApiException("Platform GET %s failed (HTTP %d): %s"
                    .formatted(path, status, abbreviate(response.body())), status, null);
        }
        try {
            String body = response.body();
            return body == null || body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (IOException e) {
            throw new PlatformApiException("Unreadable response body: GET " + path, status, e);
        }
    }

    private void pauseForRateLimit() {
        long delay = properties.getRateLimitDelayMs();
        if (delay <= 0) return;
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformApiException("Interrupted during rate-limit pause", e);
        }
    }

    static Duration retryAfter(HttpResponse<?> response) {
        return response.headers().firstValue("Retry-After")
                .flatMap(value -> {
                    try {
                        return Optional.of(Duration.ofSeconds(Long.parseLong(value.trim())));
                    } catch (NumberFormatException e) {
                        log.debug("Ignoring non-numeric Retry-After header '{}'", value);
                        return Optional.empty();
                    }
                })
                .orElse(null);
    }

    private static boolean isConnectionReset(IOException e) {
        String message = e.getMessage();
        return message != null && message.toLowerCase().contains("reset");
    }

    private static String query(Map<String, String> params) {
        if (params == null || params.isEmpty()) return "";
        return params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&", "?", ""));
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
