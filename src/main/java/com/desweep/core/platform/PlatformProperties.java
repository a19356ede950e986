package com.desweep.core.platform;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "desweep.platform")
public class PlatformProperties {

    private String restUrl = "";
    private String authUrl = "";
    private String clientId = "";
    private String clientSecret = "";
    private String accountId = "";
    private int requestTimeoutSeconds = 60;
    private long rateLimitDelayMs = 200;
    private int pageSize = 500;
    private int journeyPageSize = 100;
    private Retry retry = new Retry();

    public String getRestUrl() { return restUrl; }
    public void setRestUrl(String restUrl) { this.restUrl = restUrl; }
    public String getAuthUrl() { return authUrl; }
    public void setAuthUrl(String authUrl) { this.authUrl = authUrl; }
    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }
    public String getClientSecret() { return clientSecret; }
    public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }
    public String getAccountId() { return accountId; }
    public void setAccountId(String accountId) { this.accountId = accountId; }
    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    public long getRateLimitDelayMs() { return rateLimitDelayMs; }
    public void setRateLimitDelayMs(long rateLimitDelayMs) { this.rateLimitDelayMs = rateLimitDelayMs; }
    public int getPageSize() { return pageSize; }
    public void setPageSize(int pageSize) { this.pageSize = pageSize; }
    public int getJourneyPageSize() { return journeyPageSize; }
    public void setJourneyPageSize(int journeyPageSize) { this.journeyPageSize = journeyPageSize; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    /**
     * Returns true when credentials and an account id are present.
     */
    public boolean isConfigured() {
        return notBlank(clientId) && notBlank(clientSecret) && notBlank(accountId)
                && notBlank(authUrl);
    }

    /** Account id used to key cache entries; "default" when unset. */
    public String cacheAccountKey() {
        return notBlank(accountId) ? accountId : "default";
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    public static class Retry {
        private int maxRetries = 3;
        private long baseDelayMs = 1000;
        private boolean respectRetryAfter = true;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
        public boolean isRespectRetryAfter() { return respectRetryAfter; }
        public void setRespectRetryAfter(boolean respectRetryAfter) { this.respectRetryAfter = respectRetryAfter; }
    }
}
