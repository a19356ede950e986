package com.desweep.core.platform;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class PlatformConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient platformHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Bean
    public RetryPolicy platformRetryPolicy(PlatformProperties properties) {
        return RetryPolicy.from(properties.getRetry());
    }

    @Bean
    public AccessTokenProvider accessTokenProvider(PlatformProperties properties, HttpClient platformHttpClient,
                                                   ObjectMapper objectMapper, Clock clock) {
        return new ClientCredentialsTokenProvider(properties, platformHttpClient, objectMapper, clock);
    }

    @Bean
    public PlatformApiClient platformApiClient(PlatformProperties properties, AccessTokenProvider tokenProvider,
                                               HttpClient platformHttpClient, ObjectMapper objectMapper,
                                               RetryPolicy platformRetryPolicy) {
        return new PlatformApiClient(properties, tokenProvider, platformHttpClient, objectMapper, platformRetryPolicy);
    }

    @Bean
    public MetadataSourceClient metadataSourceClient(PlatformApiClient platformApiClient,
                                                     PlatformProperties properties) {
        return new RestMetadataSourceClient(platformApiClient, properties);
    }
}
