package com.z254.prism.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Wiring for the monitoring REST API and the service clock.
 */
@Slf4j
@Configuration
public class MonitoringClientConfig {

    /**
     * Source of "now" for all look-back windows.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WebClient monitoringWebClient(WebClient.Builder webClientBuilder, PrismProperties prismProperties) {
        PrismProperties.Api api = prismProperties.getApi();

        WebClient.Builder builder = webClientBuilder
                .baseUrl(api.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(api.getMaxInMemorySize()));

        if (api.getBearerToken() != null && !api.getBearerToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + api.getBearerToken());
        } else {
            log.warn("No bearer token configured for monitoring API at {}", api.getBaseUrl());
        }

        return builder.build();
    }
}
