package com.z254.prism.client.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.prism.client.AuditQueryClient;
import com.z254.prism.config.PrismProperties;
import com.z254.prism.correlation.ChangeEvent;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * WebClient-based implementation of AuditQueryClient over {@code /setting/accesslogs}.
 */
@Component
@Slf4j
public class WebClientAuditQueryClient extends MonitoringApiSupport implements AuditQueryClient {

    static final String COLLABORATOR = "audit-log";

    private static final String UNKNOWN = "unknown";

    public WebClientAuditQueryClient(WebClient monitoringWebClient, PrismProperties prismProperties) {
        super(monitoringWebClient, prismProperties);
    }

    @Override
    @CircuitBreaker(name = "monitoring-api")
    @Retry(name = "monitoring-api")
    public Mono<List<ChangeEvent>> fetchChangesSince(long startEpoch, int size) {
        return getJson(COLLABORATOR, builder -> builder.path("/setting/accesslogs")
                .queryParam("filter", "{filter}")
                .queryParam("sort", "-happenedOn")
                .queryParam("size", size)
                .build("happenedOn>:" + startEpoch))
                .map(body -> items(body).stream()
                        .map(WebClientAuditQueryClient::toChange)
                        .toList())
                .doOnSuccess(changes -> log.debug("Fetched {} audit entries since {}", changes.size(), startEpoch));
    }

    static ChangeEvent toChange(JsonNode item) {
        return new ChangeEvent(
                text(item, "id", "id", null),
                item.path("happenedOn").asLong(0),
                text(item, "username", "userName", UNKNOWN),
                text(item, "description", "description", UNKNOWN));
    }
}
