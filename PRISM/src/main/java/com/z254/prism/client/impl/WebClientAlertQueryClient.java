package com.z254.prism.client.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.prism.client.AlertQueryClient;
import com.z254.prism.config.PrismProperties;
import com.z254.prism.correlation.AlertEvent;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * WebClient-based implementation of AlertQueryClient over {@code /alert/alerts}.
 */
@Component
@Slf4j
public class WebClientAlertQueryClient extends MonitoringApiSupport implements AlertQueryClient {

    static final String COLLABORATOR = "alerts";

    public WebClientAlertQueryClient(WebClient monitoringWebClient, PrismProperties prismProperties) {
        super(monitoringWebClient, prismProperties);
    }

    @Override
    @CircuitBreaker(name = "monitoring-api")
    @Retry(name = "monitoring-api")
    public Mono<List<AlertEvent>> fetchAlertsSince(long startEpoch, int size) {
        return query("startEpoch>:" + startEpoch, size)
                .doOnSuccess(alerts -> log.debug("Fetched {} alerts since {}", alerts.size(), startEpoch));
    }

    @Override
    @CircuitBreaker(name = "monitoring-api")
    @Retry(name = "monitoring-api")
    public Mono<List<AlertEvent>> fetchAlertsSince(long startEpoch, String deviceName, Long groupId, int size) {
        StringBuilder filter = new StringBuilder("startEpoch>:").append(startEpoch);
        if (deviceName != null && !deviceName.isBlank()) {
            filter.append(",monitorObjectName~").append(quote(deviceName));
        }
        if (groupId != null) {
            filter.append(",hostGroupIds~").append(groupId);
        }
        return query(filter.toString(), size);
    }

    @Override
    @CircuitBreaker(name = "monitoring-api")
    @Retry(name = "monitoring-api")
    public Mono<List<AlertEvent>> fetchActiveAlerts(long deviceId, int size) {
        return query("monitorObjectId:" + deviceId + ",cleared:false", size);
    }

    private Mono<List<AlertEvent>> query(String filter, int size) {
        return getJson(COLLABORATOR, builder -> builder.path("/alert/alerts")
                .queryParam("filter", "{filter}")
                .queryParam("size", size)
                .build(filter))
                .map(body -> items(body).stream()
                        .map(WebClientAlertQueryClient::toAlert)
                        .toList());
    }

    static AlertEvent toAlert(JsonNode item) {
        return new AlertEvent(
                text(item, "id", "internalId", null),
                longOrNull(item, "monitorObjectId", "deviceId"),
                text(item, "monitorObjectName", "deviceDisplayName", null),
                text(item, "resourceTemplateName", "dataSourceName", null),
                text(item, "dataPointName", "dataPoint", null),
                item.path("startEpoch").asLong(0),
                item.path("endEpoch").asLong(0),
                item.path("severity").asInt(0));
    }

    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
