package com.z254.prism.client.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.prism.client.TopologyClient;
import com.z254.prism.config.PrismProperties;
import com.z254.prism.topology.GraphNode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * WebClient-based implementation of TopologyClient.
 * Queries {@code /topology/devices/{id}/neighbors} and {@code /device/devices/{id}/neighbors}.
 */
@Component
@Slf4j
public class WebClientTopologyClient extends MonitoringApiSupport implements TopologyClient {

    static final String COLLABORATOR = "topology";

    private final int pageSize;

    public WebClientTopologyClient(WebClient monitoringWebClient, PrismProperties prismProperties) {
        super(monitoringWebClient, prismProperties);
        this.pageSize = prismProperties.getTopology().getNeighborPageSize();
    }

    @Override
    @CircuitBreaker(name = "monitoring-api")
    @Retry(name = "monitoring-api")
    public Mono<List<GraphNode>> getTopologyNeighbors(long deviceId) {
        return neighbors("/topology/devices/{id}/neighbors", deviceId);
    }

    @Override
    @CircuitBreaker(name = "monitoring-api")
    @Retry(name = "monitoring-api")
    public Mono<List<GraphNode>> getDeviceNeighbors(long deviceId) {
        return neighbors("/device/devices/{id}/neighbors", deviceId);
    }

    private Mono<List<GraphNode>> neighbors(String path, long deviceId) {
        return getJson(COLLABORATOR, builder -> builder.path(path)
                .queryParam("size", pageSize)
                .build(deviceId))
                .map(body -> items(body).stream()
                        .map(WebClientTopologyClient::toNode)
                        .toList());
    }

    static GraphNode toNode(JsonNode item) {
        return new GraphNode(
                longOrNull(item, "id", "deviceId"),
                text(item, "displayName", "name", null));
    }
}
