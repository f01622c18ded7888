package com.z254.prism.client.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.prism.client.MetricQueryClient;
import com.z254.prism.config.PrismProperties;
import com.z254.prism.metrics.RawMetricData;
import com.z254.prism.metrics.ResourceIdentity;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * WebClient-based implementation of MetricQueryClient.
 * Reads {@code /device/devices/{d}/devicedatasources/{dds}/instances/{i}/data}.
 */
@Component
@Slf4j
public class WebClientMetricQueryClient extends MonitoringApiSupport implements MetricQueryClient {

    static final String COLLABORATOR = "metric-data";

    public WebClientMetricQueryClient(WebClient monitoringWebClient, PrismProperties prismProperties) {
        super(monitoringWebClient, prismProperties);
    }

    @Override
    @CircuitBreaker(name = "monitoring-api")
    @Retry(name = "monitoring-api")
    public Mono<RawMetricData> fetch(ResourceIdentity resource, String datapointFilter,
                                     long startEpoch, long endEpoch) {
        return getJson(COLLABORATOR, builder -> {
            builder.path("/device/devices/{d}/devicedatasources/{dds}/instances/{i}/data")
                    .queryParam("start", startEpoch)
                    .queryParam("end", endEpoch);
            if (datapointFilter != null && !datapointFilter.isBlank()) {
                builder.queryParam("datapoints", datapointFilter);
            }
            return builder.build(resource.deviceId(), resource.deviceDatasourceId(), resource.instanceId());
        })
                .map(WebClientMetricQueryClient::toRawMetricData)
                .doOnSuccess(data -> log.debug("Fetched {} rows for {}", data.values().size(), resource.key()));
    }

    static RawMetricData toRawMetricData(JsonNode body) {
        JsonNode root = body.has("data") && body.path("data").isObject() ? body.path("data") : body;

        JsonNode names = root.has("dataPoints") ? root.path("dataPoints") : root.path("datapoints");
        List<String> datapointNames = new ArrayList<>();
        names.forEach(name -> datapointNames.add(name.asText()));

        List<List<Object>> rows = new ArrayList<>();
        root.path("values").forEach(row -> {
            List<Object> cells = new ArrayList<>();
            row.forEach(cell -> cells.add(toCell(cell)));
            rows.add(cells);
        });

        List<Long> timestamps = new ArrayList<>();
        root.path("time").forEach(time -> timestamps.add(time.asLong()));

        return new RawMetricData(datapointNames, rows, timestamps);
    }

    private static Object toCell(JsonNode cell) {
        if (cell.isNull()) {
            return null;
        }
        if (cell.isNumber()) {
            return cell.numberValue();
        }
        if (cell.isTextual()) {
            return cell.textValue();
        }
        return cell.toString();
    }
}
