package com.z254.prism.client.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.prism.metrics.RawMetricData;
import com.z254.prism.support.PrismTestData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.List;

import static com.z254.prism.support.PrismTestData.RESOURCE;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WebClientMetricQueryClient}.
 */
class WebClientMetricQueryClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("should request the instance data path with the window and datapoints")
    void requestsInstanceData() {
        RecordingExchangeFunction exchange = RecordingExchangeFunction.respond("""
                {"dataPoints": ["cpu"], "values": [[1.5]], "time": [1700000000000]}
                """);
        WebClientMetricQueryClient client = new WebClientMetricQueryClient(exchange.webClient(),
                PrismTestData.properties());

        StepVerifier.create(client.fetch(RESOURCE, "cpu,mem", 100L, 200L))
                .assertNext(raw -> {
                    assertThat(raw.datapointNames()).containsExactly("cpu");
                    assertThat(raw.timestamps()).containsExactly(1_700_000_000_000L);
                })
                .verifyComplete();

        assertThat(exchange.lastRequest().getPath())
                .isEqualTo("/santaba/rest/device/devices/101/devicedatasources/202/instances/303/data");
        assertThat(exchange.lastRequest().getQuery())
                .contains("start=100")
                .contains("end=200")
                .contains("datapoints=cpu,mem");
    }

    @Test
    @DisplayName("should omit the datapoint filter when none is given")
    void noFilter() {
        RecordingExchangeFunction exchange = RecordingExchangeFunction.respond("{}");
        WebClientMetricQueryClient client = new WebClientMetricQueryClient(exchange.webClient(),
                PrismTestData.properties());

        StepVerifier.create(client.fetch(RESOURCE, null, 100L, 200L))
                .assertNext(raw -> assertThat(raw.datapointNames()).isEmpty())
                .verifyComplete();

        assertThat(exchange.lastRequest().getQuery()).doesNotContain("datapoints");
    }

    @Test
    @DisplayName("should keep cells untyped, unwrapping a data envelope")
    void parsesEnvelope() throws Exception {
        RawMetricData raw = WebClientMetricQueryClient.toRawMetricData(objectMapper.readTree("""
                {"data": {"datapoints": ["cpu", "mem", "disk"],
                          "values": [[1, "No Data", null]],
                          "time": [1700000000]}}
                """));

        assertThat(raw.datapointNames()).containsExactly("cpu", "mem", "disk");
        assertThat(raw.values()).containsExactly(Arrays.asList(1, "No Data", null));
        assertThat(raw.timestamps()).isEqualTo(List.of(1_700_000_000L));
    }
}
