package com.z254.prism.client.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.prism.correlation.AlertEvent;
import com.z254.prism.exception.CollaboratorException;
import com.z254.prism.support.PrismTestData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WebClientAlertQueryClient}.
 */
class WebClientAlertQueryClientTest {

    private static final String ALERTS = """
            {"data": {"items": [
              {"id": "LMA1", "monitorObjectId": 42, "startEpoch": 1700000100, "severity": 4},
              {"internalId": "LMA2", "deviceId": "43", "startEpoch": 1700000200, "severity": 2}
            ]}}
            """;

    private WebClientAlertQueryClient client(RecordingExchangeFunction exchange) {
        return new WebClientAlertQueryClient(exchange.webClient(), PrismTestData.properties());
    }

    @Test
    @DisplayName("should query alerts started after the window start")
    void fetchAlertsSince() {
        RecordingExchangeFunction exchange = RecordingExchangeFunction.respond(ALERTS);

        StepVerifier.create(client(exchange).fetchAlertsSince(1_700_000_000L, 1000))
                .assertNext(alerts -> assertThat(alerts).containsExactly(
                        new AlertEvent("LMA1", 42L, 1_700_000_100L, 4),
                        new AlertEvent("LMA2", 43L, 1_700_000_200L, 2)))
                .verifyComplete();

        assertThat(exchange.lastRequest().getPath()).isEqualTo("/santaba/rest/alert/alerts");
        assertThat(exchange.lastRequest().getQuery())
                .contains("filter=startEpoch>:1700000000")
                .contains("size=1000");
    }

    @Test
    @DisplayName("should read names and clear time used by noise scoring")
    void readsNoiseFields() {
        RecordingExchangeFunction exchange = RecordingExchangeFunction.respond("""
                {"items": [{"id": "LMA9", "monitorObjectId": 42, "monitorObjectName": "web01",
                  "resourceTemplateName": "CPU", "dataPointName": "usage",
                  "startEpoch": 1700000100, "endEpoch": 1700000400, "severity": 3}]}
                """);

        StepVerifier.create(client(exchange).fetchAlertsSince(1_700_000_000L, "web \"01\"", 7L, 500))
                .assertNext(alerts -> assertThat(alerts).containsExactly(new AlertEvent(
                        "LMA9", 42L, "web01", "CPU", "usage", 1_700_000_100L, 1_700_000_400L, 3)))
                .verifyComplete();

        assertThat(exchange.lastRequest().getQuery())
                .contains("filter=startEpoch>:1700000000,monitorObjectName~\"web \\\"01\\\"\",hostGroupIds~7")
                .contains("size=500");
    }

    @Test
    @DisplayName("should omit absent noise filters")
    void omitsAbsentFilters() {
        RecordingExchangeFunction exchange = RecordingExchangeFunction.respond("{\"items\": []}");

        StepVerifier.create(client(exchange).fetchAlertsSince(1_700_000_000L, null, null, 500))
                .assertNext(alerts -> assertThat(alerts).isEmpty())
                .verifyComplete();

        assertThat(exchange.lastRequest().getQuery()).contains("filter=startEpoch>:1700000000&");
    }

    @Test
    @DisplayName("should query uncleared alerts of one device")
    void fetchActiveAlerts() {
        RecordingExchangeFunction exchange = RecordingExchangeFunction.respond("{\"items\": []}");

        StepVerifier.create(client(exchange).fetchActiveAlerts(42L, 5))
                .assertNext(alerts -> assertThat(alerts).isEmpty())
                .verifyComplete();

        assertThat(exchange.lastRequest().getQuery())
                .contains("filter=monitorObjectId:42,cleared:false")
                .contains("size=5");
    }

    @Test
    @DisplayName("should map an error status to a collaborator exception")
    void errorStatus() {
        RecordingExchangeFunction exchange = RecordingExchangeFunction.fail(HttpStatus.UNAUTHORIZED,
                "{\"errorMessage\": \"Authentication failed\"}");

        StepVerifier.create(client(exchange).fetchAlertsSince(0L, 10))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(CollaboratorException.class);
                    assertThat(((CollaboratorException) error).getCollaborator()).isEqualTo("alerts");
                    assertThat(error.getMessage()).contains("HTTP 401").contains("Authentication failed");
                })
                .verify();
    }

    @Test
    @DisplayName("should default missing alert fields")
    void missingFields() throws Exception {
        AlertEvent alert = WebClientAlertQueryClient.toAlert(new ObjectMapper().readTree("{}"));

        assertThat(alert).isEqualTo(new AlertEvent(null, null, 0L, 0));
    }
}
