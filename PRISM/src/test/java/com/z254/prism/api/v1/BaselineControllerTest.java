package com.z254.prism.api.v1;

import com.z254.prism.baseline.Baseline;
import com.z254.prism.baseline.BaselineComparison;
import com.z254.prism.baseline.BaselineService;
import com.z254.prism.baseline.DatapointComparison;
import com.z254.prism.baseline.DatapointStats;
import com.z254.prism.baseline.DeviationStatus;
import com.z254.prism.exception.CollaboratorException;
import com.z254.prism.exception.NotFoundException;
import com.z254.prism.metrics.ResourceOverrides;
import com.z254.prism.support.PrismTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.z254.prism.support.PrismTestData.NOW;
import static com.z254.prism.support.PrismTestData.RESOURCE;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Web layer tests for {@link BaselineController}.
 */
@ExtendWith(MockitoExtension.class)
class BaselineControllerTest {

    @Mock
    private BaselineService baselineService;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient
                .bindToController(new BaselineController(baselineService, PrismTestData.properties()))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static Baseline baseline() {
        return new Baseline("web", RESOURCE,
                Map.of("cpu", new DatapointStats(20.0, 10.0, 30.0, 10.0, 3)), 24, NOW);
    }

    @Nested
    @DisplayName("POST /api/v1/baselines")
    class SaveTests {

        @Test
        @DisplayName("should save with the default window and return 201")
        void saves() {
            when(baselineService.saveBaseline(any(), anyString(), any(), anyInt())).thenReturn(Mono.just(baseline()));

            webTestClient.post()
                    .uri("/api/v1/baselines")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("name", "web", "deviceId", 101, "deviceDatasourceId", 202, "instanceId", 303))
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.name").isEqualTo("web")
                    .jsonPath("$.resource.deviceId").isEqualTo(101)
                    .jsonPath("$.datapoints.cpu.mean").isEqualTo(20.0);

            verify(baselineService).saveBaseline(RESOURCE, "web", null, 24);
        }

        @Test
        @DisplayName("should reject a request without a name")
        void missingName() {
            webTestClient.post()
                    .uri("/api/v1/baselines")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("deviceId", 101, "deviceDatasourceId", 202, "instanceId", 303))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo(true)
                    .jsonPath("$.code").isEqualTo("VALIDATION_ERROR");

            verifyNoInteractions(baselineService);
        }

        @Test
        @DisplayName("should answer 502 when the monitoring API fails")
        void upstreamFailure() {
            when(baselineService.saveBaseline(any(), anyString(), any(), anyInt()))
                    .thenReturn(Mono.error(new CollaboratorException("metric-data", "HTTP 503", null)));

            webTestClient.post()
                    .uri("/api/v1/baselines")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("name", "web", "deviceId", 101, "deviceDatasourceId", 202,
                            "instanceId", 303, "windowHours", 6))
                    .exchange()
                    .expectStatus().isEqualTo(502)
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("UPSTREAM_ERROR")
                    .jsonPath("$.path").isEqualTo("/api/v1/baselines");
        }
    }

    @Nested
    @DisplayName("POST /api/v1/baselines/{name}/compare")
    class CompareTests {

        @Test
        @DisplayName("should compare with stored identifiers when no body is sent")
        void noBody() {
            when(baselineService.compareToBaseline(anyString(), any(), anyInt())).thenReturn(Mono.just(
                    new BaselineComparison("web", RESOURCE,
                            Map.of("cpu", new DatapointComparison(DeviationStatus.ELEVATED, 20.0, 30.0, 50.0)), 1)));

            webTestClient.post()
                    .uri("/api/v1/baselines/web/compare")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.comparisons.cpu.status").isEqualTo("elevated")
                    .jsonPath("$.hoursCompared").isEqualTo(1);

            verify(baselineService).compareToBaseline("web", ResourceOverrides.none(), 1);
        }

        @Test
        @DisplayName("should pass overrides and window from the body")
        void withOverrides() {
            when(baselineService.compareToBaseline(anyString(), any(), anyInt())).thenReturn(Mono.just(
                    new BaselineComparison("web", RESOURCE, Map.of(), 4)));

            webTestClient.post()
                    .uri("/api/v1/baselines/web/compare")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("deviceId", 999, "windowHours", 4))
                    .exchange()
                    .expectStatus().isOk();

            verify(baselineService).compareToBaseline(eq("web"), eq(new ResourceOverrides(999L, null, null)), eq(4));
        }

        @Test
        @DisplayName("should answer 404 for an unknown baseline")
        void unknown() {
            when(baselineService.compareToBaseline(anyString(), any(), anyInt()))
                    .thenReturn(Mono.error(new NotFoundException("Baseline 'nope' not found", "Save it first.")));

            webTestClient.post()
                    .uri("/api/v1/baselines/nope/compare")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("NOT_FOUND")
                    .jsonPath("$.suggestion").isEqualTo("Save it first.");
        }
    }

    @Nested
    @DisplayName("Baseline management")
    class ManagementTests {

        @Test
        @DisplayName("should list stored baseline names")
        void list() {
            when(baselineService.listBaselines()).thenReturn(List.of("db", "web"));

            webTestClient.get()
                    .uri("/api/v1/baselines")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.count").isEqualTo(2)
                    .jsonPath("$.baselines[1]").isEqualTo("web");
        }

        @Test
        @DisplayName("should return a stored baseline")
        void get() {
            when(baselineService.findBaseline("web")).thenReturn(Optional.of(baseline()));

            webTestClient.get()
                    .uri("/api/v1/baselines/web")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.windowHours").isEqualTo(24);
        }

        @Test
        @DisplayName("should answer 204 on delete and 404 when nothing was deleted")
        void delete() {
            when(baselineService.deleteBaseline("web")).thenReturn(true);
            when(baselineService.deleteBaseline("nope")).thenReturn(false);

            webTestClient.delete().uri("/api/v1/baselines/web").exchange().expectStatus().isNoContent();
            webTestClient.delete().uri("/api/v1/baselines/nope").exchange().expectStatus().isNotFound();
        }
    }
}
