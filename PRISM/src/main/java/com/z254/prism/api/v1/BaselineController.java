package com.z254.prism.api.v1;

import com.z254.prism.baseline.Baseline;
import com.z254.prism.baseline.BaselineComparison;
import com.z254.prism.baseline.BaselineService;
import com.z254.prism.config.PrismProperties;
import com.z254.prism.exception.NotFoundException;
import com.z254.prism.metrics.ResourceIdentity;
import com.z254.prism.metrics.ResourceOverrides;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for metric baselines.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/baselines")
@Tag(name = "Baselines", description = "Metric baseline capture and comparison")
public class BaselineController {

    private final BaselineService baselineService;
    private final PrismProperties prismProperties;

    public BaselineController(BaselineService baselineService, PrismProperties prismProperties) {
        this.baselineService = baselineService;
        this.prismProperties = prismProperties;
    }

    @PostMapping
    @Operation(summary = "Save baseline",
            description = "Capture per-datapoint statistics of an instance under a name, replacing any baseline with that name")
    public Mono<ResponseEntity<Baseline>> saveBaseline(@Valid @RequestBody SaveBaselineRequest request) {
        int windowHours = request.getWindowHours() != null
                ? request.getWindowHours()
                : prismProperties.getBaseline().getDefaultSaveWindowHours();

        log.info("Saving baseline: name={}, device={}", request.getName(), request.getDeviceId());

        ResourceIdentity resource = new ResourceIdentity(request.getDeviceId(),
                request.getDeviceDatasourceId(), request.getInstanceId());
        return baselineService.saveBaseline(resource, request.getName(), request.getDatapoints(), windowHours)
                .map(baseline -> ResponseEntity.status(HttpStatus.CREATED).body(baseline));
    }

    @PostMapping("/{name}/compare")
    @Operation(summary = "Compare to baseline",
            description = "Compare recent data against a stored baseline; identifiers default to the baseline's instance")
    public Mono<ResponseEntity<BaselineComparison>> compareToBaseline(
            @Parameter(description = "Baseline name") @PathVariable String name,
            @Valid @RequestBody(required = false) CompareBaselineRequest request) {

        CompareBaselineRequest effective = request != null ? request : new CompareBaselineRequest();
        int windowHours = effective.getWindowHours() != null
                ? effective.getWindowHours()
                : prismProperties.getBaseline().getDefaultCompareWindowHours();

        ResourceOverrides overrides = new ResourceOverrides(effective.getDeviceId(),
                effective.getDeviceDatasourceId(), effective.getInstanceId());
        return baselineService.compareToBaseline(name, overrides, windowHours)
                .map(ResponseEntity::ok);
    }

    @GetMapping
    @Operation(summary = "List baselines", description = "Names of all stored baselines")
    public Mono<ResponseEntity<BaselineListResponse>> listBaselines() {
        return Mono.fromCallable(() -> {
            List<String> names = baselineService.listBaselines();
            return ResponseEntity.ok(BaselineListResponse.builder()
                    .baselines(names)
                    .count(names.size())
                    .build());
        });
    }

    @GetMapping("/{name}")
    @Operation(summary = "Get baseline", description = "Stored statistics of one baseline")
    public Mono<ResponseEntity<Baseline>> getBaseline(@PathVariable String name) {
        return Mono.fromCallable(() -> baselineService.findBaseline(name)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> notFound(name)));
    }

    @DeleteMapping("/{name}")
    @Operation(summary = "Delete baseline")
    public Mono<ResponseEntity<Void>> deleteBaseline(@PathVariable String name) {
        return Mono.fromCallable(() -> {
            if (!baselineService.deleteBaseline(name)) {
                throw notFound(name);
            }
            return ResponseEntity.noContent().<Void>build();
        });
    }

    private NotFoundException notFound(String name) {
        return new NotFoundException("Baseline '" + name + "' not found",
                "List stored baselines with GET /api/v1/baselines.");
    }

    // ========== DTOs ==========

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SaveBaselineRequest {
        @NotBlank
        private String name;
        @NotNull
        private Long deviceId;
        @NotNull
        private Long deviceDatasourceId;
        @NotNull
        private Long instanceId;
        /** Comma-separated datapoint names; all when omitted */
        private String datapoints;
        @Min(1)
        private Integer windowHours;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompareBaselineRequest {
        private Long deviceId;
        private Long deviceDatasourceId;
        private Long instanceId;
        @Min(1)
        private Integer windowHours;
    }

    @Data
    @Builder
    public static class BaselineListResponse {
        private List<String> baselines;
        private int count;
    }
}
