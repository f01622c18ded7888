package com.z254.prism.api.v1;

import com.z254.prism.config.PrismProperties;
import com.z254.prism.metrics.ResourceIdentity;
import com.z254.prism.trend.MetricTrendAnalyzer;
import com.z254.prism.trend.MetricTrendAnalyzer.DatapointAnomalies;
import com.z254.prism.trend.MetricTrendAnalyzer.DatapointChangePoints;
import com.z254.prism.trend.MetricTrendAnalyzer.DatapointForecast;
import com.z254.prism.trend.MetricTrendAnalyzer.DatapointSeasonality;
import com.z254.prism.trend.MetricTrendAnalyzer.DatapointTrend;
import com.z254.prism.trend.MetricTrendAnalyzer.TrendReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * REST API controller for per-instance trend analyses.
 */
@RestController
@RequestMapping("/api/v1/metrics/{deviceId}/{deviceDatasourceId}/{instanceId}")
@Tag(name = "Trends", description = "Forecasting and anomaly analysis")
public class TrendController {

    private final MetricTrendAnalyzer trendAnalyzer;
    private final PrismProperties.Trend config;

    public TrendController(MetricTrendAnalyzer trendAnalyzer, PrismProperties prismProperties) {
        this.trendAnalyzer = trendAnalyzer;
        this.config = prismProperties.getTrend();
    }

    @GetMapping("/forecast")
    @Operation(summary = "Forecast threshold breach", description = "Linear trend and projected breach time per datapoint")
    public Mono<ResponseEntity<TrendReport<DatapointForecast>>> forecast(
            @PathVariable long deviceId,
            @PathVariable long deviceDatasourceId,
            @PathVariable long instanceId,
            @Parameter(description = "Breach threshold") @RequestParam double threshold,
            @Parameter(description = "Comma-separated datapoint names") @RequestParam(required = false) String datapoints,
            @RequestParam(required = false) Integer hoursBack) {

        return trendAnalyzer.forecast(new ResourceIdentity(deviceId, deviceDatasourceId, instanceId), threshold,
                        datapoints, hoursBack != null ? hoursBack : config.getForecastHoursBack())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/change-points")
    @Operation(summary = "Detect change points", description = "CUSUM mean-shift detection per datapoint")
    public Mono<ResponseEntity<TrendReport<DatapointChangePoints>>> changePoints(
            @PathVariable long deviceId,
            @PathVariable long deviceDatasourceId,
            @PathVariable long instanceId,
            @RequestParam(required = false) String datapoints,
            @RequestParam(required = false) Integer hoursBack,
            @Parameter(description = "Lower detects smaller shifts") @RequestParam(required = false) Double sensitivity) {

        return trendAnalyzer.detectChangePoints(new ResourceIdentity(deviceId, deviceDatasourceId, instanceId),
                        datapoints, hoursBack(hoursBack),
                        sensitivity != null ? sensitivity : config.getChangePointSensitivity())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/trend")
    @Operation(summary = "Classify trend", description = "Volatile, cyclic, increasing, decreasing or stable per datapoint")
    public Mono<ResponseEntity<TrendReport<DatapointTrend>>> classifyTrend(
            @PathVariable long deviceId,
            @PathVariable long deviceDatasourceId,
            @PathVariable long instanceId,
            @RequestParam(required = false) String datapoints,
            @RequestParam(required = false) Integer hoursBack) {

        return trendAnalyzer.classifyTrend(new ResourceIdentity(deviceId, deviceDatasourceId, instanceId),
                        datapoints, hoursBack(hoursBack))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/seasonality")
    @Operation(summary = "Detect seasonality", description = "Autocorrelation at standard periods and peak hours of day")
    public Mono<ResponseEntity<TrendReport<DatapointSeasonality>>> seasonality(
            @PathVariable long deviceId,
            @PathVariable long deviceDatasourceId,
            @PathVariable long instanceId,
            @RequestParam(required = false) String datapoints,
            @RequestParam(required = false) Integer hoursBack) {

        return trendAnalyzer.detectSeasonality(new ResourceIdentity(deviceId, deviceDatasourceId, instanceId),
                        datapoints, hoursBack != null ? hoursBack : config.getForecastHoursBack())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/anomalies")
    @Operation(summary = "Detect anomalies", description = "Samples whose z-score exceeds the threshold")
    public Mono<ResponseEntity<TrendReport<DatapointAnomalies>>> anomalies(
            @PathVariable long deviceId,
            @PathVariable long deviceDatasourceId,
            @PathVariable long instanceId,
            @RequestParam(required = false) String datapoints,
            @RequestParam(required = false) Integer hoursBack,
            @RequestParam(required = false) Double zThreshold) {

        return trendAnalyzer.detectAnomalies(new ResourceIdentity(deviceId, deviceDatasourceId, instanceId),
                        datapoints, hoursBack(hoursBack),
                        zThreshold != null ? zThreshold : config.getAnomalyZThreshold())
                .map(ResponseEntity::ok);
    }

    private int hoursBack(Integer requested) {
        return requested != null ? requested : config.getDefaultHoursBack();
    }
}
