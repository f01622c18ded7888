package com.z254.prism.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;

/**
 * Configuration properties for the PRISM analytics service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Monitoring API connection settings</li>
 *     <li>Metric fetch classification</li>
 *     <li>Baseline deviation thresholds</li>
 *     <li>Change correlation and blast radius limits</li>
 *     <li>Alert noise scoring</li>
 *     <li>Trend analysis defaults</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "prism")
public class PrismProperties {

    private final Api api = new Api();
    private final Metrics metrics = new Metrics();
    private final Baseline baseline = new Baseline();
    private final Correlation correlation = new Correlation();
    private final Noise noise = new Noise();
    private final Topology topology = new Topology();
    private final Trend trend = new Trend();

    /**
     * Monitoring REST API client configuration.
     */
    @Data
    public static class Api {
        @NotBlank
        private String baseUrl = "http://localhost:8090/santaba/rest";

        /** Static bearer token sent on every request; empty disables the header */
        private String bearerToken = "";

        private Duration timeout = Duration.ofSeconds(30);

        /** Response buffer limit in bytes */
        @Positive
        private int maxInMemorySize = 16 * 1024 * 1024;
    }

    /**
     * Metric series fetch configuration.
     */
    @Data
    public static class Metrics {
        /** Cell value the API uses for a missing sample */
        private String missingValueSentinel = "No Data";

        /** Epoch values above this are milliseconds */
        private long millisecondThreshold = 1_000_000_000_000L;
    }

    /**
     * Baseline store and comparison configuration.
     */
    @Data
    public static class Baseline {
        private String keyPrefix = "baseline_";

        /** Deviation at or below this is normal */
        private double normalDeviationPercent = 20.0;

        /** Deviation above this is anomalous */
        private double anomalousDeviationPercent = 50.0;

        @Positive
        private int defaultSaveWindowHours = 24;

        @Positive
        private int defaultCompareWindowHours = 1;
    }

    /**
     * Change-to-alert-spike correlation configuration.
     */
    @Data
    public static class Correlation {
        private Duration bucketSize = Duration.ofMinutes(5);

        @Positive
        private int alertPageSize = 1000;

        @Positive
        private int auditPageSize = 300;

        /** Maximum uncorrelated changes and spikes listed in a report */
        @Positive
        private int maxReported = 10;

        @Positive
        private int defaultHoursBack = 24;

        @Positive
        private int defaultWindowMinutes = 30;
    }

    /**
     * Alert noise scoring configuration.
     */
    @Data
    public static class Noise {
        @Positive
        private int alertPageSize = 1000;

        /** A cleared alert that re-fires within this gap is flapping */
        private Duration flapWindow = Duration.ofMinutes(30);

        /** Alerts per datasource:datapoint at which the combination counts as repeating */
        @Positive
        private int repeatThreshold = 3;

        @Positive
        private int maxFlappingReported = 10;

        @Positive
        private int topContributors = 5;

        @Positive
        private int defaultHoursBack = 24;
    }

    /**
     * Blast radius traversal configuration.
     */
    @Data
    public static class Topology {
        @Positive
        private int maxDepth = 3;

        @Positive
        private int defaultDepth = 2;

        @Positive
        private int maxVisitedNodes = 100;

        /** Affected devices whose active alerts are checked */
        @Positive
        private int maxAlertChecks = 50;

        @Positive
        private int activeAlertSampleSize = 5;

        /** Alerts at or above this severity are critical */
        private int criticalSeverity = 4;

        @Positive
        private int neighborPageSize = 50;

        /** Parallel neighbor and alert lookups; 1 runs them one at a time */
        @Positive
        private int lookupConcurrency = 1;
    }

    /**
     * Forecasting and anomaly analysis configuration.
     */
    @Data
    public static class Trend {
        private double anomalyZThreshold = 2.0;

        private double seasonalityThreshold = 0.5;

        private double changePointSensitivity = 1.0;

        @Positive
        private int defaultHoursBack = 24;

        @Positive
        private int forecastHoursBack = 168;
    }
}
