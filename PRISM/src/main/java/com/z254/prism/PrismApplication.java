package com.z254.prism;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * PRISM - Telemetry diagnostics analytics service.
 *
 * <p>PRISM provides:
 * <ul>
 *   <li>Baselines - Snapshot metric statistics and compare fresh data against them</li>
 *   <li>Change Correlation - Link configuration changes to alert spikes</li>
 *   <li>Blast Radius - Score the impact of a failing device over its topology</li>
 *   <li>Trend Analysis - Forecasts, change points, seasonality and anomalies</li>
 * </ul>
 *
 * <p>All telemetry is read from the monitoring REST API through the adapters
 * in {@code com.z254.prism.client.impl}.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class PrismApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrismApplication.class, args);
    }
}
