package com.z254.prism.correlation;

import java.util.List;

/**
 * Outcome of an alert noise scoring run.
 *
 * @param noiseScore          0 (quiet) to 100 (very noisy)
 * @param entropy             Shannon entropy, in bits, of the datasource:datapoint distribution
 * @param normalizedEntropy   entropy divided by its maximum for the number of combinations
 * @param totalAlerts         alerts in the window
 * @param flapCount           re-fires within the flap window; {@code flappingAlerts} is truncated
 * @param flappingAlerts      the first flapping alerts found
 * @param repeatRatio         share of combinations that alerted at least the repeat threshold
 * @param topNoisyDevices     devices with the most alerts
 * @param topNoisyDatasources datasources with the most alerts
 * @param recommendations     tuning hints, never empty
 * @param hoursBack           look-back window
 */
public record AlertNoiseReport(int noiseScore,
                               double entropy,
                               double normalizedEntropy,
                               int totalAlerts,
                               int flapCount,
                               List<FlappingAlert> flappingAlerts,
                               double repeatRatio,
                               List<NoiseContributor> topNoisyDevices,
                               List<NoiseContributor> topNoisyDatasources,
                               List<String> recommendations,
                               int hoursBack) {
}
