package com.z254.prism.correlation;

import com.z254.prism.client.AlertQueryClient;
import com.z254.prism.config.PrismProperties;
import com.z254.prism.exception.InvalidInputException;
import com.z254.prism.observability.AnalysisType;
import com.z254.prism.observability.PrismMetrics;
import com.z254.prism.observability.PrismStructuredLogger;
import com.z254.prism.stats.StatsPrimitives;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.z254.prism.observability.PrismStructuredLogger.AnalysisEventType.COMPLETED;
import static com.z254.prism.observability.PrismStructuredLogger.AnalysisEventType.FAILED;

/**
 * Scores how noisy alerting has been over a look-back window.
 * <p>
 * The score blends three signals:
 * <ul>
 *     <li>normalized Shannon entropy of alerts per {@code datasource:datapoint} (weight 40)</li>
 *     <li>flap ratio: alerts that re-fire within the flap window after the previous alert on the
 *     same {@code device:datapoint} cleared (weight 3000)</li>
 *     <li>repeat ratio: combinations alerting at least the repeat threshold (weight 3000)</li>
 * </ul>
 * The sum is truncated to an integer and capped at 100.
 */
@Slf4j
@Component
public class AlertNoiseScorer {

    static final String UNKNOWN = "unknown";

    private static final int MAX_SCORE = 100;
    private static final double ENTROPY_WEIGHT = 40.0;
    private static final double FLAP_WEIGHT = 100.0 * 30.0;
    private static final double REPEAT_WEIGHT = 100.0 * 30.0;
    private static final double HIGH_REPEAT_RATIO = 0.5;
    private static final int HIGH_NOISE_SCORE = 70;

    private final AlertQueryClient alertQueryClient;
    private final PrismProperties prismProperties;
    private final PrismMetrics metrics;
    private final PrismStructuredLogger structuredLogger;
    private final Clock clock;

    public AlertNoiseScorer(AlertQueryClient alertQueryClient,
                            PrismProperties prismProperties,
                            PrismMetrics metrics,
                            PrismStructuredLogger structuredLogger,
                            Clock clock) {
        this.alertQueryClient = alertQueryClient;
        this.prismProperties = prismProperties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Score alert noise over the last {@code hoursBack} hours.
     *
     * @param hoursBack  look-back window, at least 1
     * @param deviceName optional device name substring filter
     * @param groupId    optional device group filter
     * @return the report; errors if alerts cannot be fetched
     */
    public Mono<AlertNoiseReport> score(int hoursBack, String deviceName, Long groupId) {
        if (hoursBack < 1) {
            return Mono.error(new InvalidInputException("hoursBack must be at least 1, got " + hoursBack));
        }

        long startEpoch = clock.instant().getEpochSecond() - hoursBack * 3600L;
        Timer.Sample sample = metrics.startTimer();

        log.debug("Scoring alert noise: hoursBack={}, device={}, group={}", hoursBack, deviceName, groupId);

        return alertQueryClient.fetchAlertsSince(startEpoch, deviceName, groupId,
                        prismProperties.getNoise().getAlertPageSize())
                .defaultIfEmpty(List.of())
                .map(alerts -> analyze(alerts, hoursBack))
                .doOnSuccess(report -> {
                    metrics.recordNoiseScoring();
                    metrics.recordLatency(sample, AnalysisType.ALERT_NOISE);
                    structuredLogger.logAnalysisEvent(AnalysisType.ALERT_NOISE, COMPLETED,
                            "Alert noise scoring completed", Map.of(
                                    "totalAlerts", report.totalAlerts(),
                                    "noiseScore", report.noiseScore(),
                                    "flapCount", report.flapCount()));
                })
                .doOnError(error -> structuredLogger.logAnalysisEvent(AnalysisType.ALERT_NOISE, FAILED,
                        "Alert noise scoring failed", Map.of("error", String.valueOf(error.getMessage()))));
    }

    /**
     * Build the report from already fetched alerts.
     */
    AlertNoiseReport analyze(List<AlertEvent> alerts, int hoursBack) {
        if (alerts.isEmpty()) {
            return new AlertNoiseReport(0, 0.0, 0.0, 0, 0, List.of(), 0.0, List.of(), List.of(),
                    List.of("No alerts in the time window."), hoursBack);
        }

        PrismProperties.Noise config = prismProperties.getNoise();

        Map<String, Integer> comboCounts = new LinkedHashMap<>();
        Map<String, Integer> deviceCounts = new LinkedHashMap<>();
        Map<String, Integer> datasourceCounts = new LinkedHashMap<>();
        for (AlertEvent alert : alerts) {
            String datasource = orUnknown(alert.datasource());
            comboCounts.merge(datasource + ":" + orUnknown(alert.datapoint()), 1, Integer::sum);
            deviceCounts.merge(orUnknown(alert.deviceName()), 1, Integer::sum);
            datasourceCounts.merge(datasource, 1, Integer::sum);
        }

        double entropy = entropy(comboCounts, alerts.size());
        double maxEntropy = comboCounts.size() > 1
                ? Math.log(comboCounts.size()) / Math.log(2)
                : 1.0;
        double normalizedEntropy = entropy / maxEntropy;

        List<FlappingAlert> flapping = new ArrayList<>();
        int flapCount = countFlaps(alerts, config, flapping);

        long repeating = comboCounts.values().stream()
                .filter(count -> count >= config.getRepeatThreshold())
                .count();
        double repeatRatio = (double) repeating / comboCounts.size();
        double flapRatio = (double) flapCount / alerts.size();

        int noiseScore = Math.min(MAX_SCORE, (int) (normalizedEntropy * ENTROPY_WEIGHT
                + flapRatio * FLAP_WEIGHT
                + repeatRatio * REPEAT_WEIGHT));

        return new AlertNoiseReport(
                noiseScore,
                entropy,
                normalizedEntropy,
                alerts.size(),
                flapCount,
                List.copyOf(flapping),
                repeatRatio,
                top(deviceCounts, config.getTopContributors()),
                top(datasourceCounts, config.getTopContributors()),
                recommendations(flapCount, repeatRatio, noiseScore),
                hoursBack);
    }

    // ========== Private Methods ==========

    private double entropy(Map<String, Integer> counts, int total) {
        List<Double> probabilities = counts.values().stream()
                .map(count -> (double) count / total)
                .toList();
        return StatsPrimitives.shannonEntropy(probabilities);
    }

    /**
     * Count re-fires per {@code device:datapoint}, collecting the first few into {@code flapping}.
     * An alert that is still active (end epoch 0) never starts a flap.
     */
    private int countFlaps(List<AlertEvent> alerts, PrismProperties.Noise config, List<FlappingAlert> flapping) {
        long flapWindowSeconds = config.getFlapWindow().getSeconds();

        Map<String, List<AlertEvent>> byKey = new LinkedHashMap<>();
        for (AlertEvent alert : alerts) {
            String key = orUnknown(alert.deviceName()) + ":" + orUnknown(alert.datapoint());
            byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(alert);
        }

        int flapCount = 0;
        for (Map.Entry<String, List<AlertEvent>> entry : byKey.entrySet()) {
            List<AlertEvent> events = entry.getValue().stream()
                    .sorted(Comparator.comparingLong(AlertEvent::startEpoch))
                    .toList();
            for (int i = 1; i < events.size(); i++) {
                AlertEvent previous = events.get(i - 1);
                AlertEvent current = events.get(i);
                long gap = current.startEpoch() - previous.endEpoch();
                if (previous.isCleared() && gap < flapWindowSeconds) {
                    flapCount++;
                    if (flapping.size() < config.getMaxFlappingReported()) {
                        flapping.add(new FlappingAlert(entry.getKey(), gap, current.id()));
                    }
                }
            }
        }
        return flapCount;
    }

    private List<NoiseContributor> top(Map<String, Integer> counts, int limit) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(limit)
                .map(entry -> new NoiseContributor(entry.getKey(), entry.getValue()))
                .toList();
    }

    private List<String> recommendations(int flapCount, double repeatRatio, int noiseScore) {
        List<String> recommendations = new ArrayList<>();
        if (flapCount > 0) {
            recommendations.add(flapCount
                    + " flapping alert(s) detected. Consider adding an alert delay or hysteresis.");
        }
        if (repeatRatio > HIGH_REPEAT_RATIO) {
            recommendations.add("High repeat ratio. Review alert thresholds and consider consolidation rules.");
        }
        if (noiseScore > HIGH_NOISE_SCORE) {
            recommendations.add("Very high noise level. Review the top noisy devices and datasources for tuning.");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Alert noise levels are acceptable.");
        }
        return List.copyOf(recommendations);
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
