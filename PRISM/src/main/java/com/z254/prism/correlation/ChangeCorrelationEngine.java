package com.z254.prism.correlation;

import com.z254.prism.client.AlertQueryClient;
import com.z254.prism.client.AuditQueryClient;
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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static com.z254.prism.observability.PrismStructuredLogger.AnalysisEventType.COMPLETED;
import static com.z254.prism.observability.PrismStructuredLogger.AnalysisEventType.FAILED;

/**
 * Correlates configuration changes with alert spikes.
 * <p>
 * Alerts in the look-back window are bucketed by start time. Buckets whose count exceeds
 * {@code mean + sampleStddev} of all bucket counts (and exceeds 1) are spikes. Each change is
 * then matched to the earliest spike that starts no earlier than the change and no later than
 * the correlation window after it.
 * <p>
 * Matching is first-fit per change, not an optimal assignment; a spike may be matched by several
 * changes. The audit log is optional: if it cannot be read the run continues with no changes.
 */
@Slf4j
@Component
public class ChangeCorrelationEngine {

    static final String AUDIT_COLLABORATOR = "audit-log";

    private static final double MIN_CONFIDENCE = 0.5;

    private final AlertQueryClient alertQueryClient;
    private final AuditQueryClient auditQueryClient;
    private final PrismProperties prismProperties;
    private final PrismMetrics metrics;
    private final PrismStructuredLogger structuredLogger;
    private final Clock clock;

    public ChangeCorrelationEngine(AlertQueryClient alertQueryClient,
                                   AuditQueryClient auditQueryClient,
                                   PrismProperties prismProperties,
                                   PrismMetrics metrics,
                                   PrismStructuredLogger structuredLogger,
                                   Clock clock) {
        this.alertQueryClient = alertQueryClient;
        this.auditQueryClient = auditQueryClient;
        this.prismProperties = prismProperties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Run a correlation over the last {@code hoursBack} hours.
     *
     * @param hoursBack                look-back window, at least 1
     * @param correlationWindowMinutes how long after a change a spike may start, at least 1
     * @return the report; errors if alerts cannot be fetched
     */
    public Mono<ChangeCorrelationReport> correlate(int hoursBack, int correlationWindowMinutes) {
        if (hoursBack < 1) {
            return Mono.error(new InvalidInputException("hoursBack must be at least 1, got " + hoursBack));
        }
        if (correlationWindowMinutes < 1) {
            return Mono.error(new InvalidInputException(
                    "correlationWindowMinutes must be at least 1, got " + correlationWindowMinutes));
        }

        PrismProperties.Correlation config = prismProperties.getCorrelation();
        long startEpoch = clock.instant().getEpochSecond() - hoursBack * 3600L;
        Timer.Sample sample = metrics.startTimer();

        log.debug("Correlating changes with alert spikes: hoursBack={}, windowMinutes={}",
                hoursBack, correlationWindowMinutes);

        return alertQueryClient.fetchAlertsSince(startEpoch, config.getAlertPageSize())
                .defaultIfEmpty(List.of())
                .flatMap(alerts -> fetchChanges(startEpoch, config.getAuditPageSize())
                        .map(changes -> analyze(alerts, changes, hoursBack, correlationWindowMinutes)))
                .doOnSuccess(report -> {
                    metrics.recordCorrelationRun(report.totalSpikes());
                    metrics.recordLatency(sample, AnalysisType.CHANGE_CORRELATION);
                    structuredLogger.logAnalysisEvent(AnalysisType.CHANGE_CORRELATION, COMPLETED,
                            "Change correlation completed", Map.of(
                                    "totalAlerts", report.totalAlerts(),
                                    "totalChanges", report.totalChanges(),
                                    "totalSpikes", report.totalSpikes(),
                                    "correlated", report.correlatedEvents().size()));
                })
                .doOnError(error -> structuredLogger.logAnalysisEvent(AnalysisType.CHANGE_CORRELATION, FAILED,
                        "Change correlation failed", Map.of("error", String.valueOf(error.getMessage()))));
    }

    /**
     * Build the report from already fetched alerts and changes.
     */
    ChangeCorrelationReport analyze(List<AlertEvent> alerts, List<ChangeEvent> changes,
                                    int hoursBack, int correlationWindowMinutes) {
        int maxReported = prismProperties.getCorrelation().getMaxReported();
        long windowSeconds = correlationWindowMinutes * 60L;

        List<TimeBucket> buckets = bucketAlerts(alerts);
        double threshold = spikeThreshold(buckets);
        List<TimeBucket> spikes = buckets.stream()
                .filter(bucket -> bucket.isSpike(threshold))
                .toList();

        List<CorrelatedEvent> correlated = new ArrayList<>();
        List<ChangeSummary> uncorrelatedChanges = new ArrayList<>();
        Set<Long> matchedSpikes = new HashSet<>();

        for (ChangeEvent change : changes) {
            ChangeSummary summary = summarize(change);
            TimeBucket match = firstSpikeWithinWindow(summary.timestamp(), spikes, windowSeconds);

            if (match == null) {
                uncorrelatedChanges.add(summary);
                continue;
            }

            long gap = match.bucketStart() - summary.timestamp();
            double confidence = Math.max(MIN_CONFIDENCE, 1.0 - 0.5 * ((double) gap / windowSeconds));
            correlated.add(new CorrelatedEvent(summary, match, gap / 60.0, confidence));
            matchedSpikes.add(match.bucketStart());
        }

        List<TimeBucket> uncorrelatedSpikes = spikes.stream()
                .filter(spike -> !matchedSpikes.contains(spike.bucketStart()))
                .limit(maxReported)
                .toList();

        return new ChangeCorrelationReport(
                alerts.size(),
                changes.size(),
                spikes.size(),
                threshold,
                List.copyOf(correlated),
                uncorrelatedChanges.stream().limit(maxReported).toList(),
                uncorrelatedSpikes,
                hoursBack,
                correlationWindowMinutes);
    }

    /**
     * Count alerts per fixed-width bucket, ordered by bucket start.
     */
    List<TimeBucket> bucketAlerts(List<AlertEvent> alerts) {
        long bucketSize = prismProperties.getCorrelation().getBucketSize().getSeconds();

        Map<Long, Integer> counts = new TreeMap<>();
        for (AlertEvent alert : alerts) {
            long bucketStart = Math.floorDiv(alert.startEpoch(), bucketSize) * bucketSize;
            counts.merge(bucketStart, 1, Integer::sum);
        }

        return counts.entrySet().stream()
                .map(entry -> new TimeBucket(entry.getKey(), entry.getValue()))
                .toList();
    }

    /**
     * {@code mean + sampleStddev} of the bucket counts; 0 when there are no buckets.
     */
    double spikeThreshold(List<TimeBucket> buckets) {
        if (buckets.isEmpty()) {
            return 0.0;
        }
        List<Double> counts = buckets.stream()
                .map(bucket -> (double) bucket.alertCount())
                .toList();
        return StatsPrimitives.mean(counts) + StatsPrimitives.sampleStddev(counts);
    }

    // ========== Private Methods ==========

    private Mono<List<ChangeEvent>> fetchChanges(long startEpoch, int size) {
        return auditQueryClient.fetchChangesSince(startEpoch, size)
                .defaultIfEmpty(List.of())
                .onErrorResume(error -> {
                    structuredLogger.logDegradation(AUDIT_COLLABORATOR, "fetchChangesSince", error,
                            Map.of("startEpoch", startEpoch));
                    metrics.recordCollaboratorDegraded(AUDIT_COLLABORATOR);
                    return Mono.just(List.of());
                });
    }

    private TimeBucket firstSpikeWithinWindow(long changeTime, List<TimeBucket> spikes, long windowSeconds) {
        for (TimeBucket spike : spikes) {
            long gap = spike.bucketStart() - changeTime;
            if (gap >= 0 && gap <= windowSeconds) {
                return spike;
            }
        }
        return null;
    }

    private ChangeSummary summarize(ChangeEvent change) {
        long timestamp = change.timestamp() > prismProperties.getMetrics().getMillisecondThreshold()
                ? change.timestamp() / 1000
                : change.timestamp();
        return new ChangeSummary(change.id(), timestamp, change.user(), change.description());
    }
}
