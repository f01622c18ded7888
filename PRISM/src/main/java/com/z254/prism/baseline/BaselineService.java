package com.z254.prism.baseline;

import com.z254.prism.config.PrismProperties;
import com.z254.prism.exception.InvalidInputException;
import com.z254.prism.exception.NotFoundException;
import com.z254.prism.metrics.MetricSeries;
import com.z254.prism.metrics.MetricSeriesFetcher;
import com.z254.prism.metrics.ResourceIdentity;
import com.z254.prism.metrics.ResourceOverrides;
import com.z254.prism.observability.AnalysisType;
import com.z254.prism.observability.PrismMetrics;
import com.z254.prism.observability.PrismStructuredLogger;
import com.z254.prism.stats.StatsPrimitives;
import com.z254.prism.store.NamedVariableStore;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.z254.prism.observability.PrismStructuredLogger.AnalysisEventType.COMPLETED;
import static com.z254.prism.observability.PrismStructuredLogger.AnalysisEventType.FAILED;

/**
 * Captures metric baselines and compares fresh data against them.
 * <p>
 * Baselines are kept in the {@link NamedVariableStore} under a prefixed key; saving
 * under an existing name replaces the previous baseline.
 */
@Slf4j
@Service
public class BaselineService {

    private final MetricSeriesFetcher fetcher;
    private final NamedVariableStore variableStore;
    private final PrismProperties.Baseline config;
    private final PrismMetrics metrics;
    private final PrismStructuredLogger structuredLogger;
    private final Clock clock;

    public BaselineService(MetricSeriesFetcher fetcher,
                           NamedVariableStore variableStore,
                           PrismProperties prismProperties,
                           PrismMetrics metrics,
                           PrismStructuredLogger structuredLogger,
                           Clock clock) {
        this.fetcher = fetcher;
        this.variableStore = variableStore;
        this.config = prismProperties.getBaseline();
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Fetch {@code windowHours} of data and store per-datapoint statistics under {@code name}.
     * Datapoints with no samples are kept with unavailable statistics.
     */
    public Mono<Baseline> saveBaseline(ResourceIdentity resource, String name,
                                       String datapointFilter, int windowHours) {
        if (name == null || name.isBlank()) {
            return Mono.error(new InvalidInputException("Baseline name must not be blank"));
        }

        Timer.Sample sample = metrics.startTimer();
        return fetcher.fetch(resource, datapointFilter, windowHours)
                .map(series -> {
                    Map<String, DatapointStats> stats = new LinkedHashMap<>();
                    series.forEach((datapoint, data) -> stats.put(datapoint, DatapointStats.of(data.values())));

                    Baseline baseline = new Baseline(name, resource, stats, windowHours,
                            clock.instant().getEpochSecond());
                    variableStore.set(storeKey(name), baseline);
                    return baseline;
                })
                .doOnSuccess(baseline -> {
                    metrics.recordBaselineSaved();
                    metrics.recordLatency(sample, AnalysisType.BASELINE_SAVE);
                    try (var scope = structuredLogger.withContext(Map.of(
                            PrismStructuredLogger.MDC_BASELINE_NAME, name,
                            PrismStructuredLogger.MDC_RESOURCE_KEY, resource.key()))) {
                        structuredLogger.logAnalysisEvent(AnalysisType.BASELINE_SAVE, COMPLETED,
                                "Baseline saved", Map.of(
                                        "baselineName", name,
                                        "datapoints", baseline.datapoints().size(),
                                        "windowHours", windowHours));
                    }
                })
                .doOnError(error -> structuredLogger.logAnalysisEvent(AnalysisType.BASELINE_SAVE, FAILED,
                        "Baseline save failed", Map.of("baselineName", name, "error", String.valueOf(error.getMessage()))));
    }

    /**
     * Compare the last {@code windowHours} of data against a stored baseline.
     * <p>
     * The instance defaults to the one the baseline was captured for; each non-null field of
     * {@code overrides} replaces the stored value. Datapoints missing from the baseline, or whose
     * baseline mean is unavailable, are left out of the result.
     *
     * @throws NotFoundException (as an error signal) when no baseline has that name
     */
    public Mono<BaselineComparison> compareToBaseline(String name, ResourceOverrides overrides, int windowHours) {
        Optional<Baseline> stored = findBaseline(name);
        if (stored.isEmpty()) {
            return Mono.error(new NotFoundException("Baseline '" + name + "' not found",
                    "Save a baseline with that name before comparing against it."));
        }

        Baseline baseline = stored.get();
        ResourceIdentity resource = (overrides != null ? overrides : ResourceOverrides.none())
                .applyTo(baseline.resource());

        Timer.Sample sample = metrics.startTimer();
        return fetcher.fetch(resource, null, windowHours)
                .map(series -> new BaselineComparison(name, resource, compare(baseline, series), windowHours))
                .doOnSuccess(comparison -> {
                    metrics.recordBaselineCompared();
                    metrics.recordLatency(sample, AnalysisType.BASELINE_COMPARE);
                    try (var scope = structuredLogger.withContext(Map.of(
                            PrismStructuredLogger.MDC_BASELINE_NAME, name,
                            PrismStructuredLogger.MDC_RESOURCE_KEY, resource.key()))) {
                        structuredLogger.logAnalysisEvent(AnalysisType.BASELINE_COMPARE, COMPLETED,
                                "Baseline comparison completed", Map.of(
                                        "baselineName", name,
                                        "compared", comparison.comparisons().size(),
                                        "windowHours", windowHours));
                    }
                })
                .doOnError(error -> structuredLogger.logAnalysisEvent(AnalysisType.BASELINE_COMPARE, FAILED,
                        "Baseline comparison failed", Map.of("baselineName", name, "error", String.valueOf(error.getMessage()))));
    }

    public Optional<Baseline> findBaseline(String name) {
        return variableStore.get(storeKey(name))
                .filter(Baseline.class::isInstance)
                .map(Baseline.class::cast);
    }

    public boolean deleteBaseline(String name) {
        boolean removed = variableStore.delete(storeKey(name));
        if (removed) {
            log.info("Baseline deleted: {}", name);
        }
        return removed;
    }

    /**
     * Names of all stored baselines, without the store key prefix.
     */
    public List<String> listBaselines() {
        return variableStore.names().stream()
                .filter(key -> key.startsWith(config.getKeyPrefix()))
                .filter(key -> findBaseline(key.substring(config.getKeyPrefix().length())).isPresent())
                .map(key -> key.substring(config.getKeyPrefix().length()))
                .toList();
    }

    // ========== Private Methods ==========

    private Map<String, DatapointComparison> compare(Baseline baseline, Map<String, MetricSeries> current) {
        Map<String, DatapointComparison> comparisons = new LinkedHashMap<>();
        current.forEach((datapoint, series) -> {
            DatapointStats stats = baseline.datapoints().get(datapoint);
            if (stats == null || stats.mean() == null) {
                return;
            }
            comparisons.put(datapoint, compareDatapoint(stats.mean(), series.values()));
        });
        return comparisons;
    }

    DatapointComparison compareDatapoint(double baselineMean, List<Double> values) {
        if (values.isEmpty()) {
            return DatapointComparison.noData(baselineMean);
        }

        double currentMean = StatsPrimitives.mean(values);
        double deviation = deviationPercent(baselineMean, currentMean);
        return new DatapointComparison(classify(deviation, baselineMean, currentMean),
                baselineMean, currentMean, deviation);
    }

    private double deviationPercent(double baselineMean, double currentMean) {
        if (baselineMean == 0) {
            return currentMean == 0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return Math.abs((currentMean - baselineMean) / baselineMean) * 100;
    }

    private DeviationStatus classify(double deviation, double baselineMean, double currentMean) {
        if (deviation <= config.getNormalDeviationPercent()) {
            return DeviationStatus.NORMAL;
        }
        if (deviation <= config.getAnomalousDeviationPercent()) {
            return currentMean > baselineMean ? DeviationStatus.ELEVATED : DeviationStatus.REDUCED;
        }
        return DeviationStatus.ANOMALOUS;
    }

    private String storeKey(String name) {
        return config.getKeyPrefix() + name;
    }
}
