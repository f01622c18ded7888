package com.z254.prism.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics for PRISM service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Baseline lifecycle (saved, compared)</li>
 *     <li>Change correlation runs and detected spikes</li>
 *     <li>Blast radius analyses</li>
 *     <li>Degraded collaborator calls, per collaborator</li>
 *     <li>Analysis latency, per analysis type</li>
 * </ul>
 */
@Component
public class PrismMetrics {

    private final MeterRegistry meterRegistry;

    // Baseline metrics
    @Getter
    private final Counter baselinesSaved;
    @Getter
    private final Counter baselinesCompared;

    // Correlation metrics
    @Getter
    private final Counter correlationRuns;
    @Getter
    private final Counter correlationSpikes;
    @Getter
    private final Counter noiseScorings;

    // Topology metrics
    @Getter
    private final Counter blastRadiusAnalyses;

    private final Map<String, Counter> degradedByCollaborator = new ConcurrentHashMap<>();
    private final Map<AnalysisType, Timer> latencyByAnalysis = new ConcurrentHashMap<>();

    public PrismMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.baselinesSaved = Counter.builder("prism.baselines.saved")
                .description("Baselines captured")
                .register(meterRegistry);
        this.baselinesCompared = Counter.builder("prism.baselines.compared")
                .description("Baseline comparisons performed")
                .register(meterRegistry);

        this.correlationRuns = Counter.builder("prism.correlation.runs")
                .description("Change correlation runs")
                .register(meterRegistry);
        this.correlationSpikes = Counter.builder("prism.correlation.spikes")
                .description("Alert spikes detected by correlation runs")
                .register(meterRegistry);
        this.noiseScorings = Counter.builder("prism.noise.scorings")
                .description("Alert noise scoring runs")
                .register(meterRegistry);

        this.blastRadiusAnalyses = Counter.builder("prism.blast_radius.analyses")
                .description("Blast radius analyses")
                .register(meterRegistry);
    }

    // ========== Baseline Methods ==========

    public void recordBaselineSaved() {
        baselinesSaved.increment();
    }

    public void recordBaselineCompared() {
        baselinesCompared.increment();
    }

    // ========== Correlation Methods ==========

    public void recordCorrelationRun(int spikeCount) {
        correlationRuns.increment();
        correlationSpikes.increment(spikeCount);
    }

    public void recordNoiseScoring() {
        noiseScorings.increment();
    }

    // ========== Topology Methods ==========

    public void recordBlastRadiusAnalysis() {
        blastRadiusAnalyses.increment();
    }

    // ========== Collaborator Methods ==========

    /**
     * Count a collaborator failure that was tolerated and replaced by an empty result.
     */
    public void recordCollaboratorDegraded(String collaborator) {
        degradedByCollaborator.computeIfAbsent(collaborator, name ->
                Counter.builder("prism.collaborator.degraded")
                        .description("Collaborator failures replaced by empty results")
                        .tag("collaborator", name)
                        .register(meterRegistry)
        ).increment();
    }

    // ========== Latency Methods ==========

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordLatency(Timer.Sample sample, AnalysisType analysis) {
        sample.stop(latencyByAnalysis.computeIfAbsent(analysis, type ->
                Timer.builder("prism.analysis.latency")
                        .description("Analysis latency")
                        .tag("analysis", type.tag())
                        .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                        .register(meterRegistry)));
    }
}
