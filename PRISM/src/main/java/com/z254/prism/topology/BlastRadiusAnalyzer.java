package com.z254.prism.topology;

import com.z254.prism.client.AlertQueryClient;
import com.z254.prism.client.TopologyClient;
import com.z254.prism.config.PrismProperties;
import com.z254.prism.correlation.AlertEvent;
import com.z254.prism.observability.AnalysisType;
import com.z254.prism.observability.PrismMetrics;
import com.z254.prism.observability.PrismStructuredLogger;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static com.z254.prism.observability.PrismStructuredLogger.AnalysisEventType.COMPLETED;

/**
 * Estimates the blast radius of a device failure.
 * <p>
 * Walks the device's neighbors breadth-first up to a clamped depth, samples active alerts on
 * the devices reached, and finds devices reached from more than one direction. The result is
 * folded into a 0-100 score:
 * <pre>
 * min(100, affected * 10 + devicesWithCriticalAlerts * 15 + criticalPathDevices * 20)
 * </pre>
 * Collaborator failures never fail the analysis. A failed topology lookup falls back to the
 * device neighbor list, then to no neighbors; a failed alert lookup counts as no alerts.
 * <p>
 * Lookups within a layer may run concurrently, but results are applied in layer order and the
 * visited cap is checked before each one, so the report does not depend on the concurrency.
 */
@Slf4j
@Component
public class BlastRadiusAnalyzer {

    static final String TOPOLOGY_COLLABORATOR = "topology";
    static final String ALERT_COLLABORATOR = "active-alerts";

    private static final int AFFECTED_WEIGHT = 10;
    private static final int CRITICAL_ALERT_WEIGHT = 15;
    private static final int CRITICAL_PATH_WEIGHT = 20;
    private static final int MAX_SCORE = 100;

    private final TopologyClient topologyClient;
    private final AlertQueryClient alertQueryClient;
    private final PrismProperties.Topology config;
    private final PrismMetrics metrics;
    private final PrismStructuredLogger structuredLogger;

    public BlastRadiusAnalyzer(TopologyClient topologyClient,
                               AlertQueryClient alertQueryClient,
                               PrismProperties prismProperties,
                               PrismMetrics metrics,
                               PrismStructuredLogger structuredLogger) {
        this.topologyClient = topologyClient;
        this.alertQueryClient = alertQueryClient;
        this.config = prismProperties.getTopology();
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Analyze the impact of {@code deviceId} failing.
     *
     * @param deviceId the failing device
     * @param depth    requested hops; clamped to {@code [1, maxDepth]}
     */
    public Mono<BlastRadiusReport> analyze(long deviceId, int depth) {
        int effectiveDepth = Math.min(Math.max(depth, 1), config.getMaxDepth());

        // fresh traversal state per subscription
        return Mono.defer(() -> {
            Timer.Sample sample = metrics.startTimer();
            log.debug("Analyzing blast radius: deviceId={}, depth={} (requested {})",
                    deviceId, effectiveDepth, depth);

            Traversal traversal = new Traversal(deviceId);
            return expand(traversal, List.of(deviceId), 1, effectiveDepth)
                    .flatMap(this::checkAlerts)
                    .map(statuses -> buildReport(traversal, effectiveDepth, statuses))
                    .doOnSuccess(report -> {
                        metrics.recordBlastRadiusAnalysis();
                        metrics.recordLatency(sample, AnalysisType.BLAST_RADIUS);
                        try (var scope = structuredLogger.withContext(Map.of(
                                PrismStructuredLogger.MDC_DEVICE_ID, String.valueOf(deviceId)))) {
                            structuredLogger.logAnalysisEvent(AnalysisType.BLAST_RADIUS, COMPLETED,
                                    "Blast radius analysis completed", Map.of(
                                            "deviceId", deviceId,
                                            "depth", effectiveDepth,
                                            "affected", report.totalAffectedDevices(),
                                            "score", report.blastRadiusScore()));
                        }
                    });
        });
    }

    // ========== Traversal ==========

    private Mono<Traversal> expand(Traversal traversal, List<Long> layer, int level, int maxDepth) {
        if (layer.isEmpty() || level > maxDepth) {
            return Mono.just(traversal);
        }

        List<Long> nextLayer = new ArrayList<>();
        return Flux.fromIterable(layer)
                .flatMapSequential(parent -> Mono.defer(() -> traversal.capReached(config.getMaxVisitedNodes())
                                ? Mono.<Tuple2<Long, List<GraphNode>>>empty()
                                : neighbors(parent).map(found -> Tuples.of(parent, found))),
                        config.getLookupConcurrency())
                .takeWhile(result -> !traversal.capReached(config.getMaxVisitedNodes()))
                .doOnNext(result -> traversal.record(result.getT1(), result.getT2(), level, nextLayer))
                .then(Mono.defer(() -> expand(traversal, nextLayer, level + 1, maxDepth)));
    }

    private Mono<List<GraphNode>> neighbors(long deviceId) {
        return topologyClient.getTopologyNeighbors(deviceId)
                .onErrorResume(error -> {
                    log.debug("Topology neighbors unavailable for device {}, trying device neighbors: {}",
                            deviceId, error.getMessage());
                    return topologyClient.getDeviceNeighbors(deviceId);
                })
                .defaultIfEmpty(List.of())
                .onErrorResume(error -> {
                    structuredLogger.logDegradation(TOPOLOGY_COLLABORATOR, "neighbors", error,
                            Map.of("deviceId", deviceId));
                    metrics.recordCollaboratorDegraded(TOPOLOGY_COLLABORATOR);
                    return Mono.just(List.of());
                });
    }

    // ========== Alert Sampling ==========

    private Mono<Map<Long, AlertStatus>> checkAlerts(Traversal traversal) {
        List<Discovered> toCheck = traversal.affected.stream()
                .limit(config.getMaxAlertChecks())
                .toList();

        return Flux.fromIterable(toCheck)
                .flatMapSequential(device -> alertStatus(device.deviceId())
                                .map(status -> Tuples.of(device.deviceId(), status)),
                        config.getLookupConcurrency())
                .collectMap(Tuple2::getT1, Tuple2::getT2);
    }

    private Mono<AlertStatus> alertStatus(long deviceId) {
        return alertQueryClient.fetchActiveAlerts(deviceId, config.getActiveAlertSampleSize())
                .defaultIfEmpty(List.of())
                .map(alerts -> new AlertStatus(alerts.size(), alerts.stream()
                        .mapToInt(AlertEvent::severity)
                        .anyMatch(severity -> severity >= config.getCriticalSeverity())))
                .onErrorResume(error -> {
                    structuredLogger.logDegradation(ALERT_COLLABORATOR, "fetchActiveAlerts", error,
                            Map.of("deviceId", deviceId));
                    metrics.recordCollaboratorDegraded(ALERT_COLLABORATOR);
                    return Mono.just(AlertStatus.NONE);
                });
    }

    // ========== Scoring ==========

    private BlastRadiusReport buildReport(Traversal traversal, int depth, Map<Long, AlertStatus> statuses) {
        List<AffectedDevice> affected = new ArrayList<>();
        List<CriticalPathDevice> criticalPath = new ArrayList<>();
        int criticalAlertCount = 0;

        for (Discovered device : traversal.affected) {
            AlertStatus status = statuses.getOrDefault(device.deviceId(), AlertStatus.NONE);
            affected.add(new AffectedDevice(device.deviceId(), device.deviceName(), device.depth(),
                    status.activeAlertCount(), status.hasCritical()));
            if (status.hasCritical()) {
                criticalAlertCount++;
            }

            int connections = traversal.connectionCount(device.deviceId());
            if (connections >= 2) {
                criticalPath.add(new CriticalPathDevice(device.deviceId(), device.deviceName(), connections));
            }
        }

        int score = Math.min(MAX_SCORE, affected.size() * AFFECTED_WEIGHT
                + criticalAlertCount * CRITICAL_ALERT_WEIGHT
                + criticalPath.size() * CRITICAL_PATH_WEIGHT);

        return new BlastRadiusReport(traversal.startDeviceId, depth, affected.size(), score,
                List.copyOf(affected), List.copyOf(criticalPath), criticalAlertCount);
    }

    // ========== Internal State ==========

    private record Discovered(long deviceId, String deviceName, int depth) {
    }

    private record AlertStatus(int activeAlertCount, boolean hasCritical) {
        static final AlertStatus NONE = new AlertStatus(0, false);
    }

    /**
     * Mutable BFS state. The collections are only written from the serialized result signal;
     * the visited count may also be read from lookup subscriptions.
     */
    private static final class Traversal {

        private final long startDeviceId;
        private final Set<Long> visited = new LinkedHashSet<>();
        private final List<Discovered> affected = new ArrayList<>();
        private final Map<Long, Set<Long>> parentsByDevice = new HashMap<>();
        private final AtomicInteger visitedCount = new AtomicInteger();

        Traversal(long startDeviceId) {
            this.startDeviceId = startDeviceId;
            this.visited.add(startDeviceId);
            this.visitedCount.set(1);
        }

        boolean capReached(int maxVisited) {
            return visitedCount.get() >= maxVisited;
        }

        void record(long parent, List<GraphNode> neighbors, int level, List<Long> nextLayer) {
            for (GraphNode neighbor : neighbors) {
                if (neighbor == null || neighbor.id() == null) {
                    continue;
                }
                long id = neighbor.id();
                parentsByDevice.computeIfAbsent(id, key -> new LinkedHashSet<>()).add(parent);

                if (visited.add(id)) {
                    visitedCount.incrementAndGet();
                    nextLayer.add(id);
                    String name = neighbor.displayName() != null && !neighbor.displayName().isBlank()
                            ? neighbor.displayName()
                            : "device-" + id;
                    affected.add(new Discovered(id, name, level));
                }
            }
        }

        int connectionCount(long deviceId) {
            Set<Long> parents = parentsByDevice.get(deviceId);
            return parents == null ? 0 : parents.size();
        }
    }
}
