package com.z254.prism.baseline;

import com.z254.prism.metrics.ResourceIdentity;

import java.util.Map;

/**
 * A named snapshot of per-datapoint statistics for one instance.
 *
 * @param name        baseline name
 * @param resource    instance the statistics were computed for
 * @param datapoints  stats per datapoint, in fetch order
 * @param windowHours look-back window the stats cover
 * @param createdAt   epoch seconds the baseline was captured
 */
public record Baseline(String name,
                       ResourceIdentity resource,
                       Map<String, DatapointStats> datapoints,
                       int windowHours,
                       long createdAt) {
}
