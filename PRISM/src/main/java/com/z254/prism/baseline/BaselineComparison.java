package com.z254.prism.baseline;

import com.z254.prism.metrics.ResourceIdentity;

import java.util.Map;

/**
 * Result of comparing an instance's recent data against a stored baseline.
 */
public record BaselineComparison(String baselineName,
                                 ResourceIdentity resource,
                                 Map<String, DatapointComparison> comparisons,
                                 int hoursCompared) {
}
