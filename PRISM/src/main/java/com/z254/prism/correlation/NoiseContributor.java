package com.z254.prism.correlation;

/**
 * A device or datasource and the number of alerts it raised.
 */
public record NoiseContributor(String name, int alertCount) {
}
