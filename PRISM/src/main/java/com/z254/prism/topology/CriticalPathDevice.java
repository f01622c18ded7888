package com.z254.prism.topology;

/**
 * An affected device reached from at least two distinct devices during traversal.
 */
public record CriticalPathDevice(long deviceId, String deviceName, int connectionCount) {
}
