package com.z254.prism.topology;

/**
 * A device reachable from the failing device.
 *
 * @param deviceId         device id
 * @param deviceName       display name, {@code device-<id>} when the topology has none
 * @param depth            hops from the failing device, starting at 1
 * @param activeAlertCount uncleared alerts seen on the device (sampled)
 * @param hasCritical      whether any sampled alert is critical
 */
public record AffectedDevice(long deviceId, String deviceName, int depth,
                             int activeAlertCount, boolean hasCritical) {
}
