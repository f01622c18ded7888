package com.z254.prism.topology;

import java.util.List;

/**
 * Impact assessment of a device failure.
 *
 * @param deviceId             the failing device
 * @param depth                traversal depth actually used
 * @param totalAffectedDevices devices reached, excluding the failing device
 * @param blastRadiusScore     0 to 100
 * @param affectedDevices      reached devices in discovery order
 * @param criticalPathDevices  affected devices with two or more inbound connections
 * @param criticalAlertCount   affected devices with a critical active alert
 */
public record BlastRadiusReport(long deviceId,
                                int depth,
                                int totalAffectedDevices,
                                int blastRadiusScore,
                                List<AffectedDevice> affectedDevices,
                                List<CriticalPathDevice> criticalPathDevices,
                                int criticalAlertCount) {
}
