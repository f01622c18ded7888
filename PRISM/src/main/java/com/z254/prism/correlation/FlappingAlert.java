package com.z254.prism.correlation;

/**
 * An alert that re-fired shortly after the previous alert on the same device and datapoint cleared.
 *
 * @param key        {@code device:datapoint}
 * @param gapSeconds seconds between the previous clear and this start; negative when they overlap
 * @param alertId    id of the re-fired alert
 */
public record FlappingAlert(String key, long gapSeconds, String alertId) {
}
