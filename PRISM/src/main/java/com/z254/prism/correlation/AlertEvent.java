package com.z254.prism.correlation;

/**
 * An alert as seen by the analytics engines.
 *
 * @param id         alert id
 * @param deviceId   monitored object the alert was raised on, may be {@code null}
 * @param deviceName display name of the monitored object, may be {@code null}
 * @param datasource datasource (resource template) that raised the alert, may be {@code null}
 * @param datapoint  datapoint that crossed its threshold, may be {@code null}
 * @param startEpoch epoch the alert started, as reported by the API
 * @param endEpoch   epoch the alert cleared; 0 while it is still active
 * @param severity   numeric severity; 4 and above is critical
 */
public record AlertEvent(String id,
                         Long deviceId,
                         String deviceName,
                         String datasource,
                         String datapoint,
                         long startEpoch,
                         long endEpoch,
                         int severity) {

    public AlertEvent(String id, Long deviceId, long startEpoch, int severity) {
        this(id, deviceId, null, null, null, startEpoch, 0L, severity);
    }

    public boolean isCleared() {
        return endEpoch > 0;
    }
}
