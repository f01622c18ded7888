package com.z254.prism.metrics;

/**
 * Identifies one monitored instance: a device, one of its datasources, and an instance of it.
 */
public record ResourceIdentity(long deviceId, long deviceDatasourceId, long instanceId) {

    /**
     * Compact {@code device/datasource/instance} form used in logs and MDC.
     */
    public String key() {
        return deviceId + "/" + deviceDatasourceId + "/" + instanceId;
    }
}
