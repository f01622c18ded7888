package com.z254.prism.metrics;

/**
 * Optional replacements for the parts of a stored {@link ResourceIdentity}.
 * A {@code null} field keeps the stored value.
 */
public record ResourceOverrides(Long deviceId, Long deviceDatasourceId, Long instanceId) {

    public static ResourceOverrides none() {
        return new ResourceOverrides(null, null, null);
    }

    public ResourceIdentity applyTo(ResourceIdentity stored) {
        return new ResourceIdentity(
                deviceId != null ? deviceId : stored.deviceId(),
                deviceDatasourceId != null ? deviceDatasourceId : stored.deviceDatasourceId(),
                instanceId != null ? instanceId : stored.instanceId());
    }
}
