package com.z254.prism.client;

import com.z254.prism.correlation.AlertEvent;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client for alert queries.
 */
public interface AlertQueryClient {

    /**
     * Alerts that started at or after {@code startEpoch}.
     */
    Mono<List<AlertEvent>> fetchAlertsSince(long startEpoch, int size);

    /**
     * Alerts that started at or after {@code startEpoch}, optionally narrowed to devices whose
     * name contains {@code deviceName} and to one device group. Null filters are ignored.
     */
    Mono<List<AlertEvent>> fetchAlertsSince(long startEpoch, String deviceName, Long groupId, int size);

    /**
     * Uncleared alerts raised on a device.
     */
    Mono<List<AlertEvent>> fetchActiveAlerts(long deviceId, int size);
}
