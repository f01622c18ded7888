package com.z254.prism.client;

import com.z254.prism.metrics.RawMetricData;
import com.z254.prism.metrics.ResourceIdentity;
import reactor.core.publisher.Mono;

/**
 * Client for instance time-series data.
 */
public interface MetricQueryClient {

    /**
     * Fetch raw samples of an instance between two epoch-second bounds.
     *
     * @param resource        the monitored instance
     * @param datapointFilter comma-separated datapoint names, or {@code null} for all
     * @param startEpoch      window start (seconds)
     * @param endEpoch        window end (seconds)
     * @return raw rows; errors with {@link com.z254.prism.exception.CollaboratorException} on failure
     */
    Mono<RawMetricData> fetch(ResourceIdentity resource, String datapointFilter, long startEpoch, long endEpoch);
}
