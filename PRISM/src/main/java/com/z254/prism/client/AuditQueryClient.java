package com.z254.prism.client;

import com.z254.prism.correlation.ChangeEvent;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client for the configuration-change audit log.
 */
public interface AuditQueryClient {

    /**
     * Change events that happened at or after {@code startEpoch}, newest first.
     */
    Mono<List<ChangeEvent>> fetchChangesSince(long startEpoch, int size);
}
