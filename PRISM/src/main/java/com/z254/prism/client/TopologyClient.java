package com.z254.prism.client;

import com.z254.prism.topology.GraphNode;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client for device connectivity.
 * <p>
 * Two sources exist: the topology graph, and the per-device neighbor list which is
 * used when the topology graph is unavailable.
 */
public interface TopologyClient {

    Mono<List<GraphNode>> getTopologyNeighbors(long deviceId);

    Mono<List<GraphNode>> getDeviceNeighbors(long deviceId);
}
