package com.z254.prism.topology;

/**
 * A neighbor returned by the topology source. Nodes without an id are ignored during traversal.
 */
public record GraphNode(Long id, String displayName) {
}
