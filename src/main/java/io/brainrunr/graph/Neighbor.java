package io.brainrunr.graph;

/**
 * An adjacent memory in the association graph and the strength of the shared edge.
 */
public record Neighbor(String id, double strength) {
}
