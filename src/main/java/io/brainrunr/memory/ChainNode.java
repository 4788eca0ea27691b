package io.brainrunr.memory;

/**
 * One step of a causal chain.
 *
 * @param record   the memory reached
 * @param linkType type of the link used to reach it, null for the start node
 * @param depth    hops from the start node
 */
public record ChainNode(MemoryRecord record, String linkType, int depth) {
}
