package io.brainrunr.graph;

import io.brainrunr.memory.MemoryRecord;

/**
 * A memory surfaced by divergent recall.
 *
 * @param record     the memory
 * @param activation activation summed over every path that reached it
 * @param seedId     seed at the start of the strongest contributing path
 * @param hops       length of that path
 */
public record RecallResult(MemoryRecord record, double activation, String seedId, int hops) {
}
