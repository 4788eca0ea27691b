package io.brainrunr.memory;

import io.brainrunr.search.ScoredMemory;

import java.util.List;

/**
 * Context recall extended along causal and similarity links.
 *
 * @param primary the recalled memories, best first
 * @param linked  memories linked to any primary memory, not themselves primary, in discovery order
 */
public record AssociatedRecall(List<ScoredMemory> primary, List<MemoryRecord> linked) {
}
