package io.brainrunr.memory;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate statistics over stored memories.
 */
public record MemoryStats(
        int totalCount,
        Map<MemoryCategory, Integer> byCategory,
        Map<Emotion, Integer> byEmotion,
        Instant oldest,
        Instant newest
) {
}
