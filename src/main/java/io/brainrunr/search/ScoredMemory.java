package io.brainrunr.search;

import io.brainrunr.memory.MemoryRecord;

import java.util.Comparator;

/**
 * A memory with its retrieval score and the two normalized components behind it.
 *
 * @param record     the memory
 * @param score      combined score used for ordering
 * @param similarity normalized embedding score in [0, 1]
 * @param lexical    normalized bigram score in [0, 1]
 */
public record ScoredMemory(MemoryRecord record, double score, double similarity, double lexical) {

    /** Score descending, then importance, then newer first, then id. */
    public static final Comparator<ScoredMemory> ORDER = Comparator
            .comparingDouble(ScoredMemory::score).reversed()
            .thenComparing(s -> s.record().importance(), Comparator.reverseOrder())
            .thenComparing(s -> s.record().createdAt(), Comparator.reverseOrder())
            .thenComparing(s -> s.record().id());

    public String id() {
        return record.id();
    }
}
