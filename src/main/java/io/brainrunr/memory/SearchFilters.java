package io.brainrunr.memory;

import java.time.Instant;

/**
 * Optional pre-filters applied to the candidate set before ranking. Null fields do not filter.
 */
public record SearchFilters(MemoryCategory category, Emotion emotion, Instant createdFrom, Instant createdTo) {

    private static final SearchFilters NONE = new SearchFilters(null, null, null, null);

    public static SearchFilters none() {
        return NONE;
    }

    public static SearchFilters category(MemoryCategory category) {
        return new SearchFilters(category, null, null, null);
    }

    public boolean matches(MemoryRecord record) {
        if (category != null && record.category() != category) return false;
        if (emotion != null && record.emotion() != emotion) return false;
        if (createdFrom != null && record.createdAt().isBefore(createdFrom)) return false;
        return createdTo == null || !record.createdAt().isAfter(createdTo);
    }
}
