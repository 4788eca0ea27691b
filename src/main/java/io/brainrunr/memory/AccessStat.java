package io.brainrunr.memory;

import java.time.Instant;

/**
 * Access statistics of one memory, sampled by the working set.
 */
public record AccessStat(String id, int accessCount, Instant lastAccessed, Instant createdAt) {

    public Instant lastTouched() {
        return lastAccessed != null ? lastAccessed : createdAt;
    }
}
